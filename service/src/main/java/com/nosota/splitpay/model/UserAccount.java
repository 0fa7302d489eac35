package com.nosota.splitpay.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OptimisticLock;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Registered user with a salted password hash, roles and group memberships.
 * <p>
 * The username is the natural key. Users are never deleted.
 * </p>
 */
@Entity
@Table(name = "app_user")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class UserAccount {

    @Id
    @Column(name = "username", length = 64, updatable = false, nullable = false)
    private String username;

    /**
     * One-way salted hash (BCrypt). The plaintext password is never stored.
     */
    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "app_user_role", joinColumns = @JoinColumn(name = "username"))
    @Column(name = "role", nullable = false, length = 32)
    private Set<String> roles = new HashSet<>();

    /**
     * Names of the groups the user belongs to.
     * <p>
     * Excluded from optimistic locking: a user joining two groups at once only
     * inserts two independent rows.
     * </p>
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "app_user_group", joinColumns = @JoinColumn(name = "username"))
    @Column(name = "group_name", nullable = false, length = 100)
    @OptimisticLock(excluded = true)
    private Set<String> groups = new HashSet<>();

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    /**
     * Null until first persisted, which makes Spring Data insert instead of merge,
     * so a duplicate username fails on the primary key instead of overwriting.
     */
    @Version
    private Long version;
}
