package com.nosota.splitpay.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Expense group whose budget is split evenly across its members.
 *
 * <p>Membership is not stored here: the members of a group are exactly the users
 * holding a {@link MemberPayment} for it.
 *
 * <p>Example:
 * <pre>
 * Group "trip", budget 300.00:
 *   - 1 member  (admin)        split 300.00
 *   - 2 members (admin, alice) split 150.00
 *   - 0 members                split 300.00 (divisor floored at 1)
 * </pre>
 */
@Entity
@Table(name = "expense_group")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ExpenseGroup {

    @Id
    @Column(name = "name", length = 100, updatable = false, nullable = false)
    private String name;

    /**
     * Username of the creator. Only the admin may approve or deny payments.
     * Fixed at creation.
     */
    @Column(name = "admin_username", nullable = false, updatable = false, length = 64)
    private String admin;

    /**
     * Total amount to be covered by the members. Always positive.
     */
    @Column(name = "budget", nullable = false, precision = 17, scale = 2)
    private BigDecimal budget;

    /**
     * Share of each member: budget / max(1, member count), rounded to 2 decimals.
     * Recomputed under the group lock whenever membership changes.
     */
    @Column(name = "split_amount", nullable = false, precision = 17, scale = 2)
    private BigDecimal splitAmount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;
}
