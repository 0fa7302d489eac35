package com.nosota.splitpay.model;

import com.nosota.splitpay.api.model.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment record of one member in one group.
 * <p>
 * Created with status UNPAID and amount 0.00 when the member joins the group, changed only by
 * the payment workflow, never deleted. The unique key on (group, member) guarantees one record
 * per member.
 * </p>
 */
@Entity
@Table(name = "member_payment",
        uniqueConstraints = @UniqueConstraint(name = "uk_member_payment_group_user",
                columnNames = {"group_name", "username"}),
        indexes = @Index(name = "idx_member_payment_group", columnList = "group_name"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class MemberPayment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_name", nullable = false, updatable = false, length = 100)
    private String groupName;

    @Column(name = "username", nullable = false, updatable = false, length = 64)
    private String username;

    /**
     * Amount the member reported as paid. Self-reported, not verified against a real transfer.
     */
    @Column(name = "paid_amount", nullable = false, precision = 17, scale = 2)
    private BigDecimal paidAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
