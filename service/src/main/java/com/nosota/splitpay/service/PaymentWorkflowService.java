package com.nosota.splitpay.service;

import com.nosota.splitpay.api.model.PaymentAction;
import com.nosota.splitpay.api.model.PaymentStatus;
import com.nosota.splitpay.error.ExceedsShareException;
import com.nosota.splitpay.error.GroupNotFoundException;
import com.nosota.splitpay.error.InvalidPaymentActionException;
import com.nosota.splitpay.error.NotGroupAdminException;
import com.nosota.splitpay.error.NotGroupMemberException;
import com.nosota.splitpay.error.PaymentNotFoundException;
import com.nosota.splitpay.error.ShortPaymentException;
import com.nosota.splitpay.error.ValidationException;
import com.nosota.splitpay.model.ExpenseGroup;
import com.nosota.splitpay.model.MemberPayment;
import com.nosota.splitpay.repository.ExpenseGroupRepository;
import com.nosota.splitpay.repository.MemberPaymentRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Submit/approve workflow for member payments.
 *
 * <p>Workflow:
 * <pre>
 * 1. Member submits an amount up to the current split → PENDING_APPROVAL
 * 2. Group admin approves (amount must equal the split exactly) → APPROVED
 *    or denies → DENIED
 * 3. After a deny the member may submit again
 * </pre>
 *
 * <p>Both operations lock the group row, so they are serialized with membership changes
 * and always see the current split.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentWorkflowService {

    private final ExpenseGroupRepository groupRepository;
    private final MemberPaymentRepository paymentRepository;
    private final PaymentStatusStateMachine stateMachine;
    private final Clock clock;

    /**
     * Records the amount a member reports as paid and marks it pending approval.
     * A second submission before the decision overwrites the first.
     *
     * @param groupName Group name
     * @param member    Submitting member (token subject)
     * @param amount    Positive amount, at most the current split
     * @return The updated payment record
     * @throws NotGroupMemberException if the group does not exist or the caller is not a member
     * @throws ExceedsShareException   if the amount is larger than the split; nothing is stored
     * @throws IllegalStateException   if the payment is already approved
     */
    @Transactional
    public MemberPayment submitPayment(
            @NotBlank String groupName,
            @NotBlank String member,
            @NotNull BigDecimal amount) {

        // an unknown group answers like any group the caller is not in
        ExpenseGroup group = groupRepository.findByNameForUpdate(groupName)
                .orElseThrow(() -> new NotGroupMemberException("Not part of this group"));
        MemberPayment payment = paymentRepository.findByGroupNameAndUsername(groupName, member)
                .orElseThrow(() -> new NotGroupMemberException("Not part of this group"));

        if (amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive, got " + amount.toPlainString());
        }
        if (amount.compareTo(group.getSplitAmount()) > 0) {
            throw new ExceedsShareException(String.format(
                    "Exceeds threshold amount: submitted %s, split is %s",
                    amount.toPlainString(), group.getSplitAmount().toPlainString()));
        }
        stateMachine.validateTransition(payment.getStatus(), PaymentStatus.PENDING_APPROVAL);

        payment.setPaidAmount(SplitCalculator.normalize(amount));
        payment.setStatus(PaymentStatus.PENDING_APPROVAL);
        payment.setUpdatedAt(LocalDateTime.now(clock));
        payment = paymentRepository.save(payment);

        log.info("Payment submitted: group={}, member={}, amount={}, split={}",
                groupName, member, payment.getPaidAmount(), group.getSplitAmount());
        return payment;
    }

    /**
     * Parses the wire action and decides the payment.
     *
     * @throws InvalidPaymentActionException if the action is neither "approve" nor "deny"
     */
    @Transactional
    public MemberPayment decidePayment(
            @NotBlank String groupName,
            @NotBlank String adminUsername,
            @NotBlank String targetMember,
            @NotBlank String action) {

        PaymentAction paymentAction = PaymentAction.fromValue(action)
                .orElseThrow(() -> new InvalidPaymentActionException(
                        "Unknown action '" + action + "', expected 'approve' or 'deny'"));
        return decidePayment(groupName, adminUsername, targetMember, paymentAction);
    }

    /**
     * Approves or denies a member's payment.
     *
     * <ul>
     *   <li>APPROVE: only when the reported amount equals the current split exactly;
     *       approving an approved payment again changes nothing</li>
     *   <li>DENY: always, from any state</li>
     * </ul>
     *
     * @return The updated payment record
     * @throws GroupNotFoundException   if the group does not exist
     * @throws NotGroupAdminException   if the caller is not the group admin
     * @throws PaymentNotFoundException if the target has no payment in the group
     * @throws ShortPaymentException    if approving an amount different from the split
     * @throws IllegalStateException    if approving a payment that is not pending
     */
    @Transactional
    public MemberPayment decidePayment(
            @NotBlank String groupName,
            @NotBlank String adminUsername,
            @NotBlank String targetMember,
            @NotNull PaymentAction action) {

        ExpenseGroup group = groupRepository.findByNameForUpdate(groupName)
                .orElseThrow(() -> new GroupNotFoundException("Group not found: " + groupName));

        if (!group.getAdmin().equals(adminUsername)) {
            throw new NotGroupAdminException("Only admin can approve payments");
        }

        MemberPayment payment = paymentRepository.findByGroupNameAndUsername(groupName, targetMember)
                .orElseThrow(() -> new PaymentNotFoundException("User not in this group: " + targetMember));

        PaymentStatus targetStatus = PaymentStatus.DENIED;
        if (action == PaymentAction.APPROVE) {
            if (payment.getPaidAmount().compareTo(group.getSplitAmount()) != 0) {
                throw new ShortPaymentException(String.format(
                        "Paid amount %s does not match split %s",
                        payment.getPaidAmount().toPlainString(), group.getSplitAmount().toPlainString()));
            }
            targetStatus = PaymentStatus.APPROVED;
        }

        PaymentStatus previousStatus = payment.getStatus();
        stateMachine.validateTransition(previousStatus, targetStatus);

        if (previousStatus != targetStatus) {
            payment.setStatus(targetStatus);
            payment.setUpdatedAt(LocalDateTime.now(clock));
            payment = paymentRepository.save(payment);
        }

        log.info("Payment decided: group={}, member={}, action={}, status {} → {}",
                groupName, targetMember, action, previousStatus, targetStatus);
        return payment;
    }
}
