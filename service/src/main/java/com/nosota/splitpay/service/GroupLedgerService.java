package com.nosota.splitpay.service;

import com.nosota.splitpay.api.model.PaymentStatus;
import com.nosota.splitpay.dto.GroupSnapshot;
import com.nosota.splitpay.error.GroupAlreadyExistsException;
import com.nosota.splitpay.error.GroupNotFoundException;
import com.nosota.splitpay.error.InvalidBudgetException;
import com.nosota.splitpay.error.NotGroupMemberException;
import com.nosota.splitpay.error.ShareTooSmallException;
import com.nosota.splitpay.error.UserNotFoundException;
import com.nosota.splitpay.model.ExpenseGroup;
import com.nosota.splitpay.model.MemberPayment;
import com.nosota.splitpay.model.UserAccount;
import com.nosota.splitpay.repository.ExpenseGroupRepository;
import com.nosota.splitpay.repository.MemberPaymentRepository;
import com.nosota.splitpay.repository.UserAccountRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Owns expense groups, their membership and the per-member split.
 *
 * <p>Invariants kept by this service:
 * <ul>
 *   <li>Every member has exactly one {@link MemberPayment} in the group</li>
 *   <li>{@code splitAmount == budget / max(1, members)} after every membership change</li>
 * </ul>
 *
 * <p>Membership changes lock the group row ({@link ExpenseGroupRepository#findByNameForUpdate}),
 * so concurrent additions to one group cannot interleave the member count read with the split write.
 *
 * <p>A split change does not revisit payments already approved against the previous split.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class GroupLedgerService {

    private final ExpenseGroupRepository groupRepository;
    private final MemberPaymentRepository paymentRepository;
    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    /**
     * Creates a group administered by {@code adminUsername}.
     *
     * @param name                  Unique group name
     * @param adminUsername         Creator, fixed as the group admin
     * @param budget                Positive amount to split
     * @param includeAdminAsMember  Whether the admin also pays a share
     * @return Snapshot of the new group
     * @throws InvalidBudgetException      if the budget rounds to less than 0.01
     * @throws GroupAlreadyExistsException if the name is taken
     */
    @Transactional
    public GroupSnapshot createGroup(
            @NotBlank String name,
            @NotBlank String adminUsername,
            @NotNull BigDecimal budget,
            boolean includeAdminAsMember) {

        BigDecimal normalizedBudget = SplitCalculator.normalize(budget);
        if (normalizedBudget.signum() <= 0) {
            throw new InvalidBudgetException("Budget must be at least 0.01, got " + budget.toPlainString());
        }
        if (groupRepository.existsById(name)) {
            throw new GroupAlreadyExistsException("Group already exists: " + name);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        int memberCount = includeAdminAsMember ? 1 : 0;

        ExpenseGroup group = new ExpenseGroup();
        group.setName(name);
        group.setAdmin(adminUsername);
        group.setBudget(normalizedBudget);
        group.setSplitAmount(SplitCalculator.split(normalizedBudget, memberCount));
        group.setCreatedAt(now);

        try {
            group = groupRepository.saveAndFlush(group);
        } catch (DataIntegrityViolationException e) {
            throw new GroupAlreadyExistsException("Group already exists: " + name);
        }

        if (includeAdminAsMember) {
            UserAccount admin = userAccountRepository.findById(adminUsername)
                    .orElseThrow(() -> new UserNotFoundException("User not found: " + adminUsername));
            enroll(admin, name, now);
        }

        log.info("Group created: name={}, admin={}, budget={}, split={}, adminIsMember={}",
                name, adminUsername, group.getBudget(), group.getSplitAmount(), includeAdminAsMember);

        return snapshotOf(group);
    }

    /**
     * Adds a registered user to a group and recomputes the split for every member.
     * Adding an existing member changes nothing.
     *
     * <p>Existing payment records keep their amount and status.
     *
     * @return Snapshot after the change
     * @throws UserNotFoundException  if the user is not registered
     * @throws GroupNotFoundException if the group does not exist
     * @throws ShareTooSmallException if the new split would round to 0.00; nothing is stored
     */
    @Transactional
    public GroupSnapshot addMember(@NotBlank String groupName, @NotBlank String username) {
        UserAccount user = userAccountRepository.findById(username)
                .orElseThrow(() -> new UserNotFoundException("User not found: " + username));
        ExpenseGroup group = groupRepository.findByNameForUpdate(groupName)
                .orElseThrow(() -> new GroupNotFoundException("Group not found: " + groupName));

        if (paymentRepository.existsByGroupNameAndUsername(groupName, username)) {
            log.debug("User {} is already a member of group {}", username, groupName);
            return snapshotOf(group);
        }

        long memberCount = paymentRepository.countByGroupName(groupName) + 1;
        BigDecimal splitAmount = SplitCalculator.split(group.getBudget(), memberCount);
        if (splitAmount.signum() <= 0) {
            throw new ShareTooSmallException(String.format(
                    "Budget %s cannot be split across %d members",
                    group.getBudget().toPlainString(), memberCount));
        }

        enroll(user, groupName, LocalDateTime.now(clock));
        group.setSplitAmount(splitAmount);
        group = groupRepository.save(group);

        log.info("Member added: group={}, username={}, members={}, split={}",
                groupName, username, memberCount, group.getSplitAmount());

        return snapshotOf(group);
    }

    /**
     * Returns the full group snapshot. Members can see each other's payments.
     *
     * @throws GroupNotFoundException  if the group does not exist
     * @throws NotGroupMemberException if the requester is not a member
     */
    @Transactional
    public GroupSnapshot getStatus(@NotBlank String groupName, @NotBlank String requester) {
        ExpenseGroup group = groupRepository.findById(groupName)
                .orElseThrow(() -> new GroupNotFoundException("Group not found: " + groupName));

        if (!paymentRepository.existsByGroupNameAndUsername(groupName, requester)) {
            throw new NotGroupMemberException("You are not part of this group");
        }

        log.debug("Group status read: group={}, requester={}", groupName, requester);
        return snapshotOf(group);
    }

    /**
     * Returns every group, sorted by name.
     */
    @Transactional
    public List<GroupSnapshot> listGroups() {
        Map<String, List<MemberPayment>> paymentsByGroup = paymentRepository.findAll().stream()
                .sorted((a, b) -> a.getUsername().compareTo(b.getUsername()))
                .collect(Collectors.groupingBy(MemberPayment::getGroupName));

        return groupRepository.findAllByOrderByNameAsc().stream()
                .map(group -> new GroupSnapshot(group,
                        paymentsByGroup.getOrDefault(group.getName(), List.of())))
                .toList();
    }

    private void enroll(UserAccount user, String groupName, LocalDateTime now) {
        MemberPayment payment = new MemberPayment();
        payment.setGroupName(groupName);
        payment.setUsername(user.getUsername());
        payment.setPaidAmount(SplitCalculator.normalize(BigDecimal.ZERO));
        payment.setStatus(PaymentStatus.UNPAID);
        payment.setCreatedAt(now);
        payment.setUpdatedAt(now);
        paymentRepository.save(payment);

        user.getGroups().add(groupName);
        userAccountRepository.save(user);
    }

    private GroupSnapshot snapshotOf(ExpenseGroup group) {
        return new GroupSnapshot(group, paymentRepository.findByGroupNameOrderByUsernameAsc(group.getName()));
    }
}
