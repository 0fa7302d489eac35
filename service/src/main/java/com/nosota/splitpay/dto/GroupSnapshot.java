package com.nosota.splitpay.dto;

import com.nosota.splitpay.model.ExpenseGroup;
import com.nosota.splitpay.model.MemberPayment;

import java.util.List;

/**
 * Consistent view of a group and all of its payment records, read in one transaction.
 *
 * @param group    The group
 * @param payments One record per member, sorted by username
 */
public record GroupSnapshot(
        ExpenseGroup group,
        List<MemberPayment> payments
) {
    public List<String> members() {
        return payments.stream()
                .map(MemberPayment::getUsername)
                .toList();
    }
}
