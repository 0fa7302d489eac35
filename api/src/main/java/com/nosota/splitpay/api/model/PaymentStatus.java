package com.nosota.splitpay.api.model;

/**
 * Approval state of a member's payment within a group.
 */
public enum PaymentStatus {
    /**
     * UNPAID: Initial state. Created when the member joins the group, amount is zero.
     */
    UNPAID,

    /**
     * PENDING_APPROVAL: The member has reported a payment and waits for the group admin.
     * Submitting again while pending overwrites the reported amount.
     */
    PENDING_APPROVAL,

    /**
     * APPROVED: The admin accepted the payment. The member can no longer resubmit.
     */
    APPROVED,

    /**
     * DENIED: The admin rejected the payment. The member may resubmit.
     */
    DENIED
}
