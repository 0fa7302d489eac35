package com.nosota.splitpay.service;

import com.nosota.splitpay.api.model.PaymentStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentStatusStateMachineTest {

    private final PaymentStatusStateMachine stateMachine = new PaymentStatusStateMachine();

    @Test
    void submitIsAllowedFromUnpaidPendingAndDenied() {
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.UNPAID, PaymentStatus.PENDING_APPROVAL)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.PENDING_APPROVAL, PaymentStatus.PENDING_APPROVAL)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.DENIED, PaymentStatus.PENDING_APPROVAL)).isTrue();
    }

    @Test
    void approvedCannotBeResubmitted() {
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.APPROVED, PaymentStatus.PENDING_APPROVAL)).isFalse();
        assertThatThrownBy(() -> stateMachine.validateTransition(PaymentStatus.APPROVED, PaymentStatus.PENDING_APPROVAL))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("APPROVED");
    }

    @Test
    void approvalRequiresPendingPayment() {
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.PENDING_APPROVAL, PaymentStatus.APPROVED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.UNPAID, PaymentStatus.APPROVED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.DENIED, PaymentStatus.APPROVED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.APPROVED, PaymentStatus.APPROVED)).isTrue();
    }

    @Test
    void denyIsAllowedFromEveryState() {
        for (PaymentStatus status : PaymentStatus.values()) {
            assertThat(stateMachine.isTransitionAllowed(status, PaymentStatus.DENIED))
                    .as("deny from %s", status)
                    .isTrue();
        }
    }

    @Test
    void nothingReturnsToUnpaid() {
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.PENDING_APPROVAL, PaymentStatus.UNPAID)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(PaymentStatus.DENIED, PaymentStatus.UNPAID)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(null, PaymentStatus.UNPAID)).isFalse();
    }
}
