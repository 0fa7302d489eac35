package com.nosota.splitpay.api.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentActionTest {

    @Test
    void fromValueIgnoresCaseAndWhitespace() {
        assertThat(PaymentAction.fromValue("approve")).contains(PaymentAction.APPROVE);
        assertThat(PaymentAction.fromValue(" Deny ")).contains(PaymentAction.DENY);
    }

    @Test
    void fromValueRejectsUnknownActions() {
        assertThat(PaymentAction.fromValue("refund")).isEmpty();
        assertThat(PaymentAction.fromValue("")).isEmpty();
        assertThat(PaymentAction.fromValue(null)).isEmpty();
    }
}
