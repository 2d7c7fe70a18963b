package com.fintech.bookingpayments.service.state;

import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.fintech.bookingpayments.entity.PaymentRequestStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class PaymentRequestStateMachineTest {

    @Test
    @DisplayName("Pending requests can be sent or cancelled")
    void pendingEdges() {
        assertThat(PaymentRequestStateMachine.allowedTargets(PENDING)).containsExactlyInAnyOrder(SENT, CANCELLED);
        assertThat(PaymentRequestStateMachine.isAllowed(PENDING, PAID)).isFalse();
        assertThat(PaymentRequestStateMachine.isAllowed(PENDING, EXPIRED)).isFalse();
    }

    @Test
    @DisplayName("Sent requests can be paid, cancelled or expired")
    void sentEdges() {
        assertThat(PaymentRequestStateMachine.allowedTargets(SENT)).containsExactlyInAnyOrder(PAID, CANCELLED, EXPIRED);
        assertThat(PaymentRequestStateMachine.isAllowed(SENT, PENDING)).isFalse();
        assertThat(PaymentRequestStateMachine.isAllowed(SENT, SENT)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = PaymentRequestStatus.class, names = {"PAID", "CANCELLED", "EXPIRED"})
    @DisplayName("Terminal statuses have no outgoing transition")
    void terminalStatusesAreFinal(PaymentRequestStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (PaymentRequestStatus target : PaymentRequestStatus.values()) {
            assertThat(PaymentRequestStateMachine.isAllowed(terminal, target)).isFalse();
        }
    }

    @Test
    void nullStatusIsNeverAllowed() {
        assertThat(PaymentRequestStateMachine.isAllowed(null, PAID)).isFalse();
        assertThat(PaymentRequestStateMachine.isAllowed(SENT, null)).isFalse();
    }
}
