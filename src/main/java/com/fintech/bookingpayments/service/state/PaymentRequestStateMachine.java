package com.fintech.bookingpayments.service.state;

import com.fintech.bookingpayments.entity.PaymentRequestStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.fintech.bookingpayments.entity.PaymentRequestStatus.*;

/**
 * Legal payment request transitions:
 * <pre>
 *   PENDING -> SENT | CANCELLED
 *   SENT    -> PAID | CANCELLED | EXPIRED
 * </pre>
 * Terminal statuses have no outgoing edge.
 */
public final class PaymentRequestStateMachine {

    private static final Map<PaymentRequestStatus, Set<PaymentRequestStatus>> ALLOWED =
            new EnumMap<>(PaymentRequestStatus.class);

    static {
        ALLOWED.put(PENDING, EnumSet.of(SENT, CANCELLED));
        ALLOWED.put(SENT, EnumSet.of(PAID, CANCELLED, EXPIRED));
        ALLOWED.put(PAID, EnumSet.noneOf(PaymentRequestStatus.class));
        ALLOWED.put(CANCELLED, EnumSet.noneOf(PaymentRequestStatus.class));
        ALLOWED.put(EXPIRED, EnumSet.noneOf(PaymentRequestStatus.class));
    }

    private PaymentRequestStateMachine() {
    }

    public static boolean isAllowed(PaymentRequestStatus from, PaymentRequestStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED.get(from).contains(to);
    }

    public static Set<PaymentRequestStatus> allowedTargets(PaymentRequestStatus from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }
}
