package com.fintech.bookingpayments.service.state;

import com.fintech.bookingpayments.entity.EventSource;
import com.fintech.bookingpayments.entity.TransitionSource;
import lombok.Value;

/**
 * Why a transition is requested.
 */
@Value
public class TransitionEvidence {

    TransitionSource source;

    /** Event id or actor name. */
    String reference;

    /** Stored on the request when it is cancelled. */
    String reason;

    /** Stored when a request is sent. */
    String checkoutId;

    public static TransitionEvidence forEvent(EventSource eventSource, String eventId) {
        TransitionSource source = eventSource == EventSource.POLLER ? TransitionSource.POLLER : TransitionSource.WEBHOOK;
        return new TransitionEvidence(source, eventId, null, null);
    }

    public static TransitionEvidence cancellation(TransitionSource source, String actor, String reason) {
        return new TransitionEvidence(source, actor, reason, null);
    }

    public static TransitionEvidence checkoutSent(String checkoutId, String actor) {
        return new TransitionEvidence(TransitionSource.ADMIN, actor, null, checkoutId);
    }

    public static TransitionEvidence system(String reason) {
        return new TransitionEvidence(TransitionSource.SYSTEM, "system", reason, null);
    }

    public String getActor() {
        return source.name().toLowerCase() + ":" + reference;
    }
}
