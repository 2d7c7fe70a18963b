package com.fintech.bookingpayments.service.linkage;

import com.fintech.bookingpayments.entity.LinkConfidence;

import java.util.List;

/**
 * Booking attribution of a payment. Inferred links are tagged so reports can tell them from
 * explicit ones.
 */
public sealed interface LinkageResult permits LinkageResult.Linked, LinkageResult.Unlinked {

    record Linked(Long bookingId, LinkConfidence confidence) implements LinkageResult {
    }

    record Unlinked(UnlinkedReason reason, List<Long> candidateBookingIds) implements LinkageResult {

        public Unlinked {
            candidateBookingIds = candidateBookingIds == null ? List.of() : List.copyOf(candidateBookingIds);
        }
    }

    enum UnlinkedReason {
        /**
         * No booking of the customer within the window mentions the service.
         */
        NO_CANDIDATE,

        /**
         * Several bookings are equally close. Needs a human.
         */
        AMBIGUOUS
    }

    default boolean isLinked() {
        return this instanceof Linked;
    }
}
