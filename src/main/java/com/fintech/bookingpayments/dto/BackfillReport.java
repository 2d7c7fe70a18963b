package com.fintech.bookingpayments.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of linking legacy payments to bookings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillReport {

    @Builder.Default
    private int examined = 0;

    @Builder.Default
    private int linked = 0;

    @Builder.Default
    private int unlinked = 0;

    /**
     * Payments left unlinked because several bookings matched equally well.
     */
    @Builder.Default
    private List<Long> needsReview = new ArrayList<>();
}
