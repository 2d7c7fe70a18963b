package com.fintech.bookingpayments.service.linkage;

import com.fintech.bookingpayments.config.PaymentProperties;
import com.fintech.bookingpayments.entity.Booking;
import com.fintech.bookingpayments.entity.Payment;
import com.fintech.bookingpayments.exception.LinkageAmbiguousException;
import com.fintech.bookingpayments.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Best-effort booking match for payments recorded before bookings were carried explicitly.
 * <p>
 * A booking qualifies when it belongs to the payment's customer, was created within the configured
 * window around the payment, and its service name appears in the payment notes. The closest
 * qualifying booking by creation time wins.
 */
@Component
@RequiredArgsConstructor
public class LegacyBookingMatcher {

    private final BookingRepository bookingRepository;
    private final PaymentProperties properties;

    /**
     * @return the single closest booking, or empty when none qualifies
     * @throws LinkageAmbiguousException when two or more qualifying bookings are equally close
     */
    public Optional<Booking> match(Payment payment) {
        if (payment.getCustomerId() == null || payment.getCreatedAt() == null) {
            return Optional.empty();
        }

        Duration window = properties.getLinkage().getLegacyWindow();
        LocalDateTime createdAt = payment.getCreatedAt();
        String notes = payment.getNotes() == null ? "" : payment.getNotes().toLowerCase(Locale.ROOT);

        List<Booking> qualifying = bookingRepository.findByCustomerIdAndCreatedAtBetween(
                        payment.getCustomerId(), createdAt.minus(window), createdAt.plus(window))
                .stream()
                .filter(b -> mentionsService(notes, b.getServiceName()))
                .sorted(Comparator.comparing(b -> distance(b, createdAt)))
                .toList();

        if (qualifying.isEmpty()) {
            return Optional.empty();
        }

        Duration best = distance(qualifying.get(0), createdAt);
        List<Booking> closest = qualifying.stream()
                .filter(b -> distance(b, createdAt).equals(best))
                .toList();
        if (closest.size() > 1) {
            throw new LinkageAmbiguousException(payment.getId(), closest.stream().map(Booking::getId).toList());
        }
        return Optional.of(closest.get(0));
    }

    private static boolean mentionsService(String lowerCaseNotes, String serviceName) {
        return serviceName != null && !serviceName.isBlank()
                && lowerCaseNotes.contains(serviceName.trim().toLowerCase(Locale.ROOT));
    }

    private static Duration distance(Booking booking, LocalDateTime createdAt) {
        return Duration.between(booking.getCreatedAt(), createdAt).abs();
    }
}
