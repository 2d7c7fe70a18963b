package com.fintech.bookingpayments.repository;

import com.fintech.bookingpayments.entity.EventOutcome;
import com.fintech.bookingpayments.entity.WebhookEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, Long> {

    Optional<WebhookEvent> findByEventId(String eventId);

    List<WebhookEvent> findByCheckoutIdOrderByReceivedAtAsc(String checkoutId);

    long countByOutcome(EventOutcome outcome);
}
