package com.fintech.bookingpayments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Booking Payments Service
 * <p>
 * Owns the lifecycle of payment requests raised against bookings and keeps it consistent
 * with an external payment processor that reports outcomes through at-least-once webhooks.
 * <p>
 * Key Features:
 * - Signed, deduplicated webhook ingestion
 * - Scheduled reconciliation of stale requests against the processor's checkout API
 * - Compare-and-set status transitions shared by every write path
 * - Outbox-backed customer notifications
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@EnableRetry
public class BookingPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingPaymentsApplication.class, args);
    }
}
