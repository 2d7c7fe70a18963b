package com.fintech.bookingpayments.scheduler;

import com.fintech.bookingpayments.service.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatchScheduler {

    private final NotificationDispatcher notificationDispatcher;

    @Value("${notification.dispatcher.enabled:true}")
    private boolean dispatcherEnabled;

    @Scheduled(fixedDelayString = "${notification.dispatcher.interval-ms:5000}")
    public void dispatchNotifications() {
        if (!dispatcherEnabled) {
            return;
        }
        try {
            notificationDispatcher.dispatchBatch();
        } catch (Exception e) {
            log.error("Notification dispatch failed with unexpected error", e);
        }
    }
}
