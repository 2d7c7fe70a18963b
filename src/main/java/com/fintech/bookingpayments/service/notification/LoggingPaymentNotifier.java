package com.fintech.bookingpayments.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default notifier: writes the message to the log instead of sending it.
 */
@Component
@Slf4j
public class LoggingPaymentNotifier implements PaymentNotifier {

    @Override
    public void send(PaymentNotification notification) {
        switch (notification.getFact()) {
            case PAYMENT_COMPLETED -> log.info("Notify {}: payment of {} {} received{}",
                    notification.getCustomerName(), notification.getAmount(), notification.getCurrency(),
                    forService(notification));
            case REQUEST_CLOSED -> log.info("Notify {}: payment request {} is {}{}",
                    notification.getCustomerName(), notification.getPaymentRequestId(),
                    notification.getRequestStatus().name().toLowerCase(), forService(notification));
        }
    }

    private static String forService(PaymentNotification notification) {
        return notification.getServiceName() == null ? "" : " for " + notification.getServiceName();
    }
}
