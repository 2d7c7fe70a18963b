package com.fintech.bookingpayments.exception;

public class ResourceNotFoundException extends PaymentReconciliationException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " " + id + " not found");
    }
}
