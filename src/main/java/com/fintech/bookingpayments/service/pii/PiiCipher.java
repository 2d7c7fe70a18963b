package com.fintech.bookingpayments.service.pii;

/**
 * Field-level encryption of customer PII.
 */
public interface PiiCipher {

    String encrypt(String plaintext);

    String decrypt(String ciphertext);
}
