package com.fintech.bookingpayments.service.pii;

import com.fintech.bookingpayments.config.PaymentProperties;
import com.fintech.bookingpayments.exception.PiiCipherException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AesGcmPiiCipherTest {

    private static final String KEY = Base64.getEncoder().encodeToString(new byte[32]);

    private AesGcmPiiCipher cipher;

    @BeforeEach
    void setUp() {
        PaymentProperties properties = new PaymentProperties();
        properties.getPii().setKey(KEY);
        cipher = new AesGcmPiiCipher(properties);
    }

    @Test
    @DisplayName("Decrypts what it encrypted, using a fresh IV each time")
    void freshIvPerEncryption() {
        String first = cipher.encrypt("Ana Silva");
        String second = cipher.encrypt("Ana Silva");

        assertThat(first).isNotEqualTo(second);
        assertThat(cipher.decrypt(first)).isEqualTo("Ana Silva");
    }

    @Test
    @DisplayName("Tampered ciphertext fails authentication")
    void tamperedCiphertext() {
        byte[] raw = Base64.getDecoder().decode(cipher.encrypt("Ana Silva"));
        raw[raw.length - 1] ^= 0x01;

        assertThatThrownBy(() -> cipher.decrypt(Base64.getEncoder().encodeToString(raw)))
                .isInstanceOf(PiiCipherException.class)
                .hasMessage("Decryption failed");
    }

    @Test
    @DisplayName("Garbage input is rejected")
    void garbageInput() {
        assertThatThrownBy(() -> cipher.decrypt("not base64 !!"))
                .isInstanceOf(PiiCipherException.class);
        assertThatThrownBy(() -> cipher.decrypt(Base64.getEncoder().encodeToString(new byte[4])))
                .isInstanceOf(PiiCipherException.class)
                .hasMessage("Ciphertext too short");
    }

    @Test
    @DisplayName("Missing key refuses to work")
    void missingKey() {
        AesGcmPiiCipher unconfigured = new AesGcmPiiCipher(new PaymentProperties());

        assertThatThrownBy(() -> unconfigured.encrypt("Ana"))
                .isInstanceOf(PiiCipherException.class)
                .hasMessage("PII key not configured");
    }
}
