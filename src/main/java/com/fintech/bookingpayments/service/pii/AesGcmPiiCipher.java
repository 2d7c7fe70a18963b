package com.fintech.bookingpayments.service.pii;

import com.fintech.bookingpayments.config.PaymentProperties;
import com.fintech.bookingpayments.exception.PiiCipherException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-GCM cipher. Output is Base64 of {@code iv(12) || ciphertext+tag}.
 */
@Component
@Slf4j
public class AesGcmPiiCipher implements PiiCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public AesGcmPiiCipher(PaymentProperties properties) {
        String encodedKey = properties.getPii().getKey();
        if (!StringUtils.hasText(encodedKey)) {
            log.warn("No PII key configured, customer names will not be decrypted");
            this.key = null;
        } else {
            this.key = new SecretKeySpec(Base64.getDecoder().decode(encodedKey), "AES");
        }
    }

    @Override
    public String encrypt(String plaintext) {
        SecretKey secretKey = requireKey();
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_BITS, iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(ByteBuffer.allocate(iv.length + encrypted.length)
                    .put(iv)
                    .put(encrypted)
                    .array());
        } catch (GeneralSecurityException e) {
            throw new PiiCipherException("Encryption failed", e);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        SecretKey secretKey = requireKey();
        try {
            byte[] raw = Base64.getDecoder().decode(ciphertext);
            if (raw.length <= IV_LENGTH) {
                throw new PiiCipherException("Ciphertext too short");
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_BITS, raw, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(raw, IV_LENGTH, raw.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new PiiCipherException("Decryption failed", e);
        }
    }

    private SecretKey requireKey() {
        if (key == null) {
            throw new PiiCipherException("PII key not configured");
        }
        return key;
    }
}
