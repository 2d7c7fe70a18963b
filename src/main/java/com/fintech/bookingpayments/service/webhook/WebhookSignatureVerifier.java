package com.fintech.bookingpayments.service.webhook;

import com.fintech.bookingpayments.config.PaymentProperties;
import com.fintech.bookingpayments.exception.WebhookAuthenticationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 over the raw request body with the shared webhook secret, hex encoded.
 * The header may carry a {@code sha256=} prefix.
 */
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final PaymentProperties properties;

    /**
     * @return true only if a secret is configured and {@code signatureHeader} matches the body
     */
    public boolean verify(String rawBody, String signatureHeader) {
        String secret = properties.getWebhook().getSecret();
        if (!StringUtils.hasText(secret) || !StringUtils.hasText(signatureHeader) || rawBody == null) {
            return false;
        }

        String provided = signatureHeader.trim().toLowerCase(Locale.ROOT);
        if (provided.startsWith(PREFIX)) {
            provided = provided.substring(PREFIX.length());
        }

        byte[] expected = hmac(secret, rawBody).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Signs {@code rawBody} the way the processor does.
     */
    public String sign(String rawBody) {
        String secret = properties.getWebhook().getSecret();
        if (!StringUtils.hasText(secret)) {
            throw new WebhookAuthenticationException("No webhook secret configured");
        }
        return hmac(secret, rawBody);
    }

    private static String hmac(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
