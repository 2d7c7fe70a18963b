package com.fintech.bookingpayments.service.pii;

import com.fintech.bookingpayments.entity.Customer;
import com.fintech.bookingpayments.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Plaintext customer names for payment notes and notifications. The result is never persisted
 * on the customer record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomerNameResolver {

    private final CustomerRepository customerRepository;
    private final PiiCipher piiCipher;

    /**
     * Full name of the customer, or {@code Customer #<id>} when it cannot be read.
     */
    public String displayName(Long customerId) {
        Optional<Customer> customer = customerRepository.findById(customerId);
        if (customer.isEmpty()) {
            return fallback(customerId);
        }
        try {
            String name = Stream.of(customer.get().getFirstNameEncrypted(), customer.get().getLastNameEncrypted())
                    .filter(StringUtils::hasText)
                    .map(piiCipher::decrypt)
                    .filter(StringUtils::hasText)
                    .collect(Collectors.joining(" "));
            return name.isEmpty() ? fallback(customerId) : name;
        } catch (RuntimeException e) {
            log.warn("Could not decrypt name of customer {}: {}", customerId, e.getMessage());
            return fallback(customerId);
        }
    }

    private String fallback(Long customerId) {
        return "Customer #" + customerId;
    }
}
