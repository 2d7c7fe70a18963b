package com.fintech.bookingpayments.repository;

import com.fintech.bookingpayments.entity.LinkConfidence;
import com.fintech.bookingpayments.entity.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByCheckoutId(String checkoutId);

    long countByCheckoutId(String checkoutId);

    List<Payment> findByBookingIdIsNullOrderByIdAsc();

    /**
     * Stores an inferred booking link. Never replaces an existing booking id.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Payment p SET p.bookingId = :bookingId, p.linkConfidence = :confidence " +
            "WHERE p.id = :id AND p.bookingId IS NULL")
    int assignBookingIfAbsent(@Param("id") Long id,
                              @Param("bookingId") Long bookingId,
                              @Param("confidence") LinkConfidence confidence);
}
