package com.fintech.bookingpayments.repository;

import com.fintech.bookingpayments.entity.Booking;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Locks the booking row so payment request creation for one booking is serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    /**
     * Candidate bookings for legacy payment matching.
     */
    List<Booking> findByCustomerIdAndCreatedAtBetween(Long customerId, LocalDateTime from, LocalDateTime to);

    /**
     * Marks the booking paid. Returns 0 when it already was.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.paymentStatus = com.fintech.bookingpayments.entity.BookingPaymentStatus.PAID " +
            "WHERE b.id = :id AND b.paymentStatus <> com.fintech.bookingpayments.entity.BookingPaymentStatus.PAID")
    int markPaid(@Param("id") Long id);
}
