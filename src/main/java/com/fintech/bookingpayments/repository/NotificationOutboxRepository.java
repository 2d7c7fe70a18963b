package com.fintech.bookingpayments.repository;

import com.fintech.bookingpayments.entity.NotificationOutbox;
import com.fintech.bookingpayments.entity.NotificationStatus;
import com.fintech.bookingpayments.entity.PaymentRequestFact;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface NotificationOutboxRepository extends JpaRepository<NotificationOutbox, String> {

    /**
     * Locks the next batch due for delivery. Lock timeout -2 asks Hibernate for
     * {@code SKIP LOCKED} where the dialect supports it, so dispatchers on several instances
     * never pick the same row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("SELECT n FROM NotificationOutbox n WHERE n.status IN :statuses " +
            "AND (n.nextAttemptAt IS NULL OR n.nextAttemptAt <= :now) ORDER BY n.createdAt ASC")
    List<NotificationOutbox> lockNextBatch(
            @Param("statuses") Collection<NotificationStatus> statuses,
            @Param("now") LocalDateTime now,
            Pageable pageable
    );

    List<NotificationOutbox> findByPaymentRequestId(Long paymentRequestId);

    long countByPaymentRequestIdAndFact(Long paymentRequestId, PaymentRequestFact fact);
}
