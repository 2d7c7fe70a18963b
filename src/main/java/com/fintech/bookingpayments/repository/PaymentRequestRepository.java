package com.fintech.bookingpayments.repository;

import com.fintech.bookingpayments.entity.PaymentRequest;
import com.fintech.bookingpayments.entity.PaymentRequestStatus;
import com.fintech.bookingpayments.entity.TransitionSource;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for payment requests.
 * <p>
 * Every status change goes through {@link #compareAndSetStatus}. The bookkeeping updates below never
 * touch {@code status}, {@code version} or {@code updatedAt}, so they cannot race with a transition.
 */
@Repository
public interface PaymentRequestRepository extends JpaRepository<PaymentRequest, Long> {

    Optional<PaymentRequest> findByCheckoutId(String checkoutId);

    List<PaymentRequest> findByBookingIdAndStatusIn(Long bookingId, Collection<PaymentRequestStatus> statuses);

    long countByStatus(PaymentRequestStatus status);

    /**
     * Atomic status transition. The row is only written when its stored status still equals
     * {@code expected}; the returned row count (0 or 1) tells the caller whether it won.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRequest p SET p.status = :target, p.updatedAt = :now, p.version = p.version + 1, " +
            "p.lastTransitionSource = :source, p.lastTransitionReference = :reference, " +
            "p.checkoutId = :checkoutId, p.sentAt = :sentAt, p.paidAt = :paidAt, p.closedAt = :closedAt, " +
            "p.cancellationReason = :cancellationReason " +
            "WHERE p.id = :id AND p.status = :expected")
    int compareAndSetStatus(
            @Param("id") Long id,
            @Param("expected") PaymentRequestStatus expected,
            @Param("target") PaymentRequestStatus target,
            @Param("now") LocalDateTime now,
            @Param("source") TransitionSource source,
            @Param("reference") String reference,
            @Param("checkoutId") String checkoutId,
            @Param("sentAt") LocalDateTime sentAt,
            @Param("paidAt") LocalDateTime paidAt,
            @Param("closedAt") LocalDateTime closedAt,
            @Param("cancellationReason") String cancellationReason
    );

    /**
     * Sent requests whose last status change is older than {@code updatedBefore} and that have not
     * exhausted their lookup failures. Keyset paginated on id so rows leaving the set mid-run
     * do not shift later pages.
     */
    @Query("SELECT p FROM PaymentRequest p WHERE p.status = :status " +
            "AND p.updatedAt < :updatedBefore " +
            "AND p.reconciliationFailures < :maxFailures " +
            "AND p.id > :afterId " +
            "ORDER BY p.id ASC")
    List<PaymentRequest> findStaleForReconciliation(
            @Param("status") PaymentRequestStatus status,
            @Param("updatedBefore") LocalDateTime updatedBefore,
            @Param("maxFailures") int maxFailures,
            @Param("afterId") long afterId,
            Pageable pageable
    );

    @Query("SELECT p FROM PaymentRequest p WHERE p.status = :status " +
            "AND p.reconciliationFailures >= :minFailures ORDER BY p.id ASC")
    List<PaymentRequest> findNeedingManualReview(
            @Param("status") PaymentRequestStatus status,
            @Param("minFailures") int minFailures
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRequest p SET p.webhookFailures = p.webhookFailures + 1, p.lastWebhookAt = :now " +
            "WHERE p.id = :id")
    int recordWebhookFailure(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRequest p SET p.lastWebhookAt = :now WHERE p.id = :id")
    int touchLastWebhook(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRequest p SET p.reconciliationAttempts = p.reconciliationAttempts + 1, " +
            "p.reconciliationFailures = 0, p.lastReconciledAt = :now, p.lastReconciliationError = null " +
            "WHERE p.id = :id")
    int recordReconciliationSuccess(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRequest p SET p.reconciliationAttempts = p.reconciliationAttempts + 1, " +
            "p.reconciliationFailures = p.reconciliationFailures + 1, p.lastReconciledAt = :now, " +
            "p.lastReconciliationError = :error WHERE p.id = :id")
    int recordReconciliationFailure(@Param("id") Long id, @Param("now") LocalDateTime now,
                                    @Param("error") String error);

    /**
     * A timed out or transiently failing lookup is "no information": it is noted but counts neither as
     * an attempt nor a failure.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRequest p SET p.lastReconciledAt = :now, p.lastReconciliationError = :error " +
            "WHERE p.id = :id")
    int recordTransientReconciliationError(@Param("id") Long id, @Param("now") LocalDateTime now,
                                           @Param("error") String error);

    /**
     * Puts a request parked for manual review back into the poller's scope.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRequest p SET p.reconciliationFailures = 0, p.lastReconciliationError = null " +
            "WHERE p.id = :id AND p.reconciliationFailures > 0")
    int resetReconciliationFailures(@Param("id") Long id);

    /**
     * Links a booking only when none is set yet.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentRequest p SET p.bookingId = :bookingId WHERE p.id = :id AND p.bookingId IS NULL")
    int assignBookingIfAbsent(@Param("id") Long id, @Param("bookingId") Long bookingId);
}
