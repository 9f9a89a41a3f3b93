package io.netfield.fieldops.envelope;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EnvelopeRepository extends JpaRepository<Envelope, UUID> {

  /** Oldest envelopes in {@code status} whose backoff window has elapsed. */
  @Query(
      """
      SELECT e FROM Envelope e
      WHERE e.status = :status
        AND e.nextAttemptAt <= :now
      ORDER BY e.createdAt ASC
      """)
  List<Envelope> findDueBatch(
      @Param("status") EnvelopeStatus status, @Param("now") Instant now, Pageable pageable);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT e FROM Envelope e WHERE e.id = :id")
  Optional<Envelope> findByIdForUpdate(@Param("id") UUID id);

  @Query(
      """
      SELECT e FROM Envelope e
      WHERE (:status IS NULL OR e.status = :status)
        AND (:ticketRef IS NULL OR e.ticketRef = :ticketRef)
      ORDER BY e.createdAt DESC
      """)
  Page<Envelope> findByFilters(
      @Param("status") EnvelopeStatus status,
      @Param("ticketRef") UUID ticketRef,
      Pageable pageable);

  List<Envelope> findByTicketRefOrderByCreatedAtAsc(UUID ticketRef);

  long countByStatus(EnvelopeStatus status);
}
