package io.netfield.fieldops.ticket;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TicketRepository extends JpaRepository<Ticket, UUID> {

  /** Row lock scoped to one ticket; every mutating ticket operation goes through here. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Ticket t WHERE t.id = :id")
  Optional<Ticket> findByIdForUpdate(@Param("id") UUID id);

  /**
   * Compare-and-swap claim for self-assignment. Succeeds only if nobody changed the ticket since
   * {@code expectedVersion} was read and the ticket is still approved and claimable. Returns the
   * number of rows updated, so 0 means another writer committed first.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE Ticket t
         SET t.status = :assigned, t.version = t.version + 1, t.updatedAt = :now
       WHERE t.id = :id
         AND t.version = :expectedVersion
         AND t.status IN :claimable
         AND t.approval = :approved
      """)
  int claimForSelfAssign(
      @Param("id") UUID id,
      @Param("expectedVersion") int expectedVersion,
      @Param("assigned") TicketStatus assigned,
      @Param("claimable") Collection<TicketStatus> claimable,
      @Param("approved") ApprovalStatus approved,
      @Param("now") Instant now);

  @Query(
      """
      SELECT t FROM Ticket t
      WHERE (:status IS NULL OR t.status = :status)
        AND (:approval IS NULL OR t.approval = :approval)
        AND (:category IS NULL OR t.category = :category)
      ORDER BY t.createdAt DESC
      """)
  Page<Ticket> findByFilters(
      @Param("status") TicketStatus status,
      @Param("approval") ApprovalStatus approval,
      @Param("category") TicketCategory category,
      Pageable pageable);

  List<Ticket> findByApprovalOrderByCreatedAtAsc(ApprovalStatus approval);
}
