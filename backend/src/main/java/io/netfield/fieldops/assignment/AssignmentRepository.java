package io.netfield.fieldops.assignment;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AssignmentRepository extends JpaRepository<Assignment, UUID> {

  List<Assignment> findByTicketIdOrderByCreatedAtAsc(UUID ticketId);

  Optional<Assignment> findByTicketIdAndTechnicianId(UUID ticketId, UUID technicianId);

  boolean existsByTicketIdAndTechnicianId(UUID ticketId, UUID technicianId);

  long countByTicketId(UUID ticketId);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM Assignment a WHERE a.ticketId = :ticketId")
  int deleteAllByTicketId(@Param("ticketId") UUID ticketId);
}
