package io.netfield.fieldops.technician;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TechnicianRepository extends JpaRepository<Technician, UUID> {

  Optional<Technician> findByUserId(UUID userId);

  List<Technician> findByActiveTrueOrderByNameAsc();

  List<Technician> findAllByOrderByNameAsc();

  boolean existsByContactAddressAndActiveTrue(String contactAddress);
}
