package io.netfield.fieldops.technician;

import io.netfield.fieldops.exception.ForbiddenException;
import io.netfield.fieldops.exception.ResourceNotFoundException;
import io.netfield.fieldops.exception.StateConflictException;
import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.transport.PhoneNumbers;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TechnicianService {

  private static final Logger log = LoggerFactory.getLogger(TechnicianService.class);

  private final TechnicianRepository technicianRepository;

  public TechnicianService(TechnicianRepository technicianRepository) {
    this.technicianRepository = technicianRepository;
  }

  @Transactional
  public Technician create(String name, String contactAddress, UUID userId) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Missing name", "Technician name is required");
    }
    String normalized = PhoneNumbers.normalize(contactAddress);
    if (technicianRepository.existsByContactAddressAndActiveTrue(normalized)) {
      throw new StateConflictException(
          "Duplicate technician", "An active technician already uses " + normalized);
    }
    if (userId != null && technicianRepository.findByUserId(userId).isPresent()) {
      throw new StateConflictException(
          "Duplicate technician", "User " + userId + " is already linked to a technician");
    }
    var technician = technicianRepository.save(new Technician(name.trim(), normalized, userId));
    log.info("Technician {} created ({})", technician.getId(), normalized);
    return technician;
  }

  @Transactional(readOnly = true)
  public Technician get(UUID technicianId) {
    return technicianRepository
        .findById(technicianId)
        .orElseThrow(() -> new ResourceNotFoundException("Technician", technicianId));
  }

  /** Active technicians only; used for broadcasting newly approved tickets. */
  @Transactional(readOnly = true)
  public List<Technician> listActive() {
    return technicianRepository.findByActiveTrueOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public List<Technician> list(boolean includeInactive) {
    return includeInactive
        ? technicianRepository.findAllByOrderByNameAsc()
        : technicianRepository.findByActiveTrueOrderByNameAsc();
  }

  @Transactional
  public Technician deactivate(UUID technicianId) {
    var technician = get(technicianId);
    if (!technician.isActive()) {
      throw new StateConflictException(
          "Technician inactive", "Technician " + technicianId + " is already deactivated");
    }
    technician.deactivate();
    log.info("Technician {} deactivated", technicianId);
    return technician;
  }

  @Transactional
  public Technician setAvailability(UUID technicianId, boolean available) {
    var technician = get(technicianId);
    if (available && !technician.isActive()) {
      throw new StateConflictException(
          "Technician inactive", "Deactivated technician " + technicianId + " cannot be available");
    }
    technician.markAvailable(available);
    log.info("Technician {} availability set to {}", technicianId, available);
    return technician;
  }

  /** Resolves the technician row linked to a caller identity. */
  @Transactional(readOnly = true)
  public Technician requireByUserId(UUID userId) {
    return technicianRepository
        .findByUserId(userId)
        .orElseThrow(
            () ->
                new ForbiddenException(
                    "Not a technician", "Caller " + userId + " is not linked to a technician"));
  }
}
