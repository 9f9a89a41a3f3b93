package io.netfield.fieldops.technician;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/technicians")
@PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN')")
public class TechnicianController {

  private final TechnicianService technicianService;

  public TechnicianController(TechnicianService technicianService) {
    this.technicianService = technicianService;
  }

  @PostMapping
  public ResponseEntity<TechnicianResponse> createTechnician(
      @Valid @RequestBody CreateTechnicianRequest request) {
    var technician =
        technicianService.create(request.name(), request.contactAddress(), request.userId());
    return ResponseEntity.created(URI.create("/api/technicians/" + technician.getId()))
        .body(TechnicianResponse.from(technician));
  }

  @GetMapping
  public ResponseEntity<List<TechnicianResponse>> listTechnicians(
      @RequestParam(defaultValue = "false") boolean includeInactive) {
    return ResponseEntity.ok(
        technicianService.list(includeInactive).stream().map(TechnicianResponse::from).toList());
  }

  @PostMapping("/{id}/deactivate")
  public ResponseEntity<TechnicianResponse> deactivateTechnician(@PathVariable UUID id) {
    return ResponseEntity.ok(TechnicianResponse.from(technicianService.deactivate(id)));
  }

  @PostMapping("/{id}/availability")
  public ResponseEntity<TechnicianResponse> setAvailability(
      @PathVariable UUID id, @RequestParam boolean available) {
    return ResponseEntity.ok(
        TechnicianResponse.from(technicianService.setAvailability(id, available)));
  }

  public record CreateTechnicianRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @NotBlank(message = "contactAddress is required") String contactAddress,
      UUID userId) {}

  public record TechnicianResponse(
      UUID id,
      String name,
      String contactAddress,
      boolean active,
      boolean available,
      UUID userId,
      Instant createdAt) {

    public static TechnicianResponse from(Technician technician) {
      return new TechnicianResponse(
          technician.getId(),
          technician.getName(),
          technician.getContactAddress(),
          technician.isActive(),
          technician.isAvailable(),
          technician.getUserId(),
          technician.getCreatedAt());
    }
  }
}
