package io.netfield.fieldops.technician;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "technicians")
public class Technician {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "contact_address", nullable = false, length = 32)
  private String contactAddress;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "available", nullable = false)
  private boolean available;

  @Column(name = "user_id", unique = true)
  private UUID userId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Technician() {}

  /**
   * @param contactAddress normalized phone number
   * @param userId caller identity of the technician's login, null if they have none yet
   */
  public Technician(String name, String contactAddress, UUID userId) {
    this.name = name;
    this.contactAddress = contactAddress;
    this.userId = userId;
    this.active = true;
    this.available = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Deactivation keeps the row so historical tickets still resolve the technician. */
  public void deactivate() {
    this.active = false;
    this.available = false;
    this.updatedAt = Instant.now();
  }

  public void markAvailable(boolean available) {
    this.available = available;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getContactAddress() {
    return contactAddress;
  }

  public boolean isActive() {
    return active;
  }

  public boolean isAvailable() {
    return available;
  }

  public UUID getUserId() {
    return userId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
