package io.netfield.fieldops.customer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Minimal customer record: tickets reference it and customer-facing envelopes go to it. */
@Entity
@Table(name = "customers")
public class Customer {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "contact_address", length = 32)
  private String contactAddress;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Customer() {}

  public Customer(String name, String contactAddress) {
    this.name = name;
    this.contactAddress = contactAddress;
    this.createdAt = Instant.now();
  }

  public boolean hasContactAddress() {
    return contactAddress != null && !contactAddress.isBlank();
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

  public Instant getCreatedAt() {
    return createdAt;
  }
}
