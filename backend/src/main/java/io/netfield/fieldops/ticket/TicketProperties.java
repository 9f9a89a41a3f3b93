package io.netfield.fieldops.ticket;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Ticket policy.
 *
 * @param autoApproveRoles caller roles whose tickets skip the approval gate
 * @param selfAssignEnabled whether technicians may claim INSTALL tickets themselves
 * @param staffAddresses contact addresses that receive staff-facing messages (declines)
 */
@ConfigurationProperties("fieldops.tickets")
public record TicketProperties(
    @DefaultValue("system") List<String> autoApproveRoles,
    @DefaultValue("true") boolean selfAssignEnabled,
    List<String> staffAddresses) {

  public TicketProperties {
    autoApproveRoles = autoApproveRoles == null ? List.of() : List.copyOf(autoApproveRoles);
    staffAddresses = staffAddresses == null ? List.of() : List.copyOf(staffAddresses);
  }

  public boolean isAutoApproved(String role) {
    return role != null && autoApproveRoles.contains(role);
  }
}
