package io.netfield.fieldops.security;

import java.util.Set;

/**
 * Centralized role constants used across authentication, authorization, and access control.
 *
 * <p>Caller roles come from the JWT {@code role} claim. Spring authorities are the {@code ROLE_}
 * prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // JWT "role" claim values
  public static final String SUPERADMIN = "superadmin";
  public static final String ADMIN = "admin";
  public static final String TECHNICIAN = "technician";
  public static final String SYSTEM = "system";

  // Spring Security granted authorities
  public static final String AUTHORITY_SUPERADMIN = "ROLE_SUPERADMIN";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_TECHNICIAN = "ROLE_TECHNICIAN";
  public static final String AUTHORITY_SYSTEM = "ROLE_SYSTEM";

  private static final Set<String> STAFF = Set.of(SUPERADMIN, ADMIN);

  private Roles() {}

  /** Office staff may approve, assign, retry deliveries and act on behalf of technicians. */
  public static boolean isStaff(String role) {
    return role != null && STAFF.contains(role);
  }
}
