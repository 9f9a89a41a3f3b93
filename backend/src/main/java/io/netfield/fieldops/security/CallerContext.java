package io.netfield.fieldops.security;

import io.netfield.fieldops.exception.MissingCallerIdentityException;
import java.util.Map;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the authenticated caller for controllers. The caller id is the JWT subject (a UUID);
 * the role is derived from the granted authority so that it matches what {@code @PreAuthorize}
 * evaluated.
 */
public final class CallerContext {

  private static final Map<String, String> AUTHORITY_TO_ROLE =
      Map.of(
          Roles.AUTHORITY_SUPERADMIN, Roles.SUPERADMIN,
          Roles.AUTHORITY_ADMIN, Roles.ADMIN,
          Roles.AUTHORITY_TECHNICIAN, Roles.TECHNICIAN,
          Roles.AUTHORITY_SYSTEM, Roles.SYSTEM);

  private CallerContext() {}

  /** Returns the caller's UUID. Throws if there is no authentication or the subject is no UUID. */
  public static UUID requireCallerId() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null || authentication.getName() == null) {
      throw new MissingCallerIdentityException("No authenticated caller");
    }
    try {
      return UUID.fromString(authentication.getName());
    } catch (IllegalArgumentException e) {
      throw new MissingCallerIdentityException("Caller subject is not a UUID");
    }
  }

  /** Returns the caller's role ("admin", "technician", ...), or null if none was granted. */
  public static String getCallerRole() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null) {
      return null;
    }
    return authentication.getAuthorities().stream()
        .map(GrantedAuthority::getAuthority)
        .map(AUTHORITY_TO_ROLE::get)
        .filter(role -> role != null)
        .findFirst()
        .orElse(null);
  }
}
