package io.netfield.fieldops.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class RoleClaimAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLE_CLAIM = "role";

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.SUPERADMIN, Roles.AUTHORITY_SUPERADMIN,
          Roles.ADMIN, Roles.AUTHORITY_ADMIN,
          Roles.TECHNICIAN, Roles.AUTHORITY_TECHNICIAN,
          Roles.SYSTEM, Roles.AUTHORITY_SYSTEM);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    String role = jwt.getClaimAsString(ROLE_CLAIM);
    if (role == null) {
      return List.of();
    }
    String springRole = ROLE_MAPPING.get(role.toLowerCase());
    if (springRole == null) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority(springRole));
  }
}
