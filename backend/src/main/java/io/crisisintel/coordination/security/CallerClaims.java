package io.crisisintel.coordination.security;

import io.crisisintel.coordination.exception.ForbiddenException;
import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads the caller claims issued by the session provider.
 *
 * <p>Token format: {@code { "sub": "<user uuid>", "role": "blood_bank", "admin": false }}
 */
public final class CallerClaims {

  private static final String ROLE_CLAIM = "role";
  private static final String ADMIN_CLAIM = "admin";

  public static CallerContext toCallerContext(Jwt jwt) {
    UUID userId = extractUserId(jwt);
    String roleClaim = jwt.getClaimAsString(ROLE_CLAIM);
    ActorRole role =
        roleClaim == null
            ? ActorRole.REGULAR
            : ActorRole.fromClaim(roleClaim)
                .orElseThrow(
                    () ->
                        new ForbiddenException(
                            "Unknown role", "Role claim '" + roleClaim + "' is not recognised"));
    return new CallerContext(userId, role, extractAdmin(jwt));
  }

  private static UUID extractUserId(Jwt jwt) {
    String subject = jwt.getSubject();
    if (subject == null) {
      throw new ForbiddenException("Missing subject", "Token does not identify a user");
    }
    try {
      return UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      throw new ForbiddenException("Invalid subject", "Token subject is not a user id");
    }
  }

  private static boolean extractAdmin(Jwt jwt) {
    Object value = jwt.getClaim(ADMIN_CLAIM);
    if (value instanceof Boolean flag) {
      return flag;
    }
    return value instanceof String str && Boolean.parseBoolean(str);
  }

  private CallerClaims() {}
}
