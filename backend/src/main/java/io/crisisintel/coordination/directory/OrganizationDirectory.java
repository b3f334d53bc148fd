package io.crisisintel.coordination.directory;

import io.crisisintel.coordination.security.ActorRole;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only view over accounts and organization rosters. Used to validate counterparties and unit
 * eligibility; roster maintenance happens elsewhere.
 */
public interface OrganizationDirectory {

  Optional<Account> findAccount(UUID userId);

  Optional<Account> findAccountByEmail(String email);

  Optional<FireTeam> findFireTeam(UUID teamId);

  Optional<SocialOrganization> findSocialOrganization(UUID organizationId);

  /** Returns the subset of {@code userIds} that are accepted volunteers of the organization. */
  Set<UUID> findAcceptedVolunteers(UUID organizationId, Collection<UUID> userIds);

  /** True when the hospital service exists, is active and belongs to the given hospital user. */
  boolean isActiveHospitalService(UUID serviceId, UUID hospitalUserId);

  record Account(UUID userId, String email, ActorRole role) {}

  record FireTeam(UUID teamId, UUID ownerUserId, String name, String status) {

    public boolean isAvailable() {
      return "available".equals(status);
    }
  }

  record SocialOrganization(UUID organizationId, UUID ownerUserId, String name) {}
}
