package io.crisisintel.coordination.directory;

import io.crisisintel.coordination.security.ActorRole;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Native-SQL implementation of {@link OrganizationDirectory} over the roster tables. */
@Component
@Transactional(readOnly = true)
public class JpaOrganizationDirectory implements OrganizationDirectory {

  private final EntityManager entityManager;

  public JpaOrganizationDirectory(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  @Override
  public Optional<Account> findAccount(UUID userId) {
    var query =
        entityManager
            .createNativeQuery(
                "SELECT id, email, role FROM user_accounts WHERE id = :userId", Tuple.class)
            .setParameter("userId", userId);
    return firstTuple(query.getResultList()).flatMap(JpaOrganizationDirectory::toAccount);
  }

  @Override
  public Optional<Account> findAccountByEmail(String email) {
    if (email == null || email.isBlank()) {
      return Optional.empty();
    }
    var query =
        entityManager
            .createNativeQuery(
                "SELECT id, email, role FROM user_accounts WHERE lower(email) = :email",
                Tuple.class)
            .setParameter("email", email.trim().toLowerCase(Locale.ROOT));
    return firstTuple(query.getResultList()).flatMap(JpaOrganizationDirectory::toAccount);
  }

  @Override
  public Optional<FireTeam> findFireTeam(UUID teamId) {
    var query =
        entityManager
            .createNativeQuery(
                """
                SELECT ft.id AS team_id, fd.owner_user_id AS owner_user_id,
                       ft.name AS name, ft.status AS status
                FROM fire_teams ft
                JOIN fire_departments fd ON ft.department_id = fd.id
                WHERE ft.id = :teamId
                """,
                Tuple.class)
            .setParameter("teamId", teamId);
    return firstTuple(query.getResultList())
        .map(
            t ->
                new FireTeam(
                    t.get("team_id", UUID.class),
                    t.get("owner_user_id", UUID.class),
                    t.get("name", String.class),
                    t.get("status", String.class)));
  }

  @Override
  public Optional<SocialOrganization> findSocialOrganization(UUID organizationId) {
    var query =
        entityManager
            .createNativeQuery(
                "SELECT id, owner_user_id, name FROM social_organizations WHERE id = :orgId",
                Tuple.class)
            .setParameter("orgId", organizationId);
    return firstTuple(query.getResultList())
        .map(
            t ->
                new SocialOrganization(
                    t.get("id", UUID.class),
                    t.get("owner_user_id", UUID.class),
                    t.get("name", String.class)));
  }

  @Override
  public Set<UUID> findAcceptedVolunteers(UUID organizationId, Collection<UUID> userIds) {
    if (userIds == null || userIds.isEmpty()) {
      return Set.of();
    }
    var query =
        entityManager
            .createNativeQuery(
                """
                SELECT user_id FROM social_org_volunteers
                WHERE org_id = :orgId
                  AND status = 'accepted'
                  AND user_id IN (:userIds)
                """)
            .setParameter("orgId", organizationId)
            .setParameter("userIds", userIds);
    @SuppressWarnings("unchecked")
    List<UUID> rows = query.getResultList();
    return new HashSet<>(rows);
  }

  @Override
  public boolean isActiveHospitalService(UUID serviceId, UUID hospitalUserId) {
    var query =
        entityManager
            .createNativeQuery(
                """
                SELECT COUNT(*) FROM hospital_services
                WHERE id = :serviceId
                  AND hospital_user_id = :hospitalUserId
                  AND active = true
                """)
            .setParameter("serviceId", serviceId)
            .setParameter("hospitalUserId", hospitalUserId);
    return ((Number) query.getSingleResult()).longValue() > 0;
  }

  @SuppressWarnings("unchecked")
  private static Optional<Tuple> firstTuple(List<?> rows) {
    return ((List<Tuple>) rows).stream().findFirst();
  }

  private static Optional<Account> toAccount(Tuple t) {
    return ActorRole.fromClaim(t.get("role", String.class))
        .map(role -> new Account(t.get("id", UUID.class), t.get("email", String.class), role));
  }
}
