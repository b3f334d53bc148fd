package io.crisisintel.coordination.participation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.crisisintel.coordination.crisis.Crisis;
import io.crisisintel.coordination.crisis.CrisisRepository;
import io.crisisintel.coordination.crisis.Incident;
import io.crisisintel.coordination.exception.ErrorCode;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.InvalidStateException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.security.ActorRole;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CrisisAccessServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-09T07:00:00Z");
  private static final UUID CRISIS_ID = UUID.randomUUID();
  private static final UUID CREATOR_ID = UUID.randomUUID();

  @Mock private CrisisRepository crisisRepository;
  @Mock private CrisisParticipantRepository participantRepository;

  private CrisisAccessService service;
  private Crisis crisis;

  @BeforeEach
  void setUp() {
    service = new CrisisAccessService(crisisRepository, participantRepository);
    crisis = crisisWithId(CRISIS_ID);
  }

  @Test
  void requireCrisis_unknownId_isNotFound() {
    when(crisisRepository.findById(CRISIS_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.requireCrisis(CRISIS_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void requireActiveCrisis_closedCrisis_isImmutable() {
    var incident =
        new Incident("Flood", null, "flood", "high", 0, 0, CREATOR_ID, NOW.minusSeconds(60));
    crisis.close(incident, NOW);
    when(crisisRepository.findById(CRISIS_ID)).thenReturn(Optional.of(crisis));

    assertThatThrownBy(() -> service.requireActiveCrisis(CRISIS_ID))
        .isInstanceOf(InvalidStateException.class)
        .extracting(e -> ((InvalidStateException) e).getErrorCode())
        .isEqualTo(ErrorCode.IMMUTABLE);
  }

  @Test
  void isAdministrator_creatorAndPlatformAdmin() {
    var creator = CallerContext.of(CREATOR_ID, ActorRole.REGULAR);
    var platformAdmin = new CallerContext(UUID.randomUUID(), ActorRole.HOSPITAL, true);
    var other = CallerContext.of(UUID.randomUUID(), ActorRole.HOSPITAL);

    assertThat(service.isAdministrator(creator, crisis)).isTrue();
    assertThat(service.isAdministrator(platformAdmin, crisis)).isTrue();
    assertThat(service.isAdministrator(other, crisis)).isFalse();
  }

  @Test
  void requireMayAct_organizationWithoutParticipation_isForbidden() {
    var hospital = CallerContext.of(UUID.randomUUID(), ActorRole.HOSPITAL);
    when(participantRepository.existsByCrisisIdAndUserId(CRISIS_ID, hospital.userId()))
        .thenReturn(false);

    assertThatThrownBy(() -> service.requireMayAct(hospital, crisis))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireMayAct_participatingOrganization_isAllowed() {
    var bank = CallerContext.of(UUID.randomUUID(), ActorRole.BLOOD_BANK);
    when(participantRepository.existsByCrisisIdAndUserId(CRISIS_ID, bank.userId()))
        .thenReturn(true);

    assertThatCode(() -> service.requireMayAct(bank, crisis)).doesNotThrowAnyException();
  }

  @Test
  void requireMayAct_regularUser_needsNoParticipation() {
    var regular = CallerContext.of(UUID.randomUUID(), ActorRole.REGULAR);

    assertThatCode(() -> service.requireMayAct(regular, crisis)).doesNotThrowAnyException();
    verify(participantRepository, never()).existsByCrisisIdAndUserId(any(), any());
  }

  @Test
  void requireParticipantOrAdministrator_regularNonParticipant_isForbidden() {
    var regular = CallerContext.of(UUID.randomUUID(), ActorRole.REGULAR);
    when(participantRepository.existsByCrisisIdAndUserId(CRISIS_ID, regular.userId()))
        .thenReturn(false);

    assertThatThrownBy(() -> service.requireParticipantOrAdministrator(regular, crisis))
        .isInstanceOf(ForbiddenException.class);
  }

  private static Crisis crisisWithId(UUID id) {
    var crisis = new Crisis(UUID.randomUUID(), "Flood", null, 0, 0, 10, CREATOR_ID, NOW);
    try {
      var idField = Crisis.class.getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(crisis, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set crisis ID", e);
    }
    return crisis;
  }
}
