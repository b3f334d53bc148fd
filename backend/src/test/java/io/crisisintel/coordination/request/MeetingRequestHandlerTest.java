package io.crisisintel.coordination.request;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.crisisintel.coordination.config.CoordinationProperties;
import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.directory.OrganizationDirectory.Account;
import io.crisisintel.coordination.donor.DonorProfile;
import io.crisisintel.coordination.donor.DonorProfileService;
import io.crisisintel.coordination.exception.ErrorCode;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.InvalidStateException;
import io.crisisintel.coordination.security.ActorRole;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MeetingRequestHandlerTest {

  private static final Instant NOW = Instant.parse("2026-08-12T08:00:00Z");
  private static final Instant MEETING_AT = NOW.plus(Duration.ofDays(3));
  private static final UUID BANK_ID = UUID.randomUUID();
  private static final UUID DONOR_ID = UUID.randomUUID();

  @Mock private OrganizationDirectory organizationDirectory;
  @Mock private DonorProfileService donorProfileService;

  private MeetingRequestHandler handler;
  private CallerContext bank;

  @BeforeEach
  void setUp() {
    handler =
        new MeetingRequestHandler(
            organizationDirectory, donorProfileService, CoordinationProperties.defaults());
    bank = CallerContext.of(BANK_ID, ActorRole.BLOOD_BANK);
  }

  @Test
  void validate_withoutTargetTime_isRejected() {
    var draft = meeting(null, null);

    assertThatThrownBy(() -> handler.validate(bank, draft))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("targetAt");
  }

  @Test
  void validate_unknownDonor_isRejected() {
    when(organizationDirectory.findAccount(DONOR_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> handler.validate(bank, meeting(MEETING_AT, null)))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("Unknown counterparty");
  }

  @Test
  void validate_anyAccountRoleMayBeTheDonor() {
    when(organizationDirectory.findAccount(DONOR_ID))
        .thenReturn(Optional.of(new Account(DONOR_ID, "donor@example.org", ActorRole.REGULAR)));

    assertThatCode(() -> handler.validate(bank, meeting(MEETING_AT, 30)))
        .doesNotThrowAnyException();
  }

  @Test
  void beforeAccept_donorCoolingDownAtMeetingTime_isCooldownActive() {
    var profile = new DonorProfile(DONOR_ID, "A+", NOW.minus(Duration.ofDays(60)));
    profile.applyCooldown(10, NOW);
    when(donorProfileService.find(DONOR_ID)).thenReturn(Optional.of(profile));
    var envelope = new RequestEnvelope(BANK_ID, meeting(MEETING_AT, null), NOW);

    assertThatThrownBy(() -> handler.beforeAccept(envelope, NOW))
        .isInstanceOf(InvalidStateException.class)
        .extracting(e -> ((InvalidStateException) e).getErrorCode())
        .isEqualTo(ErrorCode.COOLDOWN_ACTIVE);
  }

  @Test
  void beforeAccept_cooldownEndingBeforeMeeting_isAllowed() {
    var profile = new DonorProfile(DONOR_ID, "A+", NOW.minus(Duration.ofDays(60)));
    profile.applyCooldown(2, NOW);
    when(donorProfileService.find(DONOR_ID)).thenReturn(Optional.of(profile));
    var envelope = new RequestEnvelope(BANK_ID, meeting(MEETING_AT, null), NOW);

    assertThatCode(() -> handler.beforeAccept(envelope, NOW)).doesNotThrowAnyException();
  }

  @Test
  void afterComplete_prefersCompletionOverride() {
    var envelope = new RequestEnvelope(BANK_ID, meeting(MEETING_AT, 30), NOW);

    handler.afterComplete(envelope, 45, MEETING_AT);

    verify(donorProfileService).applyCooldown(DONOR_ID, 45, MEETING_AT);
  }

  @Test
  void afterComplete_fallsBackToRequestValue() {
    var envelope = new RequestEnvelope(BANK_ID, meeting(MEETING_AT, 30), NOW);

    handler.afterComplete(envelope, null, MEETING_AT);

    verify(donorProfileService).applyCooldown(DONOR_ID, 30, MEETING_AT);
  }

  @Test
  void afterComplete_withoutAnyValue_appliesConfiguredDefault() {
    var envelope = new RequestEnvelope(BANK_ID, meeting(MEETING_AT, null), NOW);

    handler.afterComplete(envelope, null, MEETING_AT);

    verify(donorProfileService).applyCooldown(DONOR_ID, 10, MEETING_AT);
  }

  private static RequestDraft meeting(Instant targetAt, Integer cooldownDays) {
    return new RequestDraft(
        RequestKind.MEETING,
        DONOR_ID,
        targetAt,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        cooldownDays);
  }
}
