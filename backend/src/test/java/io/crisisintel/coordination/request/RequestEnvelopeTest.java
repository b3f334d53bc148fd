package io.crisisintel.coordination.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.crisisintel.coordination.exception.ErrorCode;
import io.crisisintel.coordination.exception.InvalidStateException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RequestEnvelopeTest {

  private static final UUID REQUESTER = UUID.randomUUID();
  private static final UUID COUNTERPARTY = UUID.randomUUID();
  private static final Instant CREATED = Instant.parse("2026-03-01T08:00:00Z");
  private static final Instant TARGET = Instant.parse("2026-03-01T12:00:00Z");
  private static final Duration WINDOW = Duration.ofHours(2);

  private RequestEnvelope inventoryRequest() {
    return new RequestEnvelope(
        REQUESTER,
        new RequestDraft(
            RequestKind.INVENTORY,
            COUNTERPARTY,
            TARGET,
            null,
            "O-",
            3,
            null,
            null,
            null,
            null,
            null,
            null),
        CREATED);
  }

  @Test
  void newRequest_isPendingAndVisibleToBothParties() {
    var envelope = inventoryRequest();

    assertThat(envelope.getStatus()).isEqualTo(RequestStatus.PENDING);
    assertThat(envelope.isParty(REQUESTER)).isTrue();
    assertThat(envelope.isParty(COUNTERPARTY)).isTrue();
    assertThat(envelope.isHiddenFor(REQUESTER)).isFalse();
  }

  @Test
  void accept_thenComplete_setsTimestamps() {
    var envelope = inventoryRequest();
    var acceptedAt = CREATED.plusSeconds(60);
    var completedAt = TARGET.plusSeconds(60);

    envelope.accept(acceptedAt);
    envelope.complete(completedAt);

    assertThat(envelope.getStatus()).isEqualTo(RequestStatus.COMPLETED);
    assertThat(envelope.getRespondedAt()).isEqualTo(acceptedAt);
    assertThat(envelope.getClosedAt()).isEqualTo(completedAt);
  }

  @Test
  void complete_fromPending_isInvalidStatus() {
    var envelope = inventoryRequest();

    assertThatThrownBy(() -> envelope.complete(CREATED))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATUS));
  }

  @Test
  void acceptedRequest_cancelledOneMinuteBeforeCutoff_succeeds() {
    var envelope = inventoryRequest();
    envelope.accept(CREATED);

    envelope.cancel(TARGET.minus(WINDOW).minusSeconds(60), WINDOW, false);

    assertThat(envelope.getStatus()).isEqualTo(RequestStatus.CANCELLED);
  }

  @Test
  void acceptedRequest_cancelledExactlyAtCutoff_isTooLate() {
    var envelope = inventoryRequest();
    envelope.accept(CREATED);

    assertThatThrownBy(() -> envelope.cancel(TARGET.minus(WINDOW), WINDOW, false))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TOO_LATE_TO_CANCEL));
    assertThat(envelope.getStatus()).isEqualTo(RequestStatus.ACCEPTED);
  }

  @Test
  void acceptedRequest_cancelledOneHourBeforeTarget_isTooLate() {
    var envelope = inventoryRequest();
    envelope.accept(CREATED);

    assertThatThrownBy(() -> envelope.cancel(TARGET.minus(Duration.ofHours(1)), WINDOW, false))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TOO_LATE_TO_CANCEL));
  }

  @Test
  void pendingRequest_canBeCancelledInsideWindow() {
    var envelope = inventoryRequest();

    envelope.cancel(TARGET.minusSeconds(60), WINDOW, false);

    assertThat(envelope.getStatus()).isEqualTo(RequestStatus.CANCELLED);
  }

  @Test
  void pendingRequest_respectsWindowWhenEnforced() {
    var envelope = inventoryRequest();

    assertThatThrownBy(() -> envelope.cancel(TARGET.minusSeconds(60), WINDOW, true))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TOO_LATE_TO_CANCEL));
  }

  @Test
  void untimedRequest_canAlwaysBeCancelled() {
    var envelope =
        new RequestEnvelope(
            REQUESTER,
            new RequestDraft(
                RequestKind.DISPATCH,
                COUNTERPARTY,
                null,
                null,
                null,
                null,
                null,
                "Warehouse fire",
                "Dock 4",
                null,
                null,
                null),
            CREATED);
    envelope.accept(CREATED);

    envelope.cancel(CREATED.plusSeconds(5), WINDOW, false);

    assertThat(envelope.getStatus()).isEqualTo(RequestStatus.CANCELLED);
  }

  @Test
  void anyTransitionOnTerminalRequest_isImmutable() {
    var envelope = inventoryRequest();
    envelope.reject("No stock", CREATED);

    assertThatThrownBy(() -> envelope.accept(CREATED))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.IMMUTABLE));
    assertThatThrownBy(() -> envelope.cancel(CREATED, WINDOW, false))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.IMMUTABLE));
    assertThat(envelope.getRejectReason()).isEqualTo("No stock");
  }

  @Test
  void hide_onlyAffectsTheCallersSide() {
    var envelope = inventoryRequest();
    envelope.cancel(CREATED, WINDOW, false);

    envelope.hideFor(REQUESTER);

    assertThat(envelope.isHiddenFor(REQUESTER)).isTrue();
    assertThat(envelope.isHiddenFor(COUNTERPARTY)).isFalse();
    assertThat(envelope.getStatus()).isEqualTo(RequestStatus.CANCELLED);
  }

  @Test
  void hide_rejectedRequest_isInvalidStatus() {
    var envelope = inventoryRequest();
    envelope.reject(null, CREATED);

    assertThatThrownBy(() -> envelope.hideFor(REQUESTER))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATUS));
    assertThat(envelope.isHiddenFor(REQUESTER)).isFalse();
  }

  @Test
  void hide_openRequest_isInvalidStatus() {
    var envelope = inventoryRequest();

    assertThatThrownBy(() -> envelope.hideFor(REQUESTER))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATUS));
  }
}
