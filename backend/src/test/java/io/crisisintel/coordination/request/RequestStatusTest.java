package io.crisisintel.coordination.request;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RequestStatusTest {

  @Test
  void pending_canMoveToAcceptedRejectedOrCancelled() {
    assertThat(RequestStatus.PENDING.allowedTransitions())
        .containsExactlyInAnyOrder(
            RequestStatus.ACCEPTED, RequestStatus.REJECTED, RequestStatus.CANCELLED);
  }

  @Test
  void accepted_canOnlyCompleteOrCancel() {
    assertThat(RequestStatus.ACCEPTED.canTransitionTo(RequestStatus.COMPLETED)).isTrue();
    assertThat(RequestStatus.ACCEPTED.canTransitionTo(RequestStatus.CANCELLED)).isTrue();
    assertThat(RequestStatus.ACCEPTED.canTransitionTo(RequestStatus.REJECTED)).isFalse();
    assertThat(RequestStatus.ACCEPTED.canTransitionTo(RequestStatus.PENDING)).isFalse();
  }

  @Test
  void pending_cannotCompleteDirectly() {
    assertThat(RequestStatus.PENDING.canTransitionTo(RequestStatus.COMPLETED)).isFalse();
  }

  @Test
  void finishedStatuses_areTerminal() {
    assertThat(RequestStatus.REJECTED.isTerminal()).isTrue();
    assertThat(RequestStatus.CANCELLED.isTerminal()).isTrue();
    assertThat(RequestStatus.COMPLETED.isTerminal()).isTrue();
    assertThat(RequestStatus.PENDING.isTerminal()).isFalse();
    assertThat(RequestStatus.ACCEPTED.isTerminal()).isFalse();
  }
}
