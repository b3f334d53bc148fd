package io.crisisintel.coordination.participation;

public enum ParticipationRequestStatus {
  PENDING,
  APPROVED,
  REJECTED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
