package io.crisisintel.coordination.participation;

public enum InvitationStatus {
  PENDING,
  ACCEPTED,
  DECLINED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
