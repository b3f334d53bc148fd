package io.crisisintel.coordination.crisis;

public enum IncidentStatus {
  OPEN,
  CLOSED,
  CANCELLED
}
