package io.crisisintel.coordination.victim;

/** Victim triage status. Any status may move to any other; none is terminal. */
public enum VictimStatus {
  PENDING,
  CONFIRMED,
  DISMISSED
}
