package io.crisisintel.coordination.victim;

import java.time.Instant;
import java.util.UUID;

/** A user whose last known location lies inside a crisis radius. Never persisted. */
public record PotentialVictim(
    UUID userId, double lat, double lng, Instant locatedAt, double distanceKm) {}
