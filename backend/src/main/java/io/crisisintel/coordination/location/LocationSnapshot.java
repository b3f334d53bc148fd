package io.crisisintel.coordination.location;

import java.time.Instant;
import java.util.UUID;

/** Most recent known position of a user. */
public record LocationSnapshot(UUID userId, double lat, double lng, Instant capturedAt) {}
