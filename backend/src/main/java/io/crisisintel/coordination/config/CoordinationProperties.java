package io.crisisintel.coordination.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables of the coordination core.
 *
 * @param cancellationWindow how long before the target time a committed request stops being
 *     cancellable
 * @param enforceWindowOnPending whether pending requests with a target time also respect the
 *     cancellation window
 * @param duplicateWindow identical pending requests created within this window return the
 *     existing envelope
 * @param defaultCooldownDays cooldown applied to a donor when a meeting completes without an
 *     explicit value
 * @param defaultPageSize page size used when the caller omits one
 * @param maxPageSize upper bound on requested page sizes
 * @param defaultRadiusKm crisis radius used when the creator omits one
 */
@ConfigurationProperties(prefix = "crisisintel.coordination")
public record CoordinationProperties(
    @DefaultValue("2h") Duration cancellationWindow,
    @DefaultValue("false") boolean enforceWindowOnPending,
    @DefaultValue("2m") Duration duplicateWindow,
    @DefaultValue("10") int defaultCooldownDays,
    @DefaultValue("20") int defaultPageSize,
    @DefaultValue("100") int maxPageSize,
    @DefaultValue("5.0") double defaultRadiusKm) {

  public static CoordinationProperties defaults() {
    return new CoordinationProperties(
        Duration.ofHours(2), false, Duration.ofMinutes(2), 10, 20, 100, 5.0);
  }
}
