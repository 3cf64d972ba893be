/*
 * Where: crafting configuration binding
 * What: Lifetime and sweep schedule of composition sessions
 */
package com.guildcraft.crafting.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "crafting.session")
@Validated
public record CraftingSessionProperties(
    Duration defaultTtl, boolean sweepEnabled, Duration sweepInterval) {

  private static final Duration DEFAULT_TTL = Duration.ofHours(24);

  public CraftingSessionProperties {
    if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
      defaultTtl = DEFAULT_TTL;
    }
  }

  @AssertTrue(message = "crafting.session.sweep-interval must be positive when sweeping is enabled")
  public boolean isSweepIntervalValid() {
    if (!sweepEnabled) {
      return true;
    }
    return sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative();
  }
}
