/*
 * Where: crafting service layer
 * What: Collects the application metrics recorded by crafting commands and sessions
 * Why: Lets operators watch claim contention and rejection rates next to session volume
 */
package com.guildcraft.crafting.service;

import com.guildcraft.crafting.model.RequestOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class CraftingMetrics {

  private static final String METRIC_COMMAND_TOTAL = "crafting.request.command.total";
  private static final String METRIC_SESSION_ACTIVE = "crafting.session.active";
  static final String RESULT_SUCCESS = "success";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeSessions = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();

  public CraftingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_SESSION_ACTIVE, activeSessions, AtomicInteger::get)
        .description("Composition sessions currently held in memory")
        .register(meterRegistry);
  }

  public void recordCommand(String action, String result) {
    final String key = action + ":" + result;
    commandCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("Craft request command executions")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  /** Counts the outcome under {@code success} or the lower-cased failure code. */
  public void recordOutcome(String action, RequestOutcome<?> outcome) {
    final String result =
        outcome.isSuccess() ? RESULT_SUCCESS : outcome.errorCode().name().toLowerCase(Locale.ROOT);
    recordCommand(action, result);
  }

  public void updateActiveSessions(int count) {
    activeSessions.set(Math.max(count, 0));
  }
}
