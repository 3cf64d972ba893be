/*
 * Where: crafting domain model
 * What: Per-crafter workload summary for the admin overview
 */
package com.guildcraft.crafting.model;

import java.time.Instant;
import java.util.List;

public record CrafterActivity(
    String crafterId,
    String displayName,
    List<String> professions,
    long activeCount,
    long completedCount,
    Instant lastActivity) {

  public CrafterActivity {
    professions = professions == null ? List.of() : List.copyOf(professions);
  }
}
