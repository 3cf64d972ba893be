/*
 * Where: crafting domain model
 * What: Half-finished request composition held between chat interactions
 */
package com.guildcraft.crafting.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record CompositionSession(
    String key, String ownerId, JsonNode data, Instant createdAt, Instant expiresAt) {

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }
}
