/*
 * Where: crafting domain model
 * What: One immutable line of a request's audit trail
 * Why: The trail is the only record of who changed a request and when
 */
package com.guildcraft.crafting.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AuditEntry(
    long sequence, String action, String actorId, Instant at, Map<String, Object> details) {

  public AuditEntry {
    // Free-form details may carry JSON nulls, which Map.copyOf rejects.
    details =
        details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }
}
