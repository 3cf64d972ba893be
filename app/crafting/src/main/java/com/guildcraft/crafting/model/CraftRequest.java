/*
 * Where: crafting domain model
 * What: Snapshot of a craft request together with its audit trail
 * Why: Read paths and command results share one immutable view of the row
 */
package com.guildcraft.crafting.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CraftRequest(
    long id,
    String requesterId,
    String characterName,
    String profession,
    String gearSlot,
    String itemId,
    String itemLabel,
    int quantityRequested,
    int quantityCompleted,
    Map<String, Integer> materialsRequired,
    Map<String, Integer> materialsProvidedByRequester,
    boolean requesterProvidesMaterials,
    RequestStatus status,
    String claimedBy,
    String claimedByDisplayName,
    Instant claimedAt,
    String completedBy,
    String denyReason,
    List<AuditEntry> auditTrail,
    Instant createdAt,
    Instant updatedAt) {

  public CraftRequest {
    materialsRequired = materialsRequired == null ? Map.of() : Map.copyOf(materialsRequired);
    materialsProvidedByRequester =
        materialsProvidedByRequester == null ? Map.of() : Map.copyOf(materialsProvidedByRequester);
    auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
  }

  public int quantityRemaining() {
    return Math.max(0, quantityRequested - quantityCompleted);
  }

  public CraftRequest withAuditTrail(List<AuditEntry> trail) {
    return new CraftRequest(
        id,
        requesterId,
        characterName,
        profession,
        gearSlot,
        itemId,
        itemLabel,
        quantityRequested,
        quantityCompleted,
        materialsRequired,
        materialsProvidedByRequester,
        requesterProvidesMaterials,
        status,
        claimedBy,
        claimedByDisplayName,
        claimedAt,
        completedBy,
        denyReason,
        trail,
        createdAt,
        updatedAt);
  }
}
