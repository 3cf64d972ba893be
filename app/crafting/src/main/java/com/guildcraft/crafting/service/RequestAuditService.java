/*
 * Where: crafting service layer
 * What: Appends to and reads back the per-request audit trail
 * Why: Moderators reconstruct who did what from this history, so entries are never rewritten
 */
package com.guildcraft.crafting.service;

import com.guildcraft.crafting.model.AuditEntry;
import com.guildcraft.crafting.model.CraftRequest;
import com.guildcraft.crafting.model.RequestFailure;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.repository.CraftRequestRepository;
import com.guildcraft.crafting.repository.RequestAuditRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class RequestAuditService {

  public static final String ACTION_CREATED = "created";
  public static final String ACTION_CLAIMED = "claimed";
  public static final String ACTION_RELEASED = "released";
  public static final String ACTION_STARTED = "started";
  public static final String ACTION_PARTIAL_COMPLETED = "partial_completed";
  public static final String ACTION_COMPLETED = "completed";
  public static final String ACTION_DENIED = "denied";
  public static final String ACTION_REOPENED = "reopened";
  public static final String ACTION_REASSIGNED = "reassigned";
  public static final String ACTION_CANCELLED_CHARACTER_DELETED = "cancelled_character_deleted";

  private final RequestAuditRepository auditRepository;
  private final CraftRequestRepository requestRepository;
  private final Clock clock;

  /**
   * Appends a free-form entry to an existing request and bumps its {@code updatedAt}.
   *
   * @return the request with its full trail, or NOT_FOUND when no such request exists
   */
  @Transactional
  public RequestOutcome<CraftRequest> append(
      long requestId, String action, String actorId, Map<String, ?> details) {
    if (action == null || action.isBlank()) {
      return RequestOutcome.failure(RequestFailure.missingField("action"));
    }
    if (actorId == null || actorId.isBlank()) {
      return RequestOutcome.failure(RequestFailure.missingField("actorId"));
    }
    final Instant now = clock.instant();
    if (auditRepository.append(requestId, action, actorId, now, details) == 0) {
      return RequestOutcome.failure(RequestFailure.notFound("request " + requestId + " not found"));
    }
    requestRepository.touch(requestId, now);
    return requestRepository
        .findById(requestId)
        .map(request -> RequestOutcome.success(withTrail(request)))
        .orElseGet(
            () ->
                RequestOutcome.failure(
                    RequestFailure.notFound("request " + requestId + " not found")));
  }

  /** Records an entry for a write the caller has just made in the same transaction. */
  @Transactional(propagation = Propagation.MANDATORY)
  public void record(
      long requestId, String action, String actorId, Map<String, ?> details, Instant at) {
    if (auditRepository.append(requestId, action, actorId, at, details) == 0) {
      throw new IllegalStateException(
          "audit target vanished inside its own transaction: requestId=" + requestId);
    }
  }

  public List<AuditEntry> trailOf(long requestId) {
    return auditRepository.findByRequestId(requestId);
  }

  public CraftRequest withTrail(CraftRequest request) {
    return request.withAuditTrail(trailOf(request.id()));
  }

  public Optional<CraftRequest> withTrail(Optional<CraftRequest> request) {
    return request.map(this::withTrail);
  }

  public List<CraftRequest> withTrails(List<CraftRequest> requests) {
    if (requests.isEmpty()) {
      return requests;
    }
    final Map<Long, List<AuditEntry>> trails =
        auditRepository.findByRequestIds(requests.stream().map(CraftRequest::id).toList());
    return requests.stream()
        .map(request -> request.withAuditTrail(trails.getOrDefault(request.id(), List.of())))
        .toList();
  }

  /** Builds audit details from key/value pairs, dropping pairs whose value is null. */
  static Map<String, Object> details(Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("details need key/value pairs");
    }
    final Map<String, Object> details = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      if (keyValues[i + 1] != null) {
        details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
      }
    }
    return details;
  }
}
