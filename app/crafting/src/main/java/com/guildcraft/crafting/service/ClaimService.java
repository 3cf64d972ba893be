/*
 * Where: crafting service layer
 * What: Claims, releases and reassigns craft requests
 * Why: Two crafters clicking "claim" at once must never both win
 */
package com.guildcraft.crafting.service;

import static com.guildcraft.crafting.service.RequestAuditService.details;

import com.guildcraft.crafting.model.CraftRequest;
import com.guildcraft.crafting.model.RequestFailure;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.model.RequestStatus;
import com.guildcraft.crafting.repository.CraftRequestRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ClaimService {

  private static final Logger logger = LoggerFactory.getLogger(ClaimService.class);

  private static final String ACTION_CLAIM = "claim";
  private static final String ACTION_RELEASE = "release";
  private static final String ACTION_REASSIGN = "reassign";

  private final CraftRequestRepository requestRepository;
  private final RequestAuditService auditService;
  private final RequestStatusMachine statusMachine;
  private final CraftingMetrics metrics;
  private final Clock clock;

  /**
   * Claims an open request for a crafter.
   *
   * <p>The status check and the write are one conditional UPDATE, so a concurrent claimer that
   * loses sees ALREADY_CLAIMED rather than overwriting the winner.
   */
  @Transactional
  public RequestOutcome<CraftRequest> claim(
      long requestId, String crafterId, String crafterDisplayName) {
    final RequestOutcome<CraftRequest> outcome =
        doClaim(requestId, crafterId, crafterDisplayName);
    metrics.recordOutcome(ACTION_CLAIM, outcome);
    return outcome;
  }

  private RequestOutcome<CraftRequest> doClaim(
      long requestId, String crafterId, String crafterDisplayName) {
    if (isBlank(crafterId)) {
      return RequestOutcome.failure(RequestFailure.missingField("crafterId"));
    }
    final String displayName = isBlank(crafterDisplayName) ? crafterId : crafterDisplayName;
    final Instant now = clock.instant();
    final Optional<CraftRequest> claimed =
        requestRepository.claimIfOpen(requestId, crafterId, displayName, now);
    if (claimed.isEmpty()) {
      return rejectClaim(requestId, crafterId);
    }
    auditService.record(
        requestId,
        RequestAuditService.ACTION_CLAIMED,
        crafterId,
        details("displayName", displayName),
        now);
    logger.info("request claimed requestId={} crafterId={}", requestId, crafterId);
    return RequestOutcome.success(auditService.withTrail(claimed.get()));
  }

  private RequestOutcome<CraftRequest> rejectClaim(long requestId, String crafterId) {
    final Optional<CraftRequest> current = requestRepository.findById(requestId);
    if (current.isEmpty()) {
      return RequestOutcome.failure(notFound(requestId));
    }
    final RequestStatus status = current.get().status();
    if (status.holdsClaim()) {
      logger.info(
          "claim lost requestId={} crafterId={} holder={}",
          requestId,
          crafterId,
          current.get().claimedBy());
      return RequestOutcome.failure(RequestFailure.alreadyClaimed(requestId, status));
    }
    return RequestOutcome.failure(RequestFailure.invalidTransition(status, RequestStatus.CLAIMED));
  }

  /** Returns a claimed or in-progress request to the open pool. */
  @Transactional
  public RequestOutcome<CraftRequest> release(long requestId, String actorId) {
    final RequestOutcome<CraftRequest> outcome = doRelease(requestId, actorId);
    metrics.recordOutcome(ACTION_RELEASE, outcome);
    return outcome;
  }

  private RequestOutcome<CraftRequest> doRelease(long requestId, String actorId) {
    if (isBlank(actorId)) {
      return RequestOutcome.failure(RequestFailure.missingField("actorId"));
    }
    final Optional<CraftRequest> locked = requestRepository.lockById(requestId);
    if (locked.isEmpty()) {
      return RequestOutcome.failure(notFound(requestId));
    }
    final CraftRequest current = locked.get();
    if (!current.status().holdsClaim()) {
      return RequestOutcome.failure(RequestFailure.notClaimed(requestId, current.status()));
    }
    final Instant now = clock.instant();
    final CraftRequest released =
        requestRepository
            .releaseIfClaimed(requestId, now)
            .orElseThrow(
                () -> new IllegalStateException("locked request changed: requestId=" + requestId));
    auditService.record(
        requestId,
        RequestAuditService.ACTION_RELEASED,
        actorId,
        details(
            "previousClaimant", current.claimedBy(),
            "previousStatus", current.status().value()),
        now);
    logger.info(
        "request released requestId={} previousClaimant={} actorId={}",
        requestId,
        current.claimedBy(),
        actorId);
    return RequestOutcome.success(auditService.withTrail(released));
  }

  /**
   * Administrative override: hands a non-terminal request to another crafter.
   *
   * <p>The request lands in {@code claimed} whatever its previous non-terminal status was.
   */
  @Transactional
  public RequestOutcome<CraftRequest> reassign(
      long requestId, String adminId, String crafterId, String crafterDisplayName) {
    final RequestOutcome<CraftRequest> outcome =
        doReassign(requestId, adminId, crafterId, crafterDisplayName);
    metrics.recordOutcome(ACTION_REASSIGN, outcome);
    return outcome;
  }

  private RequestOutcome<CraftRequest> doReassign(
      long requestId, String adminId, String crafterId, String crafterDisplayName) {
    if (isBlank(adminId)) {
      return RequestOutcome.failure(RequestFailure.missingField("adminId"));
    }
    if (isBlank(crafterId)) {
      return RequestOutcome.failure(RequestFailure.missingField("crafterId"));
    }
    final Optional<CraftRequest> locked = requestRepository.lockById(requestId);
    if (locked.isEmpty()) {
      return RequestOutcome.failure(notFound(requestId));
    }
    final CraftRequest current = locked.get();
    if (current.status().isTerminal()) {
      return RequestOutcome.failure(
          RequestFailure.invalidTransition(current.status(), RequestStatus.CLAIMED));
    }
    final String displayName = isBlank(crafterDisplayName) ? crafterId : crafterDisplayName;
    final Instant now = clock.instant();
    final CraftRequest reassigned =
        requestRepository
            .reassignIfActive(requestId, crafterId, displayName, now)
            .orElseThrow(
                () -> new IllegalStateException("locked request changed: requestId=" + requestId));
    auditService.record(
        requestId,
        RequestAuditService.ACTION_REASSIGNED,
        adminId,
        details(
            "previousClaimant", current.claimedBy(),
            "previousStatus", current.status().value(),
            "newClaimant", crafterId),
        now);
    logger.info(
        "request reassigned requestId={} from={} to={} adminId={}",
        requestId,
        current.claimedBy(),
        crafterId,
        adminId);
    return RequestOutcome.success(auditService.withTrail(reassigned));
  }

  /**
   * Moves a claimed request to {@code in_progress}.
   *
   * <p>Only the status changes; the claimant stays as it is.
   */
  @Transactional
  public RequestOutcome<CraftRequest> start(long requestId, String actorId) {
    final RequestOutcome<CraftRequest> outcome = doStart(requestId, actorId);
    metrics.recordOutcome("start", outcome);
    return outcome;
  }

  private RequestOutcome<CraftRequest> doStart(long requestId, String actorId) {
    if (isBlank(actorId)) {
      return RequestOutcome.failure(RequestFailure.missingField("actorId"));
    }
    final Instant now = clock.instant();
    final Optional<CraftRequest> started = requestRepository.startIfClaimed(requestId, now);
    if (started.isEmpty()) {
      return rejectTransition(requestId, RequestStatus.IN_PROGRESS);
    }
    auditService.record(requestId, RequestAuditService.ACTION_STARTED, actorId, details(), now);
    logger.info("request started requestId={} actorId={}", requestId, actorId);
    return RequestOutcome.success(auditService.withTrail(started.get()));
  }

  private RequestOutcome<CraftRequest> rejectTransition(long requestId, RequestStatus target) {
    return requestRepository
        .findById(requestId)
        .map(
            current -> {
              final RequestOutcome<RequestStatus> check =
                  statusMachine.validate(current.status(), target);
              // Allowed edge but the write missed: the row moved underneath us.
              final RequestFailure failure =
                  check
                      .failure()
                      .orElseGet(() -> RequestFailure.invalidTransition(current.status(), target));
              return RequestOutcome.<CraftRequest>failure(failure);
            })
        .orElseGet(() -> RequestOutcome.failure(notFound(requestId)));
  }

  private static RequestFailure notFound(long requestId) {
    return RequestFailure.notFound("request " + requestId + " not found");
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
