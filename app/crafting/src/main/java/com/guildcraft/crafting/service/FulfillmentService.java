/*
 * Where: crafting service layer
 * What: Records crafting progress against an in-progress request
 * Why: Partial deliveries accumulate and must never push the completed count past the request
 */
package com.guildcraft.crafting.service;

import static com.guildcraft.crafting.service.RequestAuditService.details;

import com.guildcraft.crafting.model.CraftRequest;
import com.guildcraft.crafting.model.RequestFailure;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.repository.CraftRequestRepository;
import com.guildcraft.crafting.service.FulfillmentCalculator.Progress;
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
public class FulfillmentService {

  private static final Logger logger = LoggerFactory.getLogger(FulfillmentService.class);

  private static final String ACTION_COMPLETE = "complete";

  private final CraftRequestRepository requestRepository;
  private final RequestAuditService auditService;
  private final FulfillmentCalculator calculator;
  private final CraftingMetrics metrics;
  private final Clock clock;

  /**
   * Applies a completion report to a request that is {@code in_progress}.
   *
   * @param amount items finished now; {@code null} marks the whole request complete
   */
  @Transactional
  public RequestOutcome<CraftRequest> applyCompletion(
      long requestId, String actorId, Integer amount) {
    final RequestOutcome<CraftRequest> outcome = doApply(requestId, actorId, amount);
    metrics.recordOutcome(ACTION_COMPLETE, outcome);
    return outcome;
  }

  private RequestOutcome<CraftRequest> doApply(long requestId, String actorId, Integer amount) {
    if (actorId == null || actorId.isBlank()) {
      return RequestOutcome.failure(RequestFailure.missingField("actorId"));
    }
    // Row lock serializes concurrent reports so no increment is lost.
    final Optional<CraftRequest> locked = requestRepository.lockById(requestId);
    if (locked.isEmpty()) {
      return RequestOutcome.failure(
          RequestFailure.notFound("request " + requestId + " not found"));
    }
    final CraftRequest current = locked.get();
    final RequestOutcome<Progress> decision = calculator.apply(current, amount);
    if (!decision.isSuccess()) {
      return RequestOutcome.failure(decision.failure().orElseThrow());
    }
    final Progress progress = decision.orElseThrow();
    final Instant now = clock.instant();
    final CraftRequest updated =
        requestRepository
            .applyProgress(
                requestId,
                current.quantityCompleted(),
                progress.newCompleted(),
                progress.newStatus(),
                progress.completes() ? actorId : null,
                now)
            .orElseThrow(
                () -> new IllegalStateException("locked request changed: requestId=" + requestId));
    final String action =
        progress.completes()
            ? RequestAuditService.ACTION_COMPLETED
            : RequestAuditService.ACTION_PARTIAL_COMPLETED;
    auditService.record(
        requestId,
        action,
        actorId,
        details(
            "added", progress.added(),
            "reported", progress.reported(),
            "totalCompleted", progress.newCompleted(),
            "quantityRequested", current.quantityRequested(),
            "status", progress.newStatus().value()),
        now);
    logger.info(
        "request progress requestId={} added={} total={}/{} status={}",
        requestId,
        progress.added(),
        progress.newCompleted(),
        current.quantityRequested(),
        progress.newStatus().value());
    return RequestOutcome.success(auditService.withTrail(updated));
  }
}
