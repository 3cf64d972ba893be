/*
 * Where: crafting service layer
 * What: Entry point for creating, reading and moving craft requests through their lifecycle
 * Why: Routes every status change through the guarded writers so the audit trail stays complete
 */
package com.guildcraft.crafting.service;

import static com.guildcraft.crafting.service.RequestAuditService.details;

import com.guildcraft.crafting.config.CraftingRequestProperties;
import com.guildcraft.crafting.model.CraftRequest;
import com.guildcraft.crafting.model.CrafterActivity;
import com.guildcraft.crafting.model.DuplicateKey;
import com.guildcraft.crafting.model.NewCraftRequest;
import com.guildcraft.crafting.model.ProfessionStatusCount;
import com.guildcraft.crafting.model.RequestFailure;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.model.RequestStatus;
import com.guildcraft.crafting.repository.CraftRequestRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CraftRequestService {

  private static final Logger logger = LoggerFactory.getLogger(CraftRequestService.class);

  static final String DEFAULT_DENY_REASON = "denied";
  static final String CHARACTER_DELETED_REASON = "character deleted";

  private final CraftRequestRepository requestRepository;
  private final RequestAuditService auditService;
  private final RequestStatusMachine statusMachine;
  private final ClaimService claimService;
  private final FulfillmentService fulfillmentService;
  private final DuplicateGuard duplicateGuard;
  private final DuplicateLockKeyGenerator lockKeyGenerator;
  private final CraftingRequestProperties properties;
  private final CraftingMetrics metrics;
  private final Clock clock;

  @Transactional
  public RequestOutcome<CraftRequest> create(NewCraftRequest request) {
    final RequestOutcome<CraftRequest> outcome = doCreate(request);
    metrics.recordOutcome("create", outcome);
    return outcome;
  }

  private RequestOutcome<CraftRequest> doCreate(NewCraftRequest request) {
    final Optional<RequestFailure> invalid = validate(request);
    if (invalid.isPresent()) {
      return RequestOutcome.failure(invalid.get());
    }
    final int quantity = request.quantityRequested() == null ? 1 : request.quantityRequested();
    final DuplicateKey key =
        new DuplicateKey(
            request.requesterId(),
            request.characterName(),
            request.profession(),
            request.gearSlot(),
            request.itemId());
    // Assumption: the advisory lock is held until commit, so a racing double-submit sees our row
    // in its window check.
    // Trade-off: unrelated submissions whose keys collide in 64 bits also wait on each other.
    requestRepository.lockSubmission(lockKeyGenerator.generate(key));
    if (duplicateGuard.isDuplicate(key)) {
      logger.info(
          "duplicate submission ignored requesterId={} itemId={}",
          request.requesterId(),
          request.itemId());
      return RequestOutcome.failure(RequestFailure.duplicateSubmission());
    }
    final Instant now = clock.instant();
    final CraftRequest created = requestRepository.insert(request, quantity, now);
    auditService.record(
        created.id(),
        RequestAuditService.ACTION_CREATED,
        request.requesterId(),
        details(
            "characterName", request.characterName(),
            "itemId", request.itemId(),
            "quantityRequested", quantity),
        now);
    logger.info(
        "request created requestId={} requesterId={} profession={} itemId={} quantity={}",
        created.id(),
        created.requesterId(),
        created.profession(),
        created.itemId(),
        quantity);
    return RequestOutcome.success(auditService.withTrail(created));
  }

  private Optional<RequestFailure> validate(NewCraftRequest request) {
    if (request == null) {
      return Optional.of(RequestFailure.missingField("request"));
    }
    final Map<String, String> required = new LinkedHashMap<>();
    required.put("requesterId", request.requesterId());
    required.put("characterName", request.characterName());
    required.put("profession", request.profession());
    required.put("gearSlot", request.gearSlot());
    required.put("itemId", request.itemId());
    required.put("itemLabel", request.itemLabel());
    for (Map.Entry<String, String> field : required.entrySet()) {
      if (field.getValue() == null || field.getValue().isBlank()) {
        return Optional.of(RequestFailure.missingField(field.getKey()));
      }
    }
    if (request.quantityRequested() != null && request.quantityRequested() < 1) {
      return Optional.of(
          RequestFailure.invalidField("quantityRequested", "quantityRequested must be at least 1"));
    }
    final Optional<RequestFailure> invalidMaterials =
        validateMaterials("materialsRequired", request.materialsRequired());
    if (invalidMaterials.isPresent()) {
      return invalidMaterials;
    }
    return validateMaterials(
        "materialsProvidedByRequester", request.materialsProvidedByRequester());
  }

  private Optional<RequestFailure> validateMaterials(String field, Map<String, Integer> materials) {
    if (materials == null) {
      return Optional.empty();
    }
    for (Map.Entry<String, Integer> material : materials.entrySet()) {
      if (material.getKey() == null
          || material.getKey().isBlank()
          || material.getValue() == null
          || material.getValue() < 0) {
        return Optional.of(
            RequestFailure.invalidField(field, field + " needs non-negative counts per material"));
      }
    }
    return Optional.empty();
  }

  public Optional<CraftRequest> findById(long requestId) {
    return auditService.withTrail(requestRepository.findById(requestId));
  }

  /**
   * Lists a requester's requests, most recently updated first.
   *
   * @param statuses filter; {@code null} or empty means every status
   * @param limit page size; non-positive values fall back to {@code crafting.request.default-list-limit}
   */
  public List<CraftRequest> findByRequester(
      String requesterId, Collection<RequestStatus> statuses, int limit) {
    final int effectiveLimit = limit <= 0 ? properties.defaultListLimit() : limit;
    return auditService.withTrails(
        requestRepository.findByRequester(requesterId, orAll(statuses), effectiveLimit));
  }

  public List<CraftRequest> findByProfession(
      String profession, Collection<RequestStatus> statuses) {
    return auditService.withTrails(
        requestRepository.findByProfession(profession, orAll(statuses)));
  }

  /** The open queue of one profession, oldest request first. */
  public List<CraftRequest> findOpenQueue(String profession) {
    return auditService.withTrails(requestRepository.findOpenByProfessionOldestFirst(profession));
  }

  public List<CraftRequest> findClaimedBy(String crafterId) {
    return auditService.withTrails(requestRepository.findClaimedBy(crafterId));
  }

  public List<CraftRequest> findByCharacter(String characterName) {
    return auditService.withTrails(requestRepository.findByCharacter(characterName));
  }

  public List<ProfessionStatusCount> summarizeActiveWork() {
    return requestRepository.summarizeActive();
  }

  public List<CrafterActivity> crafterActivity() {
    return requestRepository.crafterActivity();
  }

  /**
   * Moves a request to the status named by {@code newStatus}.
   *
   * <p>{@code open} is never a valid target here; use {@link ClaimService#release} or {@link
   * #reopen} instead.
   *
   * @param reason only used for {@code denied}
   */
  @Transactional
  public RequestOutcome<CraftRequest> transition(
      long requestId, String actorId, String newStatus, String reason) {
    final Optional<RequestStatus> target = RequestStatus.parse(newStatus);
    if (target.isEmpty()) {
      return rejectTarget(requestId, newStatus);
    }
    return transition(requestId, actorId, target.get(), reason);
  }

  @Transactional
  public RequestOutcome<CraftRequest> transition(
      long requestId, String actorId, RequestStatus newStatus, String reason) {
    return switch (newStatus) {
      case CLAIMED -> claimService.claim(requestId, actorId, actorId);
      case IN_PROGRESS -> claimService.start(requestId, actorId);
      case COMPLETE -> fulfillmentService.applyCompletion(requestId, actorId, null);
      case DENIED -> deny(requestId, actorId, reason);
      case OPEN -> rejectTarget(requestId, newStatus.value());
    };
  }

  private RequestOutcome<CraftRequest> rejectTarget(long requestId, String rawTarget) {
    final Optional<CraftRequest> current = requestRepository.findById(requestId);
    if (current.isEmpty()) {
      return RequestOutcome.failure(notFound(requestId));
    }
    final RequestStatus from = current.get().status();
    final RequestOutcome<RequestStatus> check = statusMachine.validate(from, rawTarget);
    return RequestOutcome.failure(
        check.failure().orElseGet(() -> RequestFailure.invalidTransition(from, rawTarget)));
  }

  /** Denies a non-terminal request, clearing any claim. */
  @Transactional
  public RequestOutcome<CraftRequest> deny(long requestId, String actorId, String reason) {
    final RequestOutcome<CraftRequest> outcome = doDeny(requestId, actorId, reason);
    metrics.recordOutcome("deny", outcome);
    return outcome;
  }

  private RequestOutcome<CraftRequest> doDeny(long requestId, String actorId, String reason) {
    if (isBlank(actorId)) {
      return RequestOutcome.failure(RequestFailure.missingField("actorId"));
    }
    final Optional<CraftRequest> locked = requestRepository.lockById(requestId);
    if (locked.isEmpty()) {
      return RequestOutcome.failure(notFound(requestId));
    }
    final CraftRequest current = locked.get();
    final RequestOutcome<RequestStatus> check =
        statusMachine.validate(current.status(), RequestStatus.DENIED);
    if (!check.isSuccess()) {
      return RequestOutcome.failure(check.failure().orElseThrow());
    }
    final String effectiveReason = isBlank(reason) ? DEFAULT_DENY_REASON : reason;
    final Instant now = clock.instant();
    final CraftRequest denied =
        requestRepository
            .denyIfActive(requestId, effectiveReason, now)
            .orElseThrow(
                () -> new IllegalStateException("locked request changed: requestId=" + requestId));
    auditService.record(
        requestId,
        RequestAuditService.ACTION_DENIED,
        actorId,
        details(
            "reason", effectiveReason,
            "previousStatus", current.status().value(),
            "previousClaimant", current.claimedBy()),
        now);
    logger.info(
        "request denied requestId={} actorId={} reason={}", requestId, actorId, effectiveReason);
    return RequestOutcome.success(auditService.withTrail(denied));
  }

  /** Administrative override: puts a request of any status back into the open pool. */
  @Transactional
  public RequestOutcome<CraftRequest> reopen(long requestId, String adminId) {
    final RequestOutcome<CraftRequest> outcome = doReopen(requestId, adminId);
    metrics.recordOutcome("reopen", outcome);
    return outcome;
  }

  private RequestOutcome<CraftRequest> doReopen(long requestId, String adminId) {
    if (isBlank(adminId)) {
      return RequestOutcome.failure(RequestFailure.missingField("adminId"));
    }
    final Optional<CraftRequest> locked = requestRepository.lockById(requestId);
    if (locked.isEmpty()) {
      return RequestOutcome.failure(notFound(requestId));
    }
    final CraftRequest current = locked.get();
    final Instant now = clock.instant();
    final CraftRequest reopened =
        requestRepository
            .reopen(requestId, now)
            .orElseThrow(
                () -> new IllegalStateException("locked request vanished: requestId=" + requestId));
    auditService.record(
        requestId,
        RequestAuditService.ACTION_REOPENED,
        adminId,
        details(
            "previousStatus", current.status().value(),
            "previousClaimant", current.claimedBy()),
        now);
    logger.info(
        "request reopened requestId={} adminId={} previousStatus={}",
        requestId,
        adminId,
        current.status().value());
    return RequestOutcome.success(auditService.withTrail(reopened));
  }

  /** See {@link ClaimService#reassign}. */
  public RequestOutcome<CraftRequest> reassign(
      long requestId, String adminId, String crafterId, String crafterDisplayName) {
    return claimService.reassign(requestId, adminId, crafterId, crafterDisplayName);
  }

  public RequestOutcome<CraftRequest> claim(
      long requestId, String crafterId, String crafterDisplayName) {
    return claimService.claim(requestId, crafterId, crafterDisplayName);
  }

  public RequestOutcome<CraftRequest> release(long requestId, String actorId) {
    return claimService.release(requestId, actorId);
  }

  public RequestOutcome<CraftRequest> applyCompletion(
      long requestId, String actorId, Integer amount) {
    return fulfillmentService.applyCompletion(requestId, actorId, amount);
  }

  public RequestOutcome<CraftRequest> appendAudit(
      long requestId, String action, String actorId, Map<String, ?> details) {
    return auditService.append(requestId, action, actorId, details);
  }

  /**
   * Denies every non-terminal request placed for a character that is being deleted.
   *
   * @param actorId who deleted the character; blank means the requester did
   * @return number of requests denied
   */
  @Transactional
  public int cascadeDeleteCharacter(String requesterId, String characterName, String actorId) {
    final String actor = isBlank(actorId) ? requesterId : actorId;
    final Instant now = clock.instant();
    final List<CraftRequest> denied =
        requestRepository.denyActiveForCharacter(
            requesterId, characterName, CHARACTER_DELETED_REASON, now);
    for (CraftRequest request : denied) {
      auditService.record(
          request.id(),
          RequestAuditService.ACTION_CANCELLED_CHARACTER_DELETED,
          actor,
          details("reason", CHARACTER_DELETED_REASON, "characterName", characterName),
          now);
    }
    logger.info(
        "character cascade requesterId={} characterName={} denied={}",
        requesterId,
        characterName,
        denied.size());
    return denied.size();
  }

  @Transactional
  public int cascadeDeleteCharacter(String requesterId, String characterName) {
    return cascadeDeleteCharacter(requesterId, characterName, requesterId);
  }

  private static Collection<RequestStatus> orAll(Collection<RequestStatus> statuses) {
    if (statuses == null || statuses.isEmpty()) {
      return EnumSet.allOf(RequestStatus.class);
    }
    return statuses;
  }

  private static RequestFailure notFound(long requestId) {
    return RequestFailure.notFound("request " + requestId + " not found");
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
