/*
 * Where: crafting service layer
 * What: The fixed table of allowed request status transitions
 * Why: Every writer checks edges here so the lifecycle only moves forward (or to denied)
 */
package com.guildcraft.crafting.service;

import com.guildcraft.crafting.model.RequestFailure;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.model.RequestStatus;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RequestStatusMachine {

  private static final Logger logger = LoggerFactory.getLogger(RequestStatusMachine.class);

  private static final Map<RequestStatus, Set<RequestStatus>> ALLOWED =
      new EnumMap<>(RequestStatus.class);

  static {
    ALLOWED.put(RequestStatus.OPEN, EnumSet.of(RequestStatus.CLAIMED, RequestStatus.DENIED));
    ALLOWED.put(
        RequestStatus.CLAIMED, EnumSet.of(RequestStatus.IN_PROGRESS, RequestStatus.DENIED));
    ALLOWED.put(
        RequestStatus.IN_PROGRESS, EnumSet.of(RequestStatus.COMPLETE, RequestStatus.DENIED));
    ALLOWED.put(RequestStatus.COMPLETE, EnumSet.noneOf(RequestStatus.class));
    ALLOWED.put(RequestStatus.DENIED, EnumSet.noneOf(RequestStatus.class));
  }

  public boolean canTransition(RequestStatus from, RequestStatus to) {
    if (from == null || to == null) {
      return false;
    }
    return ALLOWED.get(from).contains(to);
  }

  public Set<RequestStatus> allowedTargets(RequestStatus from) {
    return EnumSet.copyOf(ALLOWED.get(from));
  }

  public RequestOutcome<RequestStatus> validate(RequestStatus from, RequestStatus to) {
    if (!canTransition(from, to)) {
      return RequestOutcome.failure(
          RequestFailure.invalidTransition(from, to == null ? null : to.value()));
    }
    return RequestOutcome.success(to);
  }

  /**
   * Validates a transition whose target arrives as a raw status value.
   *
   * <p>Unknown and retired values (for example {@code cancelled}) fail closed.
   */
  public RequestOutcome<RequestStatus> validate(RequestStatus from, String rawTarget) {
    final Optional<RequestStatus> target = RequestStatus.parse(rawTarget);
    if (target.isEmpty()) {
      logger.warn("rejected unrecognized target status from={} to={}", from, rawTarget);
      return RequestOutcome.failure(RequestFailure.invalidTransition(from, rawTarget));
    }
    return validate(from, target.get());
  }
}
