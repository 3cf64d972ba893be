/*
 * Where: crafting service layer
 * What: Decides the next quantity and status when a crafter reports progress
 * Why: Kept free of I/O so the clamping rules can be checked against any snapshot
 */
package com.guildcraft.crafting.service;

import com.guildcraft.crafting.model.CraftRequest;
import com.guildcraft.crafting.model.RequestFailure;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.model.RequestStatus;
import org.springframework.stereotype.Component;

@Component
public class FulfillmentCalculator {

  /**
   * Computes the effect of a completion report.
   *
   * @param amount items finished in this report, or {@code null} to finish the whole request
   */
  public RequestOutcome<Progress> apply(CraftRequest snapshot, Integer amount) {
    if (snapshot.status() != RequestStatus.IN_PROGRESS) {
      return RequestOutcome.failure(
          RequestFailure.invalidTransition(snapshot.status(), RequestStatus.COMPLETE));
    }
    final int requested = snapshot.quantityRequested();
    final int completed = snapshot.quantityCompleted();
    if (completed < 0 || completed > requested) {
      return RequestOutcome.failure(
          RequestFailure.exceedsRequested(snapshot.id(), completed, requested));
    }
    if (amount == null) {
      return RequestOutcome.success(
          new Progress(
              null, snapshot.quantityRemaining(), requested, RequestStatus.COMPLETE));
    }
    if (amount <= 0) {
      return RequestOutcome.failure(
          RequestFailure.invalidField("amount", "amount must be at least 1"));
    }
    // long arithmetic: a huge amount must clamp, not wrap around.
    final int newCompleted = (int) Math.min(requested, (long) completed + amount);
    final RequestStatus newStatus =
        newCompleted == requested ? RequestStatus.COMPLETE : RequestStatus.IN_PROGRESS;
    return RequestOutcome.success(
        new Progress(amount, newCompleted - completed, newCompleted, newStatus));
  }

  /**
   * @param reported amount the crafter entered, {@code null} for "mark complete"
   * @param added how much quantityCompleted actually grew after clamping
   */
  public record Progress(Integer reported, int added, int newCompleted, RequestStatus newStatus) {

    public boolean completes() {
      return newStatus == RequestStatus.COMPLETE;
    }
  }
}
