/*
 * Where: crafting service layer
 * What: Detects a second submission of the same request inside a short window
 * Why: Chat clients re-send on slow acknowledgements, which used to create twin requests
 */
package com.guildcraft.crafting.service;

import com.guildcraft.crafting.config.CraftingRequestProperties;
import com.guildcraft.crafting.model.DuplicateKey;
import com.guildcraft.crafting.repository.CraftRequestRepository;
import java.time.Clock;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Window check only. Callers that insert afterwards must hold the submission lock from {@link
 * CraftRequestRepository#lockSubmission(long)} so the check and the insert are not interleaved.
 */
@Component
@RequiredArgsConstructor
public class DuplicateGuard {

  private final CraftRequestRepository requestRepository;
  private final CraftingRequestProperties properties;
  private final Clock clock;

  public boolean isDuplicate(
      String requesterId,
      String characterName,
      String profession,
      String gearSlot,
      String itemId,
      Duration window) {
    return isDuplicate(
        new DuplicateKey(requesterId, characterName, profession, gearSlot, itemId), window);
  }

  public boolean isDuplicate(DuplicateKey key) {
    return isDuplicate(key, properties.duplicateWindow());
  }

  public boolean isDuplicate(DuplicateKey key, Duration window) {
    if (window == null || window.isZero() || window.isNegative()) {
      return false;
    }
    return requestRepository.existsCreatedSince(key, clock.instant().minus(window));
  }
}
