/*
 * Where: crafting service layer
 * What: Registers, lists and deletes the characters a guild member crafts for
 * Why: Deleting a character must also retire the requests still waiting on it
 */
package com.guildcraft.crafting.service;

import com.guildcraft.crafting.model.CharacterDeletion;
import com.guildcraft.crafting.model.CharacterKind;
import com.guildcraft.crafting.model.CharacterRecord;
import com.guildcraft.crafting.model.RequestFailure;
import com.guildcraft.crafting.model.RequestOutcome;
import com.guildcraft.crafting.repository.CharacterRepository;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CharacterService {

  private static final Logger logger = LoggerFactory.getLogger(CharacterService.class);

  private final CharacterRepository characterRepository;
  private final CraftRequestService craftRequestService;
  private final Clock clock;

  @Transactional
  public RequestOutcome<CharacterRecord> register(String ownerId, String name, String kind) {
    if (ownerId == null || ownerId.isBlank()) {
      return RequestOutcome.failure(RequestFailure.missingField("ownerId"));
    }
    if (name == null || name.isBlank()) {
      return RequestOutcome.failure(RequestFailure.missingField("name"));
    }
    final CharacterKind characterKind;
    try {
      characterKind = CharacterKind.fromValue(kind);
    } catch (IllegalArgumentException ex) {
      return RequestOutcome.failure(RequestFailure.invalidField("kind", ex.getMessage()));
    }
    final CharacterRecord created =
        characterRepository.insert(ownerId, name.trim(), characterKind, clock.instant());
    logger.info(
        "character registered characterId={} ownerId={} kind={}",
        created.characterId(),
        ownerId,
        characterKind.value());
    return RequestOutcome.success(created);
  }

  public List<CharacterRecord> listByOwner(String ownerId) {
    return characterRepository.findByOwner(ownerId);
  }

  /** Deletes an owned character and denies its non-terminal requests in one transaction. */
  @Transactional
  public RequestOutcome<CharacterDeletion> delete(String ownerId, long characterId) {
    final Optional<CharacterRecord> character =
        characterRepository.findOwned(ownerId, characterId);
    if (character.isEmpty()) {
      return RequestOutcome.failure(
          RequestFailure.notFound("character " + characterId + " not found"));
    }
    final String name = character.get().name();
    final int cancelled = craftRequestService.cascadeDeleteCharacter(ownerId, name, ownerId);
    characterRepository.delete(ownerId, characterId);
    logger.info(
        "character deleted characterId={} ownerId={} cancelledRequests={}",
        characterId,
        ownerId,
        cancelled);
    return RequestOutcome.success(new CharacterDeletion(name, cancelled));
  }
}
