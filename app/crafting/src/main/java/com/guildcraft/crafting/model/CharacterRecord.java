/*
 * Where: crafting domain model
 * What: Snapshot of a row in the characters table
 */
package com.guildcraft.crafting.model;

import java.time.Instant;

public record CharacterRecord(
    long characterId, String ownerId, String name, CharacterKind kind, Instant createdAt) {}
