/*
 * Where: crafting domain model
 * What: Result of deleting a character, including how many requests were denied by the cascade
 */
package com.guildcraft.crafting.model;

public record CharacterDeletion(String characterName, int cancelledRequests) {}
