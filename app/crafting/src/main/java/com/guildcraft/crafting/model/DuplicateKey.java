/*
 * Where: crafting domain model
 * What: The tuple that identifies a repeated submission
 */
package com.guildcraft.crafting.model;

public record DuplicateKey(
    String requesterId, String characterName, String profession, String gearSlot, String itemId) {

  // Unit separator keeps "a|b" + "c" apart from "a" + "b|c".
  public String canonical() {
    return String.join("\u001f", requesterId, characterName, profession, gearSlot, itemId);
  }
}
