/*
 * Where: crafting domain model
 * What: Main / alt classification of a registered character
 */
package com.guildcraft.crafting.model;

public enum CharacterKind {
  MAIN("main"),
  ALT("alt");

  private final String value;

  CharacterKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static CharacterKind fromValue(String kind) {
    for (CharacterKind characterKind : values()) {
      if (characterKind.value.equalsIgnoreCase(kind)) {
        return characterKind;
      }
    }
    throw new IllegalArgumentException("unsupported character kind: " + kind);
  }
}
