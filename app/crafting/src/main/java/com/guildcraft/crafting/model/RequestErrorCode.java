/*
 * Where: crafting domain model
 * What: Codes for the business failures a crafting command can report
 * Why: Callers branch on the cause without parsing messages
 */
package com.guildcraft.crafting.model;

public enum RequestErrorCode {
  NOT_FOUND,
  INVALID_TRANSITION,
  ALREADY_CLAIMED,
  NOT_CLAIMED,
  EXCEEDS_REQUESTED,
  MISSING_FIELD,
  INVALID_FIELD,
  DUPLICATE_SUBMISSION
}
