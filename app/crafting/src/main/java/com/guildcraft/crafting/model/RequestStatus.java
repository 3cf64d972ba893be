/*
 * Where: crafting domain model
 * What: Lifecycle states of a craft request
 * Why: Keeps the persisted status values and the transition table in one type
 */
package com.guildcraft.crafting.model;

import java.util.Optional;

public enum RequestStatus {
  OPEN("open"),
  CLAIMED("claimed"),
  IN_PROGRESS("in_progress"),
  COMPLETE("complete"),
  DENIED("denied");

  private final String value;

  RequestStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETE || this == DENIED;
  }

  public boolean holdsClaim() {
    return this == CLAIMED || this == IN_PROGRESS;
  }

  /**
   * Parses a persisted or caller-supplied status value.
   *
   * <p>Matching is exact: no case folding and no trimming. Retired values such as {@code
   * cancelled} are not mapped onto a current status.
   */
  public static Optional<RequestStatus> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (RequestStatus status : values()) {
      if (status.value.equals(value)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }

  public static RequestStatus fromValue(String value) {
    return parse(value)
        .orElseThrow(() -> new IllegalArgumentException("unsupported request status: " + value));
  }
}
