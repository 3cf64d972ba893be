/*
 * Where: crafting domain model
 * What: Describes why a crafting command was rejected
 * Why: fromStatus/toStatus and field carry the structured part of the failure for rendering
 */
package com.guildcraft.crafting.model;

public record RequestFailure(
    RequestErrorCode code,
    String message,
    RequestStatus fromStatus,
    String toStatus,
    String field) {

  public static RequestFailure notFound(String message) {
    return new RequestFailure(RequestErrorCode.NOT_FOUND, message, null, null, null);
  }

  public static RequestFailure invalidTransition(RequestStatus from, RequestStatus to) {
    return invalidTransition(from, to.value());
  }

  public static RequestFailure invalidTransition(RequestStatus from, String to) {
    final String fromValue = from == null ? null : from.value();
    return new RequestFailure(
        RequestErrorCode.INVALID_TRANSITION,
        "invalid status transition: " + fromValue + " -> " + to,
        from,
        to,
        null);
  }

  public static RequestFailure alreadyClaimed(long requestId, RequestStatus current) {
    return new RequestFailure(
        RequestErrorCode.ALREADY_CLAIMED,
        "request " + requestId + " is already claimed",
        current,
        RequestStatus.CLAIMED.value(),
        null);
  }

  public static RequestFailure notClaimed(long requestId, RequestStatus current) {
    return new RequestFailure(
        RequestErrorCode.NOT_CLAIMED,
        "request " + requestId + " has no active claim",
        current,
        RequestStatus.OPEN.value(),
        null);
  }

  public static RequestFailure exceedsRequested(long requestId, int completed, int requested) {
    return new RequestFailure(
        RequestErrorCode.EXCEEDS_REQUESTED,
        "request " + requestId + " completed " + completed + " exceeds requested " + requested,
        null,
        null,
        "quantityCompleted");
  }

  public static RequestFailure missingField(String field) {
    return new RequestFailure(
        RequestErrorCode.MISSING_FIELD, field + " is required", null, null, field);
  }

  public static RequestFailure invalidField(String field, String message) {
    return new RequestFailure(RequestErrorCode.INVALID_FIELD, message, null, null, field);
  }

  public static RequestFailure duplicateSubmission() {
    return new RequestFailure(
        RequestErrorCode.DUPLICATE_SUBMISSION,
        "an identical request was submitted moments ago",
        null,
        null,
        null);
  }
}
