/*
 * Where: crafting domain model
 * What: Either the result of a crafting command or the reason it was rejected
 * Why: Expected business conditions are returned to the front end, not thrown
 */
package com.guildcraft.crafting.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public final class RequestOutcome<T> {

  private final T value;
  private final RequestFailure failure;

  private RequestOutcome(T value, RequestFailure failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T> RequestOutcome<T> success(T value) {
    return new RequestOutcome<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> RequestOutcome<T> failure(RequestFailure failure) {
    return new RequestOutcome<>(null, Objects.requireNonNull(failure, "failure"));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public Optional<T> value() {
    return Optional.ofNullable(value);
  }

  public Optional<RequestFailure> failure() {
    return Optional.ofNullable(failure);
  }

  /** Returns the failure code, or {@code null} for a successful outcome. */
  public RequestErrorCode errorCode() {
    return failure == null ? null : failure.code();
  }

  public <R> RequestOutcome<R> map(Function<? super T, ? extends R> mapper) {
    if (failure != null) {
      return failure(failure);
    }
    return success(mapper.apply(value));
  }

  /**
   * Unwraps the value. Intended for callers that have already checked {@link #isSuccess()}.
   *
   * @throws IllegalStateException when the outcome is a failure
   */
  public T orElseThrow() {
    if (failure != null) {
      throw new IllegalStateException(failure.code() + ": " + failure.message());
    }
    return value;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RequestOutcome<?> that)) {
      return false;
    }
    return Objects.equals(value, that.value) && Objects.equals(failure, that.failure);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, failure);
  }

  @Override
  public String toString() {
    return failure == null ? "RequestOutcome[value=" + value + "]" : "RequestOutcome[" + failure + "]";
  }
}
