package com.example.serverlesscluster.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an operation that either produces a value or fails with a {@link ClusterError}.
 *
 * <p>Used where absence of state is an expected, caller-handled condition (endpoint access on an
 * imported cluster, rotation without a secret) rather than a programming error.
 *
 * @param <T> value type
 */
public final class Result<T> {

  private final T value;
  private final ClusterError error;

  private Result(final T value, final ClusterError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> Result<T> ok(final T value) {
    return new Result<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> Result<T> error(final ClusterError error) {
    return new Result<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isOk() {
    return error == null;
  }

  public Optional<T> value() {
    return Optional.ofNullable(value);
  }

  public Optional<ClusterError> error() {
    return Optional.ofNullable(error);
  }

  public <R> Result<R> map(final Function<? super T, ? extends R> mapper) {
    return isOk() ? Result.ok(mapper.apply(value)) : Result.error(error);
  }

  /**
   * Returns the value or throws.
   *
   * @return the value
   * @throws ClusterErrorException carrying the error when this result failed
   */
  public T orElseThrow() {
    if (error != null) throw new ClusterErrorException(error);
    return value;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof Result<?> other)) return false;
    return Objects.equals(value, other.value) && Objects.equals(error, other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, error);
  }

  @Override
  public String toString() {
    return isOk() ? "Ok[" + value + "]" : "Error[" + error + "]";
  }
}
