/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.function;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a validation step: either a value or an {@link InvalidFunctionSpec}. Steps are chained
 * with {@link #flatMap}; the chain stops at the first failure and carries that failure to the end.
 *
 * @param <T> type of the validated value
 */
public abstract class Validated<T> {

  private Validated() {}

  public static <T> Validated<T> valid(T value) {
    return new Valid<>(Objects.requireNonNull(value));
  }

  public static <T> Validated<T> invalid(InvalidFunctionSpec error) {
    return new Invalid<>(Objects.requireNonNull(error));
  }

  public abstract boolean isValid();

  /**
   * Returns the validated value.
   *
   * @throws IllegalStateException if validation failed
   */
  public abstract T get();

  /**
   * Returns the validation failure.
   *
   * @throws IllegalStateException if validation succeeded
   */
  public abstract InvalidFunctionSpec getError();

  public abstract <U> Validated<U> map(Function<? super T, ? extends U> mapper);

  public abstract <U> Validated<U> flatMap(Function<? super T, Validated<U>> next);

  private static final class Valid<T> extends Validated<T> {
    private final T value;

    private Valid(T value) {
      this.value = value;
    }

    @Override
    public boolean isValid() {
      return true;
    }

    @Override
    public T get() {
      return value;
    }

    @Override
    public InvalidFunctionSpec getError() {
      throw new IllegalStateException("Validation succeeded with " + value);
    }

    @Override
    public <U> Validated<U> map(Function<? super T, ? extends U> mapper) {
      return valid(mapper.apply(value));
    }

    @Override
    public <U> Validated<U> flatMap(Function<? super T, Validated<U>> next) {
      return next.apply(value);
    }

    @Override
    public String toString() {
      return "Valid(" + value + ")";
    }
  }

  private static final class Invalid<T> extends Validated<T> {
    private final InvalidFunctionSpec error;

    private Invalid(InvalidFunctionSpec error) {
      this.error = error;
    }

    @Override
    public boolean isValid() {
      return false;
    }

    @Override
    public T get() {
      throw new IllegalStateException(error.getMessage());
    }

    @Override
    public InvalidFunctionSpec getError() {
      return error;
    }

    @Override
    public <U> Validated<U> map(Function<? super T, ? extends U> mapper) {
      return invalid(error);
    }

    @Override
    public <U> Validated<U> flatMap(Function<? super T, Validated<U>> next) {
      return invalid(error);
    }

    @Override
    public String toString() {
      return "Invalid(" + error + ")";
    }
  }
}
