package com.consullo.cup.search;

import java.util.Objects;

/**
 * Raised when a search request cannot be evaluated. The {@link Precondition} identifies which rule was
 * violated; an empty result is never used to signal these cases.
 *
 * @since 1.0
 */
public class SearchPreconditionException extends RuntimeException {

  /** Violated search precondition. */
  public enum Precondition {
    NO_PRIOR_CAPTURE,
    INVALID_LIMIT,
    EMPTY_QUERY,
    UNSUPPORTED_FILTER
  }

  private final Precondition precondition;

  public SearchPreconditionException(Precondition precondition, String message) {
    super(message);
    this.precondition = Objects.requireNonNull(precondition, "precondition");
  }

  public Precondition precondition() {
    return precondition;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{precondition=" + precondition + ", message=" + getMessage() + "}";
  }
}
