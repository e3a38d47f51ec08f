package com.bsk.recommender.exception;

/**
 * A recommendation query that cannot be evaluated, raised before any table is consulted. Extends
 * {@link IllegalArgumentException} so the global handler maps it to 400.
 */
public class InvalidQueryException extends IllegalArgumentException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
