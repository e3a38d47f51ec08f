package com.bsk.recommender.exception;

/** A required reference table could not be read at start-up. */
public class ReferenceDataException extends RuntimeException {

  public ReferenceDataException(String message) {
    super(message);
  }

  public ReferenceDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
