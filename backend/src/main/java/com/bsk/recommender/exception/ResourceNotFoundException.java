package com.bsk.recommender.exception;

/** Thrown when a lookup the caller cannot proceed without finds nothing. */
public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String message) {
    super(message);
  }
}
