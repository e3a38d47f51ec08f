package com.bsk.recommender.exception;

/** The citizen master file was not part of this deployment. */
public class CitizenDataUnavailableException extends RuntimeException {

  public CitizenDataUnavailableException() {
    super(
        "Citizen database not available in this deployment. Please use manual entry mode.");
  }
}
