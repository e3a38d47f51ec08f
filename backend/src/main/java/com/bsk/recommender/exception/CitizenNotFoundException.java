package com.bsk.recommender.exception;

import lombok.Getter;

@Getter
public class CitizenNotFoundException extends ResourceNotFoundException {

  private final String citizenId;

  public CitizenNotFoundException(String citizenId) {
    super("Citizen " + citizenId + " not found");
    this.citizenId = citizenId;
  }
}
