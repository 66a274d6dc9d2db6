package com.ryvin.matching.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProfileResponse(
    String userId,
    Boolean verified,
    String status,
    Integer age,
    String gender,
    List<String> seekingGenders,
    Integer minAge,
    Integer maxAge,
    Double maxDistanceKm,
    Double latitude,
    Double longitude) {

  public ProfileResponse {
    seekingGenders = seekingGenders == null ? List.of() : List.copyOf(seekingGenders);
  }
}
