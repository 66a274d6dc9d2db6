package com.ryvin.matching.service.dto;

import java.util.List;

public record ProfileCandidatesResponse(List<ProfileResponse> candidates) {

  public ProfileCandidatesResponse {
    candidates = candidates == null ? List.of() : List.copyOf(candidates);
  }
}
