package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.scoring.RankedCandidate;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record CandidatesResponse(String userId, List<Candidate> candidates) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Candidate(int rank, String candidateId, CompatibilityScoreResponse score) {}

  public static CandidatesResponse from(String userId, List<RankedCandidate> ranked) {
    final List<Candidate> candidates = new ArrayList<>();
    for (int i = 0; i < ranked.size(); i++) {
      final RankedCandidate candidate = ranked.get(i);
      candidates.add(
          new Candidate(
              i + 1,
              candidate.candidateId(),
              CompatibilityScoreResponse.from(candidate.score())));
    }
    return new CandidatesResponse(userId, candidates);
  }
}
