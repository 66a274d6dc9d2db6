package com.ryvin.matching.scoring;

import com.ryvin.matching.model.CompatibilityScore;

public record RankedCandidate(String candidateId, CompatibilityScore score) {}
