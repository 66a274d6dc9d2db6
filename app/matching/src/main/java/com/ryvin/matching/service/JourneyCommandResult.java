package com.ryvin.matching.service;

import com.ryvin.matching.model.CommandOutcome;
import com.ryvin.matching.model.JourneyRecord;

public record JourneyCommandResult(JourneyRecord journey, CommandOutcome outcome) {}
