package com.ryvin.matching.service;

import com.ryvin.matching.model.CommandOutcome;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.MeetingRequestRecord;

public record MeetingCommandResult(
    MeetingRequestRecord meeting, JourneyRecord journey, CommandOutcome outcome) {}
