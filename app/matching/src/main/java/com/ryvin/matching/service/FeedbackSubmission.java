package com.ryvin.matching.service;

import com.ryvin.matching.model.FeedbackRecord;
import com.ryvin.matching.model.JourneyRecord;

public record FeedbackSubmission(FeedbackRecord feedback, JourneyRecord journey) {}
