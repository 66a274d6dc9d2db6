package com.ryvin.matching.model;

public enum MeetingStatus {
  PENDING,
  ACCEPTED,
  DECLINED,
  COMPLETED,
  EXPIRED
}
