package com.ryvin.matching.api;

import com.ryvin.matching.scoring.ExclusionReason;

public class NotEligibleException extends RuntimeException {

  private final ExclusionReason reason;

  public NotEligibleException(ExclusionReason reason) {
    super("pairing is not eligible: " + reason.value());
    this.reason = reason;
  }

  public ExclusionReason reason() {
    return reason;
  }
}
