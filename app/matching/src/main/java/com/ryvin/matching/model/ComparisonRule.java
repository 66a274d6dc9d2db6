package com.ryvin.matching.model;

public enum ComparisonRule {
  SIMILARITY("similarity"),
  EXACT_MATCH("exact_match");

  private final String value;

  ComparisonRule(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ComparisonRule fromValue(String rule) {
    for (ComparisonRule comparisonRule : values()) {
      if (comparisonRule.value.equalsIgnoreCase(rule)
          || comparisonRule.name().equalsIgnoreCase(rule)) {
        return comparisonRule;
      }
    }
    throw new IllegalArgumentException("unsupported comparison_rule: " + rule);
  }
}
