package com.ryvin.matching.api;

public class QuestionnaireFieldNotFoundException extends RuntimeException {

  public QuestionnaireFieldNotFoundException(String fieldId) {
    super("questionnaire field not found: " + fieldId);
  }
}
