package com.ryvin.matching.api;

public class QuestionnaireFieldAlreadyExistsException extends RuntimeException {

  public QuestionnaireFieldAlreadyExistsException(String fieldId) {
    super("questionnaire field already exists: " + fieldId);
  }
}
