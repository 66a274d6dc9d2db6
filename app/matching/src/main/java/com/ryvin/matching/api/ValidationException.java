package com.ryvin.matching.api;

/** 入力が不正または値域外。何も適用せずに拒否する。 */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
