/*
 * どこで: Matching API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 失敗の種類ごとに安定したエラーコードと参照先を返すため
 */
package com.ryvin.matching.api;

import com.ryvin.matching.service.ProfileIntegrationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(ValidationException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(NotEligibleException.class)
  public ResponseEntity<ApiErrorResponse> handleNotEligible(NotEligibleException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.NOT_ELIGIBLE, ex.getMessage(), ex.reason().value()));
  }

  @ExceptionHandler(JourneyStateConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleStateConflict(JourneyStateConflictException ex) {
    final String message =
        ex.currentStage() == null
            ? ex.getMessage()
            : ex.getMessage() + " (current_stage=" + ex.currentStage() + ")";
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.STATE_CONFLICT, message, ex.journeyId()));
  }

  @ExceptionHandler(JourneyAlreadyExistsException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyExists(JourneyAlreadyExistsException ex) {
    // 既存 Journey の id を reference に載せ、クライアントがそちらへ遷移できるようにする
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.ALREADY_EXISTS, ex.getMessage(), ex.existingJourneyId()));
  }

  @ExceptionHandler(QuestionnaireFieldAlreadyExistsException.class)
  public ResponseEntity<ApiErrorResponse> handleFieldAlreadyExists(
      QuestionnaireFieldAlreadyExistsException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.ALREADY_EXISTS, ex.getMessage()));
  }

  @ExceptionHandler(DuplicateFeedbackException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicateFeedback(DuplicateFeedbackException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.DUPLICATE_FEEDBACK, ex.getMessage()));
  }

  @ExceptionHandler(InvalidMeetingStateException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidMeetingState(
      InvalidMeetingStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.INVALID_MEETING_STATE, ex.getMessage()));
  }

  @ExceptionHandler({
    JourneyNotFoundException.class,
    MeetingRequestNotFoundException.class,
    QuestionnaireFieldNotFoundException.class,
    UserProfileNotFoundException.class
  })
  public ResponseEntity<ApiErrorResponse> handleNotFound(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(MatchingAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(MatchingAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse(ApiErrorCode.FORBIDDEN, ex.getMessage()));
  }

  @ExceptionHandler(ProfileIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleProfileIntegration(
      ProfileIntegrationException ex) {
    logger.warn("profile integration failed reason={}", ex.reason(), ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.PROFILE_UNAVAILABLE,
                "profile service is unavailable",
                ex.reason().name()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
    logger.error("unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.VALIDATION_ERROR, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
