/*
 * どこで: Identity API
 * 何を: 例外を標準エラー形式へ変換する
 * なぜ: 失敗時の契約を一定に保ち、呼び出し側が再試行可否を判断できるようにするため
 */
package com.example.identity.api;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class IdentityApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(IdentityApiExceptionHandler.class);

  @ExceptionHandler(InvalidObservationException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidObservation(InvalidObservationException ex) {
    return badRequest(ex.getMessage());
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

  @ExceptionHandler(ConcurrentContactUpdateException.class)
  public ResponseEntity<ApiErrorResponse> handleConcurrentUpdate(
      ConcurrentContactUpdateException ex) {
    logger.info("identify conflicted with a concurrent merge: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.CONCURRENT_UPDATE, ex.getMessage()));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    logger.error("contact store call failed", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse(ApiErrorCode.STORE_UNAVAILABLE, "contact store is unavailable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
    logger.error("identify failed unexpectedly", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal server error"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }
}
