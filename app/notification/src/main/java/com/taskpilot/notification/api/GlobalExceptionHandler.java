/*
 * どこで: Notification API の例外変換
 * 何を: 入力不備/保存層障害を ProblemDetail へ変換する
 * なぜ: 検知器側が再試行すべき失敗 (503) と直すべき入力 (400) を区別できるようにするため
 */
package com.taskpilot.notification.api;

import com.taskpilot.notification.service.NotificationIntakeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(NotificationIntakeException.class)
  public ProblemDetail handleIntake(NotificationIntakeException ex) {
    final ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setTitle("Invalid Notification");
    return problem;
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    final ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Validation failed");
    problem.setTitle("Bad Request");
    problem.setProperty(
        "errors",
        ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .toList());
    return problem;
  }

  @ExceptionHandler(DataAccessException.class)
  public ProblemDetail handleStorage(DataAccessException ex) {
    logger.error("notification storage unavailable", ex);
    final ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.SERVICE_UNAVAILABLE, "Notification storage unavailable");
    problem.setTitle("Service Unavailable");
    return problem;
  }
}
