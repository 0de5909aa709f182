package com.usagelens.analytics.web;

import com.usagelens.engine.batch.BatchContractException;
import com.usagelens.engine.clickhouse.ClickHouseException;
import com.usagelens.engine.clickhouse.ClickHouseTimeoutException;
import com.usagelens.engine.sql.QueryBuildException;
import com.usagelens.engine.window.UnresolvableRangeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class UsageExceptionHandler {

  @ExceptionHandler(QueryBuildException.class)
  public ResponseEntity<UsageErrorResponse> handle(QueryBuildException e) {
    return respond(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage(), null);
  }

  @ExceptionHandler(UnresolvableRangeException.class)
  public ResponseEntity<UsageErrorResponse> handle(UnresolvableRangeException e) {
    return respond(HttpStatus.BAD_REQUEST, e.reason().name().toLowerCase(), e.getMessage(), null);
  }

  @ExceptionHandler(ClickHouseTimeoutException.class)
  public ResponseEntity<UsageErrorResponse> handle(ClickHouseTimeoutException e) {
    log.warn("usage store timeout queryId={} executionId={}", e.queryId(), e.executionId());
    return respond(HttpStatus.GATEWAY_TIMEOUT, "store_timeout", e.getMessage(), e.queryId());
  }

  @ExceptionHandler(ClickHouseException.class)
  public ResponseEntity<UsageErrorResponse> handle(ClickHouseException e) {
    log.warn("usage store error queryId={} executionId={} status={} code={}", e.queryId(), e.executionId(),
        e.statusCode(), e.errorCode());
    return respond(HttpStatus.BAD_GATEWAY, "store_error", e.responseSnippet(), e.queryId());
  }

  @ExceptionHandler(BatchContractException.class)
  public ResponseEntity<UsageErrorResponse> handle(BatchContractException e) {
    log.error("usage batch contract violated: {}", e.getMessage());
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "batch_contract", e.getMessage(), null);
  }

  private static ResponseEntity<UsageErrorResponse> respond(HttpStatus status, String error, String message,
                                                            String queryId) {
    return ResponseEntity.status(status).body(new UsageErrorResponse(status.value(), error, message, queryId));
  }

  public record UsageErrorResponse(int status, String error, String message, String queryId) {
  }
}
