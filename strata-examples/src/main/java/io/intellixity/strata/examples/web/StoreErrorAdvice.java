package io.intellixity.strata.examples.web;

import io.intellixity.strata.persistence.error.ReadException;
import io.intellixity.strata.persistence.error.SaveException;
import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.error.StoreErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps classified store failures to HTTP responses. */
@RestControllerAdvice
public final class StoreErrorAdvice {
  private static final Logger log = LoggerFactory.getLogger(StoreErrorAdvice.class);

  @ExceptionHandler(SaveException.class)
  public ResponseEntity<Map<String, Object>> onSave(SaveException e) {
    log.warn("save failed kind={} sqlState={} partition={} details={}", e.kind(), e.sqlState(), e.partition(), e.details());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("kind", e.kind().name());
    body.put("partition", e.partition());
    body.putAll(e.details());
    return ResponseEntity.status(statusOf(e.kind())).body(body);
  }

  @ExceptionHandler(ReadException.class)
  public ResponseEntity<Map<String, Object>> onRead(ReadException e) {
    log.warn("read failed kind={} sqlState={} resolver={}", e.kind(), e.sqlState(), e.resolver());
    return ResponseEntity.status(statusOf(e.kind())).body(Map.of("kind", e.kind().name(), "resolver", e.resolver()));
  }

  @ExceptionHandler({IllegalArgumentException.class, SchemaConfigException.class})
  public ResponseEntity<Map<String, Object>> onBadRequest(RuntimeException e) {
    return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
  }

  static HttpStatus statusOf(StoreErrorKind kind) {
    return switch (kind) {
      case UNIQUENESS_VIOLATION, SERIALIZATION_CONFLICT -> HttpStatus.CONFLICT;
      case STRING_TOO_LONG, INVALID_ENCODING, INVALID_VALUE_REPRESENTATION, NOT_NULL_VIOLATION, CHECK_VIOLATION ->
          HttpStatus.UNPROCESSABLE_ENTITY;
      case CONNECTION_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
      case STATEMENT_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
      default -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }
}
