package com.marketdesk.marketdata.api;

import com.marketdesk.marketdata.client.ConfigurationException;
import com.marketdesk.marketdata.client.DataException;
import com.marketdesk.marketdata.client.UpstreamException;
import com.marketdesk.marketdata.client.ValidationException;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
    return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> handleConstraintViolation(
      ConstraintViolationException ex) {
    return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<Map<String, Object>> handleConfiguration(ConfigurationException ex) {
    log.error("Trading API not configured: {}", ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, "CONFIGURATION_ERROR", ex.getMessage());
  }

  @ExceptionHandler(UpstreamException.class)
  public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamException ex) {
    log.error("Upstream error", ex);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "UPSTREAM_ERROR");
    body.put("message", ex.getMessage());
    body.put("upstreamStatus", ex.status());
    body.put("upstreamBody", ex.body());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
  }

  @ExceptionHandler(DataException.class)
  public ResponseEntity<Map<String, Object>> handleData(DataException ex) {
    log.warn("Upstream data missing: {}", ex.getMessage());
    return error(HttpStatus.BAD_GATEWAY, "DATA_ERROR", ex.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> error(
      HttpStatus status, String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", message);
    return ResponseEntity.status(status).body(body);
  }
}
