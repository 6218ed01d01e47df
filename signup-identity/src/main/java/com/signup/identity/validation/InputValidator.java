package com.signup.identity.validation;

import com.signup.core.Outcome;
import com.signup.core.StepLogger;
import com.signup.identity.error.ValidationException;
import org.slf4j.event.Level;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts raw values into typed ones. Rejections are logged at WARN with tag
 * {@code "validate <field>"}; successes are not logged. Raw values never reach the log.
 */
public final class InputValidator {
  private final StepLogger logger;

  public InputValidator(StepLogger logger) {
    this.logger = StepLogger.guarded(Objects.requireNonNull(logger, "logger"));
  }

  public <T> Outcome<T> validate(Object raw, ValueShape<T> shape, String field) {
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(field, "field");
    try {
      return Outcome.success(shape.decode(raw));
    } catch (IllegalArgumentException ex) {
      String reason = ex.getMessage() != null ? ex.getMessage() : "is invalid";
      return Outcome.failure(reject(field, reason, ex));
    }
  }

  /** Builds and logs a rejection for {@code field}. */
  public ValidationException reject(String field, String reason, Throwable cause) {
    ValidationException failure = new ValidationException(field, reason, cause);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("field", field);
    details.put("reason", reason);
    logger.log(Level.WARN, "validate " + field, details);
    return failure;
  }
}
