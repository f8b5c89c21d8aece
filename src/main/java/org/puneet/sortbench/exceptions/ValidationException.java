package org.puneet.sortbench.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Validation exception for the sorting benchmark harness.
 * Raised at the public boundary of the trial runner, the ranker and the
 * configuration layer whenever an input would make a measurement meaningless
 * (no trials, negative dataset sizes, nothing to rank).
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-15
 */
public class ValidationException extends Exception implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(ValidationException.class);

    /**
     * Types of validation failures
     */
    public enum ValidationType {
        CONFIGURATION_VALIDATION("VAL003", "Configuration validation failed"),
        RANGE_VALIDATION("VAL005", "Value out of valid range"),
        NULL_VALIDATION("VAL007", "Null value not allowed"),
        SIZE_VALIDATION("VAL008", "Size validation failed");

        private final String code;
        private final String description;

        ValidationType(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }

    /**
     * Validation error details
     */
    public static class ValidationError implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;

        private final String fieldName;
        private final Object actualValue;
        private final Object expectedValue;
        private final String constraint;

        public ValidationError(String fieldName, Object actualValue,
                             Object expectedValue, String constraint) {
            this.fieldName = fieldName;
            this.actualValue = actualValue;
            this.expectedValue = expectedValue;
            this.constraint = constraint;
        }

        public String getFieldName() {
            return fieldName;
        }

        public Object getActualValue() {
            return actualValue;
        }

        public Object getExpectedValue() {
            return expectedValue;
        }

        public String getConstraint() {
            return constraint;
        }

        @Override
        public String toString() {
            return String.format("Field '%s': expected %s %s, but got %s",
                    fieldName, constraint, expectedValue, actualValue);
        }
    }

    private final ValidationType validationType;
    private final List<ValidationError> validationErrors;
    private final LocalDateTime timestamp;
    private final Map<String, Object> metadata;

    /**
     * Constructs a new ValidationException with type and message.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message) {
        this(validationType, message, new ArrayList<>(), new HashMap<>());
    }

    /**
     * Constructs a new ValidationException with type, message, and validation errors.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param validationErrors List of specific validation errors
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message,
                             List<ValidationError> validationErrors) {
        this(validationType, message, validationErrors, new HashMap<>());
    }

    /**
     * Constructs a new ValidationException with all parameters.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param validationErrors List of specific validation errors
     * @param metadata Additional metadata for debugging
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message,
                             List<ValidationError> validationErrors,
                             Map<String, Object> metadata) {
        super(formatMessage(Objects.requireNonNull(validationType, "Validation type cannot be null"),
                message, validationErrors));

        this.validationType = validationType;
        this.validationErrors = validationErrors != null ?
                new ArrayList<>(validationErrors) : new ArrayList<>();
        this.timestamp = LocalDateTime.now();
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();

        logger.debug("ValidationException created: [{}] {} at {}",
                validationType.getCode(), getMessage(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
    }

    /**
     * Creates a validation exception for null value scenarios.
     *
     * @param fieldName The name of the field that is null
     * @return A new ValidationException configured for null validation
     */
    public static ValidationException nullValue(String fieldName) {
        String message = String.format("Null value not allowed for field '%s'", fieldName);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, null, "non-null", "NOT_NULL")
        );

        return new ValidationException(ValidationType.NULL_VALIDATION, message, errors);
    }

    /**
     * Creates a validation exception for range violation scenarios.
     *
     * @param fieldName The name of the field
     * @param value The actual value
     * @param minValue The minimum allowed value
     * @param maxValue The maximum allowed value
     * @return A new ValidationException configured for range validation
     */
    public static ValidationException outOfRange(String fieldName, Number value,
                                               Number minValue, Number maxValue) {
        String message = String.format(
                "Value %s for field '%s' is out of range [%s, %s]",
                value, fieldName, minValue, maxValue
        );
        String expectedRange = String.format("[%s, %s]", minValue, maxValue);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, value, expectedRange, "RANGE")
        );

        return new ValidationException(ValidationType.RANGE_VALIDATION, message, errors);
    }

    /**
     * Creates a validation exception for invalid size scenarios.
     *
     * @param fieldName The name of the sized field
     * @param actualSize The actual size
     * @param expectedSize The bound the size was checked against
     * @param constraint The size constraint (e.g., "MIN", "MAX", "EXACT")
     * @return A new ValidationException configured for size validation
     */
    public static ValidationException invalidSize(String fieldName, int actualSize,
                                                int expectedSize, String constraint) {
        String message = String.format(
                "Size validation failed for field '%s': actual size %d, expected %s %d",
                fieldName, actualSize, constraint, expectedSize
        );
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, actualSize, expectedSize, constraint)
        );

        return new ValidationException(ValidationType.SIZE_VALIDATION, message, errors);
    }

    /**
     * Creates a validation exception for an empty collection that must hold
     * at least one element.
     *
     * @param fieldName The name of the collection
     * @return A new ValidationException configured for configuration validation
     */
    public static ValidationException emptyCollection(String fieldName) {
        String message = String.format("Collection '%s' must not be empty", fieldName);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, 0, 1, "MIN_SIZE")
        );

        return new ValidationException(ValidationType.CONFIGURATION_VALIDATION, message, errors);
    }

    /**
     * Creates a validation exception for invalid configuration.
     *
     * @param configName The configuration parameter name
     * @param reason The reason for invalidity
     * @param metadata Additional configuration details
     * @return A new ValidationException configured for configuration validation
     */
    public static ValidationException invalidConfiguration(String configName,
                                                         String reason,
                                                         Map<String, Object> metadata) {
        String message = String.format("Invalid configuration '%s': %s", configName, reason);
        return new ValidationException(
                ValidationType.CONFIGURATION_VALIDATION, message, new ArrayList<>(), metadata
        );
    }

    private static String formatMessage(ValidationType validationType, String message,
                                      List<ValidationError> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(validationType.getCode()).append("] ");
        sb.append(validationType.getDescription());

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }

        if (errors != null && !errors.isEmpty()) {
            sb.append(" | Errors: ");
            sb.append(errors.size()).append(" validation error(s)");
        }

        return sb.toString();
    }

    public ValidationType getValidationType() {
        return validationType;
    }

    /**
     * Gets the list of validation errors.
     *
     * @return An unmodifiable list of validation errors
     */
    public List<ValidationError> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * Gets the metadata associated with this exception.
     *
     * @return An unmodifiable map of metadata
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public boolean hasValidationErrors() {
        return !validationErrors.isEmpty();
    }

    /**
     * Gets a detailed string representation for logging.
     *
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationException Details:\n");
        sb.append("  Type: ").append(validationType.getCode()).append(" - ")
          .append(validationType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");

        if (!validationErrors.isEmpty()) {
            sb.append("  Validation Errors (").append(validationErrors.size()).append("):\n");
            for (ValidationError error : validationErrors) {
                sb.append("    - ").append(error).append("\n");
            }
        }

        if (!metadata.isEmpty()) {
            sb.append("  Metadata:\n");
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                sb.append("    ").append(entry.getKey()).append(": ")
                  .append(entry.getValue()).append("\n");
            }
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ValidationException[type=%s, errors=%d, timestamp=%s]: %s",
                validationType.name(),
                validationErrors.size(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
