package com.cycleforecast.core.exception;

import java.util.Objects;

/**
 * The external provider's answer could not be turned into a structured
 * prediction.
 *
 * @since 1.0.0
 */
public class ResponseParseException extends CyclePredictionException {

    private static final long serialVersionUID = 1L;

    public enum ParseFailure {
        /** No {@code {...}} span in the answer. */
        NO_JSON_FOUND,
        /** A required field is absent or not of its expected type. */
        MISSING_FIELD
    }

    private final ParseFailure failure;
    private final String fieldName;

    private ResponseParseException(ParseFailure failure, String fieldName, String message) {
        super(message);
        this.failure = failure;
        this.fieldName = fieldName;
    }

    public static ResponseParseException noJsonFound() {
        return new ResponseParseException(ParseFailure.NO_JSON_FOUND, null,
                "No JSON object found in provider response");
    }

    public static ResponseParseException missingField(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        return new ResponseParseException(ParseFailure.MISSING_FIELD, fieldName,
                "Missing or malformed field in provider response: " + fieldName);
    }

    public ParseFailure getFailure() {
        return failure;
    }

    /**
     * @return the offending field for {@link ParseFailure#MISSING_FIELD},
     *         otherwise {@code null}
     */
    public String getFieldName() {
        return fieldName;
    }
}
