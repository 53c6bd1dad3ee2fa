package com.benchy.queryplan.exception;

/**
 * Exception thrown when an encoded plan document cannot be written or read
 * back.
 *
 * <p>Attribute values that have no scalar form are not a reason for this
 * exception; encoders write them as strings.
 */
public class PlanEncodingException extends PlanTranslationException {

    public PlanEncodingException(String message, Throwable cause) {
        super(message, cause, null);
    }

    public PlanEncodingException(String message) {
        super(message, null);
    }

    @Override
    public String getUserMessage() {
        return "Encoded query plan could not be processed: " + getMessage();
    }
}
