package com.benchy.queryplan.exception;

import com.benchy.queryplan.operator.DBMSType;

/**
 * Exception thrown when a vendor plan lacks a field its schema requires, carries
 * a field of the wrong shape, or is not valid JSON at all.
 */
public class MalformedPlanException extends PlanTranslationException {

    private final String fieldName;

    public MalformedPlanException(String message, String fieldName, DBMSType dbms) {
        super(message, dbms);
        this.fieldName = fieldName;
    }

    public MalformedPlanException(String message, Throwable cause, DBMSType dbms) {
        super(message, cause, dbms);
        this.fieldName = null;
    }

    /**
     * Returns the offending field.
     *
     * @return the field name, or null if the document as a whole was unreadable
     */
    public String getFieldName() {
        return fieldName;
    }

    @Override
    public String getUserMessage() {
        if (fieldName == null) {
            return "The " + getDbms() + " explain output could not be read: " + getMessage();
        }
        return "The " + getDbms() + " explain output is missing or has an invalid '" +
               fieldName + "' field. Check that the plan was captured with " +
               "EXPLAIN (FORMAT JSON, ANALYZE).";
    }
}
