package com.benchy.queryplan.exception;

import com.benchy.queryplan.operator.DBMSType;

/**
 * Base class for failures while translating a vendor query plan.
 *
 * <p>A translation either produces a complete canonical tree or throws one of
 * the subclasses of this exception. Callers driving query execution decide
 * whether to continue without a plan, skip the query, or abort the run.
 *
 * @see UnrecognizedOperatorException
 * @see MalformedPlanException
 */
public class PlanTranslationException extends RuntimeException {

    private final DBMSType dbms;

    /**
     * Creates a plan translation exception.
     *
     * @param message the error message
     * @param dbms the vendor whose plan failed to translate, may be null
     */
    public PlanTranslationException(String message, DBMSType dbms) {
        super(message);
        this.dbms = dbms;
    }

    /**
     * Creates a plan translation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param dbms the vendor whose plan failed to translate, may be null
     */
    public PlanTranslationException(String message, Throwable cause, DBMSType dbms) {
        super(message, cause);
        this.dbms = dbms;
    }

    /**
     * Returns the vendor whose plan failed to translate.
     *
     * @return the vendor, or null if not known
     */
    public DBMSType getDbms() {
        return dbms;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return "Query plan translation failed: " + getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Plan Translation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (dbms != null) {
            sb.append("DBMS: ").append(dbms).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
