package com.benchy.queryplan.exception;

import com.benchy.queryplan.operator.DBMSType;

/**
 * Exception thrown when a native operator name, or a native join kind, has no
 * entry in the dispatch table of its vendor.
 *
 * <p>Misclassifying an operator would silently corrupt cross-vendor
 * comparisons, so the whole parse is aborted instead.
 */
public class UnrecognizedOperatorException extends PlanTranslationException {

    private final String nativeName;

    public UnrecognizedOperatorException(String nativeName, DBMSType dbms) {
        this("'" + nativeName + "' is not a recognized " + dbms + " operator", nativeName, dbms);
    }

    public UnrecognizedOperatorException(String message, String nativeName, DBMSType dbms) {
        super(message, dbms);
        this.nativeName = nativeName;
    }

    /**
     * Returns the vendor-native name that could not be mapped.
     *
     * @return the native operator or join kind name
     */
    public String getNativeName() {
        return nativeName;
    }

    @Override
    public String getUserMessage() {
        return "Unsupported " + getDbms() + " plan operator '" + nativeName + "'. " +
               "The operator must be added to the " + getDbms() + " dispatch table before " +
               "plans containing it can be translated.";
    }
}
