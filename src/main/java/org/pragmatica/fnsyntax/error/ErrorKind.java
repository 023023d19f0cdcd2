package org.pragmatica.fnsyntax.error;

/**
 * Closed set of definition-form failures.
 */
public enum ErrorKind {
    /**
     * Named definition does not start with a symbol.
     */
    MISSING_NAME,
    /**
     * No parameter vector or clause list after the optional name.
     */
    MISSING_PARAMETERS,
    /**
     * A clause's parameter declaration is not a vector, or a clause is not a list.
     */
    MALFORMED_SIGNATURE
}
