package org.pragmatica.fnsyntax.parser;

import org.pragmatica.fnsyntax.error.FnSyntaxError.SignatureVariant;

/**
 * Which clause layout a declaration was resolved to. Decided once from the first form after the name
 * and applied to every clause of that declaration.
 */
public enum ClauseShape {
    /**
     * {@code [params] body...}: the whole remainder is one clause.
     */
    SINGLE_CLAUSE(SignatureVariant.INVALID_SIGNATURE),
    /**
     * {@code ([params] body...) ([params] body...)}: each list is a clause.
     */
    MULTI_CLAUSE(SignatureVariant.PARAMETER_DECLARATION);

    private final SignatureVariant variant;

    ClauseShape(SignatureVariant variant) {
        this.variant = variant;
    }

    /**
     * Wording used for a malformed parameter declaration under this shape.
     */
    public SignatureVariant signatureVariant() {
        return variant;
    }
}
