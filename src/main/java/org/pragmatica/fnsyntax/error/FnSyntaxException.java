package org.pragmatica.fnsyntax.error;

/**
 * Invalid-argument failure raised to macro code when a definition form cannot be parsed.
 */
public final class FnSyntaxException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private FnSyntaxException(String message) {
        super(message);
    }

    public static FnSyntaxException invalidArgument(String message) {
        return new FnSyntaxException(message);
    }
}
