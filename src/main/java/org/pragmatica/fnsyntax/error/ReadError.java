package org.pragmatica.fnsyntax.error;

import org.pragmatica.fnsyntax.reader.SourceLocation;

/**
 * Failure to read forms from source text.
 */
public sealed interface ReadError {
    SourceLocation location();

    String message();

    /**
     * Report as the invalid-argument exception macro code expects.
     */
    default FnSyntaxException asException() {
        return FnSyntaxException.invalidArgument(message());
    }

    /**
     * A token that cannot start or continue a form at this point.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ReadError {
        @Override
        public String message() {
            return "Cannot read form at " + location + ": found '" + found + "' where " + expected + " belongs";
        }
    }

    /**
     * Text ran out inside a form, or held no form at all.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ReadError {
        @Override
        public String message() {
            return "Form text ends at " + location + " before " + expected;
        }
    }

    /**
     * Malformed token (bad escape, unterminated string, number out of range).
     */
    record InvalidToken(
    SourceLocation location,
    String reason) implements ReadError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * Map literal with odd arity or duplicate keys.
     */
    record InvalidMap(
    SourceLocation location,
    String reason) implements ReadError {
        @Override
        public String message() {
            return "Invalid map literal at " + location + ": " + reason;
        }
    }
}
