package org.pragmatica.fnsyntax.error;

import io.vavr.control.Option;
import org.pragmatica.fnsyntax.tree.SyntaxNode;
import org.pragmatica.fnsyntax.tree.SyntaxPrinter;

import java.util.Objects;

/**
 * Malformed function literal or named definition. Messages embed the offending forms in printed form.
 */
public sealed interface FnSyntaxError {
    ErrorKind kind();

    String message();

    /**
     * Report as the invalid-argument exception macro code expects.
     */
    default FnSyntaxException asException() {
        return FnSyntaxException.invalidArgument(message());
    }

    /**
     * Named definition whose first form is not a symbol. {@code found} is empty when there were no forms at all.
     */
    record MissingName(Option<SyntaxNode> found) implements FnSyntaxError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.MISSING_NAME;
        }

        @Override
        public String message() {
            return "first argument to a named definition must be a symbol, got `"
                   + found.map(SyntaxPrinter::print)
                          .getOrElse("nothing")
                   + "`";
        }
    }

    /**
     * Nothing resembling a parameter vector or clause list follows the optional name.
     */
    record MissingParameters() implements FnSyntaxError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.MISSING_PARAMETERS;
        }

        @Override
        public String message() {
            return "parameter declaration missing";
        }
    }

    /**
     * Clause whose parameter declaration is not a vector. Wording depends on the variant chosen for
     * the whole declaration.
     */
    record MalformedSignature(SignatureVariant variant, SyntaxNode offending) implements FnSyntaxError {
        public MalformedSignature {
            Objects.requireNonNull(variant, "variant");
            Objects.requireNonNull(offending, "offending");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.MALFORMED_SIGNATURE;
        }

        @Override
        public String message() {
            var printed = SyntaxPrinter.print(offending);
            return switch (variant) {
                case PARAMETER_DECLARATION -> "parameter declaration `" + printed + "` should be an ordered sequence";
                case INVALID_SIGNATURE -> "invalid signature: `" + printed + "` should be a list";
            };
        }
    }

    /**
     * Wording of a {@link MalformedSignature} failure.
     */
    enum SignatureVariant {
        /**
         * Reports the parameter token itself.
         */
        PARAMETER_DECLARATION,
        /**
         * Reports the whole offending signature form.
         */
        INVALID_SIGNATURE
    }
}
