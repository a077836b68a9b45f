package org.ippcode.compiler.frontend.classifier;

import org.ippcode.compiler.api.CompilerErrorCode;
import org.ippcode.compiler.api.Operand;

/**
 * The outcome of classifying one operand token.
 */
public sealed interface Classification permits Classification.Accepted, Classification.Rejected {

    /**
     * The token is valid for its position.
     * @param operand The classified operand.
     */
    record Accepted(Operand operand) implements Classification {}

    /**
     * The token is not valid for its position.
     * @param code The error code describing the violation.
     * @param message A message naming the offending token.
     */
    record Rejected(CompilerErrorCode code, String message) implements Classification {}
}
