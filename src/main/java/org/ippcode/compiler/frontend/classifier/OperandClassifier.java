package org.ippcode.compiler.frontend.classifier;

import org.ippcode.compiler.api.CompilerErrorCode;
import org.ippcode.compiler.api.Frame;
import org.ippcode.compiler.api.Operand;
import org.ippcode.compiler.api.OperandKind;
import org.ippcode.compiler.frontend.semantics.DeclarationLookup;
import org.ippcode.compiler.isa.OperandCategory;
import org.ippcode.compiler.util.Literals;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a raw token is valid for the operand category expected at its position
 * and, if so, resolves it to a concrete {@link OperandKind} and payload.
 * <p>
 * Classification never modifies the declared variables; it only reads them.
 */
public final class OperandClassifier {

    private static final Set<String> TYPE_NAMES = Set.of("int", "bool", "string");

    /**
     * Classifies a token.
     * @param token The operand exactly as written.
     * @param expected The category the instruction signature expects at this position.
     * @param declared The variables declared so far.
     * @return The classified operand, or the reason the token was rejected.
     */
    public Classification classify(String token, OperandCategory expected, DeclarationLookup declared) {
        return switch (expected) {
            case VARIABLE -> classifyVariable(token, declared);
            case SYMBOL -> classifySymbol(token, declared);
            case LABEL -> classifyLabel(token);
            case TYPE -> classifyType(token);
        };
    }

    private Classification classifyVariable(String token, DeclarationLookup declared) {
        int at = token.indexOf('@');
        if (at < 0) {
            return reject(CompilerErrorCode.INVALID_VARIABLE, "Invalid variable '" + token + "', expected FRAME@name");
        }
        Optional<Frame> frame = Frame.fromPrefix(token.substring(0, at));
        if (frame.isEmpty()) {
            return reject(CompilerErrorCode.INVALID_VARIABLE, "Invalid variable '" + token + "', unknown frame");
        }
        String name = token.substring(at + 1);
        if (!Literals.isIdentifier(name)) {
            return reject(CompilerErrorCode.INVALID_VARIABLE, "Invalid variable name in '" + token + "'");
        }
        if (!declared.isDeclared(frame.get(), name)) {
            return reject(CompilerErrorCode.UNDECLARED_VARIABLE, "Variable '" + token + "' is used before its DEFVAR");
        }
        return accept(OperandKind.VAR, token);
    }

    private Classification classifySymbol(String token, DeclarationLookup declared) {
        int at = token.indexOf('@');
        if (at < 0) {
            return reject(CompilerErrorCode.INVALID_LITERAL, "Invalid constant '" + token + "', expected a variable or TYPE@value");
        }
        String prefix = token.substring(0, at);
        if (Frame.fromPrefix(prefix).isPresent()) {
            return classifyVariable(token, declared);
        }

        String literal = token.substring(at + 1);
        switch (prefix) {
            case "int":
                return Literals.isInteger(literal)
                        ? accept(OperandKind.INT, literal)
                        : reject(CompilerErrorCode.INVALID_LITERAL, "Invalid integer constant '" + token + "'");
            case "bool":
                return Literals.isBoolean(literal)
                        ? accept(OperandKind.BOOL, literal)
                        : reject(CompilerErrorCode.INVALID_LITERAL, "Invalid boolean constant '" + token + "'");
            case "nil":
                return Literals.isNil(literal)
                        ? accept(OperandKind.NIL, literal)
                        : reject(CompilerErrorCode.INVALID_LITERAL, "Invalid nil constant '" + token + "'");
            case "string":
                return Literals.isString(literal)
                        ? accept(OperandKind.STRING, Literals.decodeString(literal))
                        : reject(CompilerErrorCode.INVALID_LITERAL, "Invalid escape sequence in string constant '" + token + "'");
            default:
                return reject(CompilerErrorCode.INVALID_LITERAL, "Unknown constant type in '" + token + "'");
        }
    }

    private Classification classifyLabel(String token) {
        if (!Literals.isIdentifier(token)) {
            return reject(CompilerErrorCode.INVALID_LABEL, "Invalid label '" + token + "'");
        }
        return accept(OperandKind.LABEL, token);
    }

    private Classification classifyType(String token) {
        if (!TYPE_NAMES.contains(token)) {
            return reject(CompilerErrorCode.INVALID_TYPE, "Invalid type '" + token + "', expected int, bool or string");
        }
        return accept(OperandKind.TYPE, token);
    }

    private static Classification accept(OperandKind kind, String value) {
        return new Classification.Accepted(new Operand(kind, value));
    }

    private static Classification reject(CompilerErrorCode code, String message) {
        return new Classification.Rejected(code, message);
    }
}
