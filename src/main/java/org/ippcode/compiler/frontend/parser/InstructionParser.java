package org.ippcode.compiler.frontend.parser;

import org.ippcode.compiler.api.CompilerErrorCode;
import org.ippcode.compiler.api.Instruction;
import org.ippcode.compiler.api.Operand;
import org.ippcode.compiler.api.SourceInfo;
import org.ippcode.compiler.diagnostics.DiagnosticsEngine;
import org.ippcode.compiler.frontend.classifier.Classification;
import org.ippcode.compiler.frontend.classifier.OperandClassifier;
import org.ippcode.compiler.frontend.preprocessor.LogicalLine;
import org.ippcode.compiler.frontend.semantics.DeclarationLookup;
import org.ippcode.compiler.isa.InstructionSet;
import org.ippcode.compiler.isa.InstructionSignature;
import org.ippcode.compiler.isa.OperandCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses one logical line into a validated {@link Instruction}.
 * <p>
 * Checks run in a fixed order and the first violation ends the line: an unknown opcode, a
 * second opcode on the line, the operand count, then each operand from left to right.
 * Errors are reported to the {@link DiagnosticsEngine}; no instruction is produced for a
 * line with an error and no order number is consumed.
 */
public class InstructionParser {

    private static final Logger LOG = LoggerFactory.getLogger(InstructionParser.class);
    private static final String DEFVAR = "DEFVAR";
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final InstructionSet instructionSet;
    private final OperandClassifier classifier;
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new InstructionParser.
     * @param instructionSet The signature table.
     * @param classifier The operand classifier.
     * @param diagnostics The engine for reporting errors.
     */
    public InstructionParser(InstructionSet instructionSet, OperandClassifier classifier, DiagnosticsEngine diagnostics) {
        this.instructionSet = instructionSet;
        this.classifier = classifier;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses a single line.
     * @param line The logical line.
     * @param context The state of the current parse pass. DEFVAR updates its declared variables.
     * @return The instruction, or empty if an error was reported.
     */
    public Optional<Instruction> parseLine(LogicalLine line, ParseContext context) {
        SourceInfo source = line.source();
        String[] tokens = TOKEN_SEPARATOR.split(line.content());
        Optional<InstructionSignature> signature = instructionSet.lookup(tokens[0]);
        if (signature.isEmpty()) {
            return error(CompilerErrorCode.UNKNOWN_INSTRUCTION, "Instruction '" + tokens[0] + "' does not exist", source);
        }

        InstructionSignature sig = signature.get();
        for (int i = 1; i < tokens.length; i++) {
            if (isSecondOpcode(sig, i - 1, tokens[i])) {
                return error(CompilerErrorCode.MULTIPLE_OPCODES,
                        "More than one opcode on one line: '" + tokens[0] + "' and '" + tokens[i] + "'", source);
            }
        }

        int operandCount = tokens.length - 1;
        if (operandCount != sig.getArity()) {
            return error(CompilerErrorCode.INVALID_OPERAND_COUNT,
                    String.format("Instruction %s expects %d operand(s) but got %d", sig.opcode(), sig.getArity(), operandCount),
                    source);
        }

        boolean isDefvar = DEFVAR.equals(sig.opcode());
        DeclarationLookup lookup = isDefvar ? DeclarationLookup.UNCHECKED : context.getDeclaredVariables();
        List<Operand> operands = new ArrayList<>(operandCount);
        for (int i = 0; i < operandCount; i++) {
            Classification result = classifier.classify(tokens[i + 1], sig.categoryAt(i), lookup);
            if (result instanceof Classification.Rejected rejected) {
                return error(rejected.code(), rejected.message() + " (argument " + (i + 1) + ")", source);
            }
            operands.add(((Classification.Accepted) result).operand());
        }

        if (isDefvar) {
            Operand variable = operands.get(0);
            if (!context.getDeclaredVariables().declare(variable.frame(), variable.variableName())) {
                LOG.debug("{}: variable {} declared again", source, variable.value());
            }
        }

        Instruction instruction = new Instruction(context.allocateOrder(), sig.opcode(), operands, source);
        LOG.trace("{}: {} {}", source, instruction.order(), instruction.opcode());
        return Optional.of(instruction);
    }

    private boolean isSecondOpcode(InstructionSignature signature, int operandIndex, String token) {
        if (operandIndex < signature.getArity() && signature.categoryAt(operandIndex) == OperandCategory.LABEL) {
            return false;
        }
        return instructionSet.isOpcode(token);
    }

    private Optional<Instruction> error(CompilerErrorCode code, String message, SourceInfo source) {
        diagnostics.reportError(code, message, source);
        return Optional.empty();
    }
}
