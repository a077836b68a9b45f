package org.ippcode.compiler;

import org.ippcode.compiler.api.CompilationException;
import org.ippcode.compiler.api.CompilerErrorCode;
import org.ippcode.compiler.api.ICompiler;
import org.ippcode.compiler.api.Instruction;
import org.ippcode.compiler.api.Program;
import org.ippcode.compiler.diagnostics.DiagnosticsEngine;
import org.ippcode.compiler.frontend.classifier.OperandClassifier;
import org.ippcode.compiler.frontend.parser.InstructionParser;
import org.ippcode.compiler.frontend.parser.ParseContext;
import org.ippcode.compiler.frontend.preprocessor.LogicalLine;
import org.ippcode.compiler.frontend.preprocessor.PreProcessedSource;
import org.ippcode.compiler.frontend.preprocessor.PreProcessor;
import org.ippcode.compiler.isa.InstructionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The main translator implementation. This class drives the whole pipeline from source
 * lines to a validated {@link Program}: preprocessing with the header check, then parsing
 * line by line. It stops at the first error.
 * <p>
 * Every call to {@link #compile(List, String)} uses a fresh diagnostics engine and parse
 * context, so an instance can be reused, but it is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;
    private final InstructionSet instructionSet;
    private final OperandClassifier classifier = new OperandClassifier();

    /**
     * Creates a translator for IPPcode23 with the default options.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * Creates a translator for the IPPcode23 instruction set.
     * @param options The translator options.
     */
    public Compiler(CompilerOptions options) {
        this(options, InstructionSet.ippCode23());
    }

    /**
     * Creates a translator.
     * @param options The translator options.
     * @param instructionSet The signature table to validate against.
     */
    public Compiler(CompilerOptions options, InstructionSet instructionSet) {
        this.options = options;
        this.instructionSet = instructionSet;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Program compile(List<String> sourceLines, String programName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Preprocessing and header check
        PreProcessor preProcessor = new PreProcessor(options.headerToken(), options.caseSensitiveHeader(), programName);
        PreProcessedSource source = preProcessor.process(sourceLines);
        if (!source.headerAccepted()) {
            LogicalLine header = source.header();
            if (header == null) {
                diagnostics.reportError(CompilerErrorCode.MISSING_HEADER,
                        "Missing header '" + options.headerToken() + "'", programName);
            } else {
                diagnostics.reportError(CompilerErrorCode.INVALID_HEADER,
                        "Invalid header '" + header.content() + "', expected '" + options.headerToken() + "'",
                        header.source());
            }
            throw failure(diagnostics);
        }

        // Phase 2: Parsing and validation, one line at a time
        ParseContext context = new ParseContext();
        InstructionParser parser = new InstructionParser(instructionSet, classifier, diagnostics);
        List<Instruction> instructions = new ArrayList<>(source.lines().size());
        for (LogicalLine line : source.lines()) {
            Optional<Instruction> instruction = parser.parseLine(line, context);
            if (instruction.isEmpty()) {
                throw failure(diagnostics);
            }
            instructions.add(instruction.get());
        }

        if (instructions.isEmpty()) {
            LOG.debug("{} contains no instructions", programName);
        }
        LOG.info("Translated {}: {} instruction(s), {} global and {} local variable(s) declared",
                programName, instructions.size(),
                context.getDeclaredVariables().globals().size(),
                context.getDeclaredVariables().locals().size());
        return new Program(options.language(), instructions);
    }

    private static CompilationException failure(DiagnosticsEngine diagnostics) {
        LOG.debug("Translation failed:\n{}", diagnostics.summary());
        return new CompilationException(diagnostics.firstError()
                .orElseThrow(() -> new IllegalStateException("Translation failed without a diagnostic")));
    }
}
