package org.ippcode.cli;

import com.typesafe.config.Config;
import org.ippcode.cli.config.ConfigLoader;
import org.ippcode.cli.config.LoggingConfigurator;
import org.ippcode.compiler.Compiler;
import org.ippcode.compiler.CompilerOptions;
import org.ippcode.compiler.api.CompilationException;
import org.ippcode.compiler.api.CompilerErrorCode;
import org.ippcode.compiler.api.ICompiler;
import org.ippcode.compiler.api.Program;
import org.ippcode.compiler.backend.emit.EmissionException;
import org.ippcode.compiler.backend.emit.XmlEmitter;
import org.ippcode.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
    name = "ippcode-parse",
    description = {
        "Reads IPPcode23 source code from standard input, checks its lexical and syntactic",
        "correctness and writes its XML representation to standard output."
    },
    exitCodeOnInvalidInput = 10,
    exitCodeOnExecutionException = 99,
    footer = {
        "",
        "Exit codes: 0 success, 10 invalid parameters, 11 input error, 12 output error,",
        "21 missing or invalid header, 22 unknown opcode, 23 other syntax or semantic error,",
        "99 internal error."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);
    static final String SOURCE_NAME = "<stdin>";
    private static final String INDENT_PATH = "ippcode.output.indent";

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
    private boolean helpRequested;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final InputStream input;
    private final Function<CompilerOptions, ICompiler> compilerFactory;
    private Config config;

    public CommandLineInterface() {
        this(System.in, Compiler::new, null);
    }

    /**
     * Constructor for tests.
     * @param input The stream the source is read from.
     * @param compilerFactory Creates the translator for the configured options.
     * @param config The configuration, or {@code null} to load it on first use.
     */
    CommandLineInterface(InputStream input, Function<CompilerOptions, ICompiler> compilerFactory, Config config) {
        this.input = input;
        this.compilerFactory = compilerFactory;
        this.config = config;
    }

    @Override
    public Integer call() {
        final Config cfg = getConfig();
        LoggingConfigurator.configure(cfg);
        final CompilerOptions options = CompilerOptions.fromConfig(cfg);

        final List<String> lines;
        try {
            lines = readLines(input);
        } catch (IOException e) {
            return fail(new Diagnostic(CompilerErrorCode.IO_ERROR_READING_FILE,
                    "Cannot read standard input: " + e.getMessage(), SOURCE_NAME, 0));
        }

        try {
            Program program = compilerFactory.apply(options).compile(lines, SOURCE_NAME);
            PrintWriter out = spec.commandLine().getOut();
            int indent = cfg.hasPath(INDENT_PATH) ? cfg.getInt(INDENT_PATH) : 4;
            new XmlEmitter(indent).emit(program, out);
            if (out.checkError()) {
                return fail(ExitCode.OUTPUT_ERROR, "Cannot write to standard output");
            }
            return ExitCode.SUCCESS.code();
        } catch (CompilationException e) {
            return fail(e.getDiagnostic());
        } catch (EmissionException e) {
            LOG.error("Failed to emit XML", e);
            return fail(ExitCode.OUTPUT_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected internal error", e);
            return fail(new Diagnostic(CompilerErrorCode.UNKNOWN_ERROR, "Internal error: " + e, SOURCE_NAME, 0));
        }
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine(new CommandLineInterface()).execute(args));
    }

    /**
     * Creates the picocli command line with UTF-8 standard output and error streams.
     * @param cli The command instance.
     * @return The configured command line.
     */
    static CommandLine createCommandLine(CommandLineInterface cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setOut(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
        commandLine.setErr(new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));
        return commandLine;
    }

    private int fail(Diagnostic diagnostic) {
        return fail(ExitCode.forKind(diagnostic.code().kind()), diagnostic.toString());
    }

    private int fail(ExitCode exitCode, String message) {
        LOG.debug("Exiting with {}: {}", exitCode, message);
        PrintWriter err = spec.commandLine().getErr();
        err.printf("[%s] %s (%d)%n", exitCode, message, exitCode.code());
        err.flush();
        return exitCode.code();
    }

    private static List<String> readLines(InputStream in) throws IOException {
        List<String> lines = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return lines;
    }

    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load();
        }
        return config;
    }
}
