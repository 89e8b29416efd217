package org.kal.cli;

import ch.qos.logback.classic.Level;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.kal.cli.config.ConfigLoader;
import org.kal.cli.config.LoggingConfigurator;
import org.kal.compiler.CompilationSession;
import org.kal.compiler.CompilerSettings;
import org.kal.compiler.TopLevelResult;
import org.kal.compiler.diagnostics.Diagnostic;
import org.kal.compiler.ir.IrPrinter;
import org.kal.runtime.NativeFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(
    name = "kal",
    mixinStandardHelpOptions = true,
    version = "kal 1.0",
    description = "Reads Kaleidoscope definitions, externs and expressions, lowers them to IR and evaluates the expressions."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(names = {"-c", "--config"}, description = "Path to custom configuration file (default: kal.conf)")
    private File configFile;

    @Option(names = {"-f", "--file"}, description = "Read the source from this file instead of standard input.")
    private File sourceFile;

    @Option(names = "--no-eval", description = "Lower top-level expressions without evaluating them.")
    private boolean noEval;

    @Option(names = "--dump-module", negatable = true, description = "Print the whole module at end of input.")
    private Boolean dumpModule;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging.")
    private boolean verbose;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final InputStream stdin;

    public CommandLineInterface() {
        this(System.in);
    }

    /**
     * @param stdin The stream read in interactive mode.
     */
    public CommandLineInterface(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("kal");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final CompilerSettings settings;
        try {
            final Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            settings = applyOverrides(CompilerSettings.fromConfig(config));
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.debug("Configuration could not be loaded", e);
            err.println("Failed to load configuration: " + e.getMessage());
            err.flush();
            return 2;
        }
        if (verbose) {
            LoggingConfigurator.setRootLevel(Level.DEBUG);
        }
        LOG.debug("Operator table: {}", settings.operators());

        final boolean interactive = sourceFile == null;
        try (Reader input = interactive
                ? new InputStreamReader(stdin, StandardCharsets.UTF_8)
                : Files.newBufferedReader(sourceFile.toPath(), StandardCharsets.UTF_8)) {
            final String inputName = interactive ? "<stdin>" : sourceFile.getName();
            final CompilationSession session = new CompilationSession(input, inputName, settings, NativeFunctions.standard(System.out));
            final boolean failed = runSession(session, interactive, out, err);

            if (settings.dumpModuleOnExit()) {
                out.print(IrPrinter.print(session.module()));
                out.flush();
            }
            return !interactive && failed ? 1 : 0;
        }
    }

    private boolean runSession(CompilationSession session, boolean interactive, PrintWriter out, PrintWriter err) {
        boolean failed = false;
        while (true) {
            if (interactive) {
                err.print(session.settings().prompt());
                err.flush();
            }
            final TopLevelResult result = session.handleNext();
            if (result.kind() == TopLevelResult.Kind.END_OF_INPUT) {
                return failed;
            }
            report(result, out, err);
            failed |= !result.isSuccess();
        }
    }

    private void report(TopLevelResult result, PrintWriter out, PrintWriter err) {
        for (Diagnostic diagnostic : result.diagnostics()) {
            err.println(diagnostic);
        }
        result.loweredFunction().ifPresent(function -> {
            switch (result.kind()) {
                case DEFINITION -> out.println("Read function definition:");
                case EXTERN -> out.println("Read extern:");
                default -> out.println("Read top-level expression:");
            }
            out.print(IrPrinter.print(function));
        });
        result.evaluatedValue().ifPresent(value -> out.println("Evaluated to " + value));
        if (result.executionError() != null) {
            err.println("Evaluation failed: " + result.executionError());
        }
        out.flush();
        err.flush();
    }

    private CompilerSettings applyOverrides(CompilerSettings settings) {
        CompilerSettings result = settings;
        if (noEval) {
            result = result.withEvaluate(false);
        }
        if (dumpModule != null) {
            result = result.withDumpModuleOnExit(dumpModule);
        }
        return result;
    }
}
