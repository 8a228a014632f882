package dev.ccast.cli;

import dev.ccast.CcAstSettings;
import dev.ccast.CcParser;
import dev.ccast.engine.ParseEngine;
import dev.ccast.engine.ParseFailureException;
import dev.ccast.tree.FingerprintStrategy;
import dev.ccast.tree.TreePrinter;
import dev.ccast.treesitter.TreeSitterEngine;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // picocli populates the annotated fields before call()
@CommandLine.Command(
        name = "ccast",
        mixinStandardHelpOptions = true,
        description = "Parses a C or C++ file and prints its syntax tree, one node per line.")
public final class CcAstCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CcAstCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_PARSE_FAILURE = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Source file to parse.")
    private Path file;

    @CommandLine.Parameters(
            index = "1..*",
            description = "Arguments passed verbatim to the parsing engine. Put them after --.")
    private List<String> engineArguments = new ArrayList<>();

    @CommandLine.Option(
            names = {"-v", "--verbose"},
            description = "Print spelling and location next to each kind.")
    private boolean verbose;

    @CommandLine.Option(names = "--max-depth", description = "Do not descend below this depth; 0 is unlimited.")
    @Nullable
    private Integer maxDepth;

    @CommandLine.Option(names = "--skip-kind", description = "Leave nodes of this kind out. Can be repeated.")
    private List<String> skipKinds = new ArrayList<>();

    @CommandLine.Option(
            names = "--fingerprint",
            description = "How visited cursors are re-identified: ${COMPLETION-CANDIDATES}.")
    @Nullable
    private FingerprintStrategy fingerprint;

    @CommandLine.Option(
            names = "--fail-on-diagnostics",
            description = "Exit with status 1 when the parser reported diagnostics.")
    private boolean failOnDiagnostics;

    private final @Nullable ParseEngine engine;

    public CcAstCli() {
        this(null);
    }

    /** @param engine engine to use instead of tree-sitter */
    CcAstCli(@Nullable ParseEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        if (maxDepth != null && maxDepth < 0) {
            throw new CommandLine.ParameterException(
                    spec.commandLine(), "--max-depth must be 0 (unlimited) or positive, got " + maxDepth);
        }

        var settings = CcAstSettings.load();
        if (fingerprint != null) {
            settings = settings.withFingerprintStrategy(fingerprint);
        }
        if (maxDepth != null) {
            settings = settings.withMaxDepth(maxDepth);
        }
        if (!skipKinds.isEmpty()) {
            settings = settings.withSkipKinds(Set.copyOf(skipKinds));
        }

        var parseEngine = engine != null ? engine : new TreeSitterEngine(settings.defaultDialect());
        var parser = new CcParser(parseEngine, settings);
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            var result = parser.parseFile(file, engineArguments);
            TreePrinter.printTree(result.root(), out, verbose);
            if (result.error().isPresent()) {
                var diagnostics = result.error().get().getDiagnostics();
                diagnostics.forEach(err::println);
                err.flush();
                if (failOnDiagnostics) {
                    return EXIT_DIAGNOSTICS;
                }
            }
            return EXIT_OK;
        } catch (ParseFailureException e) {
            logger.debug("Parse failure", e);
            err.println(e.getMessage());
            err.flush();
            return EXIT_PARSE_FAILURE;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CcAstCli()).execute(args);
        System.exit(exitCode);
    }
}
