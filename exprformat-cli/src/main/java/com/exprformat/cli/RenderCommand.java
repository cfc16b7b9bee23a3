package com.exprformat.cli;

import com.exprformat.ExprFormatCLI;
import com.exprformat.core.config.ConfigLoader;
import com.exprformat.core.config.FormatterConfig;
import com.exprformat.core.format.ExpressionFormatter;
import com.exprformat.core.format.FormattedOutput;
import com.exprformat.core.format.Formatters;
import com.exprformat.core.io.ExprJsonReader;
import com.exprformat.core.model.Expr;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to render a JSON expression tree with one of the registered formatters.
 *
 * <p>Exit codes: {@code 0} on success, {@code 1} when the tree cannot be read or
 * written, {@code 2} when no formatter has the requested id.
 */
@Command(
    name = "render",
    description = "Render a JSON expression tree as plain text or HTML",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_UNKNOWN_FORMATTER = 2;

    @ParentCommand
    private ExprFormatCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JSON tree file to render")
    private Path input;

    @Option(names = {"-f", "--format"}, description = "Formatter id (default: ${DEFAULT-VALUE})")
    private String formatterId = "text";

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./exprformat.yaml when present)")
    private Path configPath;

    @Option(names = {"-l", "--level"}, description = "Starting indentation level (default: ${DEFAULT-VALUE})")
    private int level = 0;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path output;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        PrintWriter err = spec.commandLine().getErr();

        Optional<ExpressionFormatter> formatter = Formatters.find(formatterId);
        if (formatter.isEmpty()) {
            String known = Formatters.available().stream()
                .map(ExpressionFormatter::getId)
                .collect(Collectors.joining(", "));
            err.println("✗ Unknown formatter '" + formatterId + "' (available: " + known + ")");
            return EXIT_UNKNOWN_FORMATTER;
        }

        try {
            log.info("Rendering {} with formatter '{}'", input, formatter.get().getId());
            FormatterConfig config = ConfigLoader.loadOrDefaults(resolveConfigPath());
            Expr tree = new ExprJsonReader().read(input);

            FormattedOutput result = formatter.get().format(tree, level, config);
            if (output != null) {
                Files.writeString(output, result.content(), StandardCharsets.UTF_8);
                log.info("Wrote {} output to {}", result.contentType(), output.toAbsolutePath());
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.println(result.content());
                out.flush();
            }
            return 0;

        } catch (Exception e) {
            log.error("Render failed", e);
            err.println("✗ Render failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private Path resolveConfigPath() {
        if (configPath != null) {
            return configPath;
        }
        Path conventional = Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        return Files.isRegularFile(conventional) ? conventional : null;
    }
}
