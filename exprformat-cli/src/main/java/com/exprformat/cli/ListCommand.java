package com.exprformat.cli;

import com.exprformat.ExprFormatCLI;
import com.exprformat.core.format.ExpressionFormatter;
import com.exprformat.core.format.Formatters;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the formatters discovered through SPI.
 */
@Command(
    name = "list",
    description = "List available formatters",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @ParentCommand
    private ExprFormatCLI parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        PrintWriter out = spec.commandLine().getOut();

        List<ExpressionFormatter> formatters = Formatters.available();
        log.debug("Discovered {} formatters", formatters.size());

        out.println("Available Formatters:");
        out.println();
        if (formatters.isEmpty()) {
            out.println("  (none found)");
        } else {
            formatters.forEach(f -> out.printf("  • %s (ID: %s, .%s, %s)%n",
                f.getDisplayName(), f.getId(), f.getFileExtension(), f.getContentType()));
        }
        out.flush();
        return 0;
    }
}
