package com.specsync.core.report;

import com.specsync.core.model.Component;
import com.specsync.core.model.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Prints synced components to a terminal, optionally with ANSI colors.
 */
public class ConsoleStatusPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConsoleStatusPrinter.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final PrintStream out;
    private final boolean useColors;

    public ConsoleStatusPrinter(PrintStream out, boolean useColors) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.useColors = useColors;
    }

    /**
     * Prints every component followed by a summary line.
     *
     * @param components synced components
     * @param showSatisfied whether satisfied requirements are listed too
     */
    public void print(List<Component> components, boolean showSatisfied) {
        log.debug("Printing status for {} components", components.size());
        for (Component component : components) {
            printComponent(component, showSatisfied);
        }
        printSummary(StatusSummary.of(components));
    }

    private void printComponent(Component component, boolean showSatisfied) {
        boolean complete = component.allRequirementsSatisfied();
        String marker = complete ? color(ANSI_GREEN, "✓") : color(ANSI_RED, "✗");
        out.println(marker + " " + color(ANSI_BOLD, component.moduleName())
            + " (" + component.type().tag() + ")");
        for (Requirement requirement : component.requirements()) {
            if (requirement.satisfied() && !showSatisfied) {
                continue;
            }
            String detail = MarkdownStatusReport.describe(requirement.details());
            String line = "    " + (requirement.satisfied() ? "✓ " : "✗ ") + requirement.name()
                + (detail.isEmpty() ? "" : ": " + detail);
            out.println(requirement.satisfied() ? line : color(ANSI_YELLOW, line));
        }
    }

    private void printSummary(StatusSummary summary) {
        out.println();
        out.println(color(ANSI_BOLD, summary.completeCount() + "/" + summary.componentCount()
            + " components complete, " + summary.satisfiedCount() + "/" + summary.requirementCount()
            + " requirements satisfied"));
    }

    private String color(String code, String text) {
        return useColors ? code + text + ANSI_RESET : text;
    }
}
