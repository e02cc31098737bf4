package com.specsync.core.report;

import com.specsync.core.model.Component;
import com.specsync.core.model.Requirement;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders synced components as a Markdown status report.
 *
 * <p>The report opens with a summary table, followed by one section per component
 * listing its requirements in catalogue order.
 */
public class MarkdownStatusReport {

    /**
     * Generates the report.
     *
     * @param projectName project name used in the title
     * @param components synced components
     * @return Markdown text
     */
    public String generate(String projectName, List<Component> components) {
        StatusSummary summary = StatusSummary.of(components);
        StringBuilder md = new StringBuilder();

        md.append("# ").append(projectName).append(" Requirement Status\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Components | ").append(summary.componentCount()).append(" |\n");
        md.append("| Complete components | ").append(summary.completeCount()).append(" |\n");
        md.append("| Requirements satisfied | ").append(summary.satisfiedCount())
            .append(" / ").append(summary.requirementCount()).append(" |\n");
        md.append("| Satisfaction | ")
            .append(String.format(Locale.ROOT, "%.0f%%", summary.satisfactionRatio() * 100)).append(" |\n\n");

        for (Component component : components) {
            md.append("## ").append(component.moduleName()).append("\n\n");
            md.append("Type: `").append(component.type().tag()).append("` · Next action: `")
                .append(component.status().nextAction().name().toLowerCase(Locale.ROOT)).append("`\n\n");
            if (component.requirements().isEmpty()) {
                md.append("_No requirements._\n\n");
                continue;
            }
            md.append("| Requirement | Satisfied | Score | Details |\n");
            md.append("|-------------|-----------|-------|---------|\n");
            for (Requirement requirement : component.requirements()) {
                md.append("| ").append(requirement.name())
                    .append(" | ").append(requirement.satisfied() ? "✓" : "✗")
                    .append(" | ").append(String.format(Locale.ROOT, "%.2f", requirement.score()))
                    .append(" | ").append(escape(describe(requirement.details())))
                    .append(" |\n");
            }
            md.append("\n");
        }
        return md.toString();
    }

    static String describe(Map<String, Object> details) {
        Object reason = details.get("reason");
        if (reason != null) {
            return reason.toString();
        }
        Object status = details.get("status");
        return status == null ? "" : status.toString();
    }

    private static String escape(String text) {
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
