package com.specsync.core.checker;

import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.registry.RequirementDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Checks that every direct dependency has all of its requirements satisfied.
 *
 * <p>Reads the dependencies' requirements from the graph snapshot in the context. The
 * score is the share of satisfied dependencies.
 */
public class DependencyChecker implements RequirementChecker {

    private static final Logger log = LoggerFactory.getLogger(DependencyChecker.class);

    @Override
    public CheckerKind kind() {
        return CheckerKind.DEPENDENCY;
    }

    @Override
    public CheckResult check(CheckContext context, RequirementDefinition definition, Component component,
                             Map<String, Object> options) {
        if (!context.graph().hasDependencyGraph()) {
            log.warn("Dependencies not loaded for {}", component.moduleName());
            return CheckResult.failed("Dependencies not loaded");
        }

        List<Component> dependencies = context.graph().dependenciesOf(component.id());
        if (dependencies.isEmpty()) {
            return CheckResult.ok(Map.of("status", "No dependencies", "count", 0));
        }

        List<String> unsatisfied = dependencies.stream()
            .filter(dependency -> !dependency.allRequirementsSatisfied())
            .map(Component::moduleName)
            .toList();

        int satisfiedCount = dependencies.size() - unsatisfied.size();
        if (unsatisfied.isEmpty()) {
            return CheckResult.fraction(satisfiedCount, dependencies.size(),
                Map.of("status", "All dependencies satisfied", "count", dependencies.size()));
        }
        return CheckResult.fraction(satisfiedCount, dependencies.size(), Map.of(
            "reason", "Unsatisfied dependencies: " + String.join(", ", unsatisfied),
            "unsatisfied", unsatisfied,
            "count", dependencies.size()));
    }
}
