package com.specsync.core.checker;

import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.model.Requirement;
import com.specsync.core.registry.HierarchyVariant;
import com.specsync.core.registry.RequirementDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Checks a requirement across a component's entire descendant subtree.
 *
 * <p>A descendant passes when it has the aggregated requirement satisfied, or, for
 * {@code children_complete}, when all of its requirements are satisfied. A subtree
 * without descendants is vacuously satisfied. The score is the share of passing
 * descendants.
 */
public class HierarchicalChecker implements RequirementChecker {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalChecker.class);

    @Override
    public CheckerKind kind() {
        return CheckerKind.HIERARCHICAL;
    }

    @Override
    public CheckResult check(CheckContext context, RequirementDefinition definition, Component component,
                             Map<String, Object> options) {
        if (!context.graph().hasHierarchy()) {
            log.warn("Child components not loaded for {}", component.moduleName());
            return CheckResult.failed("Child components not loaded");
        }

        Optional<String> childRequirement = childRequirement(definition);
        List<Component> descendants = context.graph().descendantsOf(component.id());
        if (descendants.isEmpty()) {
            return CheckResult.ok(Map.of("status", "No child components to check", "count", 0));
        }

        Predicate<Component> passes = childRequirement
            .<Predicate<Component>>map(name -> descendant -> hasSatisfied(descendant, name))
            .orElse(Component::allRequirementsSatisfied);

        List<String> failing = descendants.stream()
            .filter(passes.negate())
            .map(Component::moduleName)
            .toList();

        String subject = childRequirement.orElse("all requirements");
        int passing = descendants.size() - failing.size();
        if (failing.isEmpty()) {
            return CheckResult.fraction(passing, descendants.size(), Map.of(
                "status", "All child components have " + subject,
                "count", descendants.size()));
        }
        return CheckResult.fraction(passing, descendants.size(), Map.of(
            "reason", "Child components missing " + subject + ": " + String.join(", ", failing),
            "missing", failing,
            "count", descendants.size()));
    }

    private static Optional<String> childRequirement(RequirementDefinition definition) {
        Optional<String> configured = definition.configString(RequirementDefinition.CHILD_REQUIREMENT);
        if (configured.isPresent()) {
            return configured.filter(name -> !"all".equals(name));
        }
        return HierarchyVariant.fromName(definition.name()).flatMap(HierarchyVariant::childRequirement);
    }

    private static boolean hasSatisfied(Component component, String requirementName) {
        return component.requirements().stream()
            .filter(requirement -> requirement.name().equals(requirementName))
            .anyMatch(Requirement::satisfied);
    }
}
