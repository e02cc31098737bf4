package com.specsync.core.checker;

import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.model.Requirement;
import com.specsync.core.registry.RequirementDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes a requirement definition to the checker its reference names and turns the
 * result into a {@link Requirement}.
 *
 * <p>The dispatcher owns threshold evaluation: a requirement is satisfied when the
 * checker's score reaches the definition's threshold. A checker that throws is reported
 * as an unsatisfied requirement rather than aborting the sync.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CheckerDispatcher dispatcher = CheckerDispatcher.withDefaultCheckers();
 * Requirement requirement = dispatcher.evaluate(context, definition, component, Map.of());
 * }</pre>
 */
public class CheckerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CheckerDispatcher.class);

    private final Map<CheckerKind, RequirementChecker> checkers;
    private final Clock clock;

    public CheckerDispatcher(Collection<? extends RequirementChecker> checkers, Clock clock) {
        Objects.requireNonNull(checkers, "checkers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.checkers = new EnumMap<>(CheckerKind.class);
        for (RequirementChecker checker : checkers) {
            this.checkers.put(checker.kind(), checker);
        }
        for (CheckerKind kind : CheckerKind.values()) {
            if (!this.checkers.containsKey(kind)) {
                throw new IllegalArgumentException("No checker registered for " + kind.reference());
            }
        }
    }

    public static CheckerDispatcher withDefaultCheckers() {
        return withDefaultCheckers(Clock.systemUTC());
    }

    public static CheckerDispatcher withDefaultCheckers(Clock clock) {
        return new CheckerDispatcher(List.of(
            new FileExistenceChecker(),
            new DocumentValidityChecker(),
            new TestStatusChecker(),
            new DependencyChecker(),
            new HierarchicalChecker()
        ), clock);
    }

    public RequirementChecker checkerFor(CheckerKind kind) {
        return checkers.get(kind);
    }

    /**
     * Evaluates one definition for one component.
     *
     * @param context collaborators and graph snapshot
     * @param definition requirement definition
     * @param component component under check
     * @param options per-invocation options
     * @return evaluated requirement
     */
    public Requirement evaluate(CheckContext context, RequirementDefinition definition, Component component,
                                Map<String, Object> options) {
        CheckResult result;
        try {
            result = checkers.get(definition.checker()).check(context, definition, component, options);
        } catch (RuntimeException e) {
            log.error("Checker {} failed for requirement {} of {}",
                definition.checker().reference(), definition.name(), component.moduleName(), e);
            result = CheckResult.failed(Map.of(
                "reason", "Checker failed",
                "error", String.valueOf(e.getMessage())));
        }

        return new Requirement(
            definition.name(),
            definition.artifactType(),
            definition.description(),
            definition.checker(),
            result.score(),
            definition.isSatisfiedBy(result.score()),
            result.details(),
            clock.instant(),
            component.id()
        );
    }
}
