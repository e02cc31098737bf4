package com.specsync.core.checker;

import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.registry.RequirementDefinition;

import java.util.Map;

/**
 * Evaluates one kind of requirement for a component.
 *
 * <p>Implementations must not throw for missing files, unloaded links or absent
 * collaborators: those are reported as unsatisfied results with a {@code reason}.
 * They never modify the component.
 */
public interface RequirementChecker {

    /**
     * Returns the checker reference this implementation serves.
     *
     * @return checker kind
     */
    CheckerKind kind();

    /**
     * Checks a requirement.
     *
     * @param context collaborators and graph snapshot
     * @param definition requirement definition
     * @param component component under check
     * @param options per-invocation options
     * @return check result
     */
    CheckResult check(CheckContext context, RequirementDefinition definition, Component component,
                      Map<String, Object> options);
}
