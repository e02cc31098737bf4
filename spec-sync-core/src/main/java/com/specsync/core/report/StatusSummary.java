package com.specsync.core.report;

import com.specsync.core.model.Component;
import com.specsync.core.model.NextAction;
import com.specsync.core.model.Requirement;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Project-wide completion figures over a set of synced components.
 *
 * @param componentCount number of components
 * @param completeCount components with every requirement satisfied
 * @param requirementCount total requirements
 * @param satisfiedCount satisfied requirements
 * @param incomplete module names of components with an unsatisfied requirement
 * @param readyForWork module names of components whose next step can start
 * @param nextActions number of components per next action
 */
public record StatusSummary(
    int componentCount,
    int completeCount,
    int requirementCount,
    int satisfiedCount,
    List<String> incomplete,
    List<String> readyForWork,
    Map<NextAction, Integer> nextActions
) {

    public StatusSummary {
        incomplete = incomplete == null ? List.of() : List.copyOf(incomplete);
        readyForWork = readyForWork == null ? List.of() : List.copyOf(readyForWork);
        nextActions = nextActions == null ? Map.of() : Map.copyOf(nextActions);
    }

    /**
     * Computes the summary.
     *
     * @param components synced components
     * @return summary
     */
    public static StatusSummary of(List<Component> components) {
        int requirementCount = 0;
        int satisfiedCount = 0;
        Map<NextAction, Integer> nextActions = new EnumMap<>(NextAction.class);
        for (Component component : components) {
            requirementCount += component.requirements().size();
            satisfiedCount += (int) component.requirements().stream().filter(Requirement::satisfied).count();
            nextActions.merge(component.status().nextAction(), 1, Integer::sum);
        }

        List<String> incomplete = components.stream()
            .filter(component -> !component.allRequirementsSatisfied())
            .map(Component::moduleName)
            .toList();
        List<String> ready = components.stream()
            .filter(component -> component.status().readyForWork())
            .map(Component::moduleName)
            .toList();

        return new StatusSummary(components.size(), components.size() - incomplete.size(),
            requirementCount, satisfiedCount, incomplete, ready, nextActions);
    }

    /**
     * Returns the share of satisfied requirements.
     *
     * @return value in [0.0, 1.0]; 1.0 when there are no requirements
     */
    public double satisfactionRatio() {
        return requirementCount == 0 ? 1.0 : (double) satisfiedCount / requirementCount;
    }
}
