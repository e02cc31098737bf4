package com.specsync.core.store;

import com.specsync.core.model.Requirement;
import com.specsync.core.model.Scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe {@link RequirementStore} held in memory.
 */
public class InMemoryRequirementStore implements RequirementStore {

    // scope key -> component id -> requirement name -> requirement
    private final Map<String, Map<String, Map<String, Requirement>>> data = new ConcurrentHashMap<>();

    @Override
    public Requirement create(Scope scope, Requirement requirement) {
        Map<String, Requirement> byName = componentRequirements(scope, requirement.componentId());
        synchronized (byName) {
            if (byName.containsKey(requirement.name())) {
                throw new RequirementStoreException("Requirement " + requirement.name()
                    + " already exists for component " + requirement.componentId());
            }
            byName.put(requirement.name(), requirement);
        }
        return requirement;
    }

    @Override
    public void clearAll(Scope scope, String componentId) {
        projectData(scope).remove(componentId);
    }

    @Override
    public void clearByNames(Scope scope, Collection<String> componentIds, Set<String> names) {
        Map<String, Map<String, Requirement>> project = projectData(scope);
        for (String componentId : componentIds) {
            Map<String, Requirement> byName = project.get(componentId);
            if (byName != null) {
                synchronized (byName) {
                    byName.keySet().removeAll(names);
                }
            }
        }
    }

    @Override
    public void clearProject(Scope scope) {
        data.remove(scope.key());
    }

    @Override
    public List<Requirement> listForComponent(Scope scope, String componentId) {
        Map<String, Requirement> byName = projectData(scope).get(componentId);
        if (byName == null) {
            return List.of();
        }
        synchronized (byName) {
            return List.copyOf(byName.values());
        }
    }

    @Override
    public Map<String, List<Requirement>> listAll(Scope scope) {
        Map<String, List<Requirement>> result = new LinkedHashMap<>();
        projectData(scope).keySet().stream()
            .sorted()
            .forEach(componentId -> result.put(componentId, listForComponent(scope, componentId)));
        return result;
    }

    @Override
    public void replaceAll(Scope scope, String componentId, List<Requirement> requirements) {
        Map<String, Requirement> replacement = new LinkedHashMap<>();
        for (Requirement requirement : requirements) {
            if (!componentId.equals(requirement.componentId())) {
                throw new RequirementStoreException("Requirement " + requirement.name()
                    + " belongs to " + requirement.componentId() + ", not " + componentId);
            }
            if (replacement.put(requirement.name(), requirement) != null) {
                throw new RequirementStoreException("Duplicate requirement " + requirement.name()
                    + " for component " + componentId);
            }
        }
        projectData(scope).put(componentId, replacement);
    }

    /**
     * Replaces the whole content of a scope.
     *
     * @param scope tenant and project
     * @param requirements requirements per component id
     */
    void load(Scope scope, Map<String, List<Requirement>> requirements) {
        Map<String, Map<String, Requirement>> project = new ConcurrentHashMap<>();
        requirements.forEach((componentId, list) -> {
            Map<String, Requirement> byName = new LinkedHashMap<>();
            list.forEach(requirement -> byName.put(requirement.name(), requirement));
            project.put(componentId, byName);
        });
        data.put(scope.key(), project);
    }

    Set<String> scopeKeys() {
        return data.keySet();
    }

    Map<String, List<Requirement>> snapshot(String scopeKey) {
        Map<String, List<Requirement>> result = new LinkedHashMap<>();
        Map<String, Map<String, Requirement>> project = data.getOrDefault(scopeKey, Map.of());
        project.keySet().stream().sorted().forEach(componentId -> {
            Map<String, Requirement> byName = project.get(componentId);
            synchronized (byName) {
                result.put(componentId, new ArrayList<>(byName.values()));
            }
        });
        return result;
    }

    private Map<String, Map<String, Requirement>> projectData(Scope scope) {
        return data.computeIfAbsent(scope.key(), key -> new ConcurrentHashMap<>());
    }

    private Map<String, Requirement> componentRequirements(Scope scope, String componentId) {
        return projectData(scope).computeIfAbsent(componentId, key -> new LinkedHashMap<>());
    }
}
