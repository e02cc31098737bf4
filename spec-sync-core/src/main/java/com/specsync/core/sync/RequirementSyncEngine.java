package com.specsync.core.sync;

import com.specsync.core.checker.CheckContext;
import com.specsync.core.checker.CheckerDispatcher;
import com.specsync.core.document.DocumentValidator;
import com.specsync.core.environment.Environment;
import com.specsync.core.graph.ComponentGraph;
import com.specsync.core.graph.DependencyGraphBuilder;
import com.specsync.core.graph.HierarchyTreeBuilder;
import com.specsync.core.layout.FileLayoutResolver;
import com.specsync.core.model.Component;
import com.specsync.core.model.Requirement;
import com.specsync.core.model.Scope;
import com.specsync.core.registry.RequirementDefinition;
import com.specsync.core.registry.RequirementRegistry;
import com.specsync.core.store.RequirementStore;
import com.specsync.core.store.RequirementStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Recomputes component requirements after project changes in two passes.
 *
 * <p><b>Pass order:</b>
 * <ol>
 *   <li>Refresh every component's {@link com.specsync.core.model.ComponentStatus}.</li>
 *   <li>Attach dependency links and compute the affected set (every component when forced).</li>
 *   <li>Affected components: clear and recompute local requirements. Others keep theirs.</li>
 *   <li>Attach the hierarchy over the post-local snapshot.</li>
 *   <li>Clear relational requirements project-wide and recompute them for every component.
 *       Components are visited after their dependencies and descendants, and each one's
 *       relational results join the snapshot before its dependents and ancestors are checked.</li>
 *   <li>Merge and order each component's requirements by its catalogue.</li>
 * </ol>
 *
 * <p>Each component's requirements are written with one {@link RequirementStore#replaceAll}.
 * When that fails, they are written one by one so that only the requirements the store
 * rejects are logged and dropped. A failed clear is logged too. Neither stops the pass.
 * Passes for the same scope run one at a time.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RequirementSyncEngine engine = new RequirementSyncEngine(
 *     RequirementRegistry.builtIn(),
 *     CheckerDispatcher.withDefaultCheckers(),
 *     new ConventionalFileLayout(),
 *     new LocalEnvironment(projectRoot),
 *     new MarkdownSectionValidator(),
 *     new InMemoryRequirementStore(),
 *     Clock.systemUTC());
 *
 * SyncResult result = engine.sync(request);
 * }</pre>
 */
public class RequirementSyncEngine {

    private static final Logger log = LoggerFactory.getLogger(RequirementSyncEngine.class);

    private final RequirementRegistry registry;
    private final CheckerDispatcher dispatcher;
    private final FileLayoutResolver layout;
    private final Environment environment;
    private final DocumentValidator documentValidator;
    private final RequirementStore store;
    private final ComponentStatusAnalyzer statusAnalyzer;
    private final Map<String, ReentrantLock> scopeLocks = new ConcurrentHashMap<>();

    public RequirementSyncEngine(
            RequirementRegistry registry,
            CheckerDispatcher dispatcher,
            FileLayoutResolver layout,
            Environment environment,
            DocumentValidator documentValidator,
            RequirementStore store,
            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.documentValidator = Objects.requireNonNull(documentValidator, "documentValidator must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.statusAnalyzer = new ComponentStatusAnalyzer(layout, Objects.requireNonNull(clock, "clock must not be null"));
    }

    /**
     * Runs one sync pass.
     *
     * @param request components, edges, change signals and options
     * @return components with refreshed status and ordered requirements
     */
    public SyncResult sync(SyncRequest request) {
        ReentrantLock lock = scopeLocks.computeIfAbsent(request.scope().key(), key -> new ReentrantLock());
        lock.lock();
        try {
            return doSync(request);
        } finally {
            lock.unlock();
        }
    }

    private SyncResult doSync(SyncRequest request) {
        long started = System.nanoTime();
        Scope scope = request.scope();
        SyncOptions options = request.options();
        PassCounters counters = new PassCounters();

        log.info("Syncing {} components for {} (force={}, persist={}, changed={})",
            request.components().size(), scope.key(), options.force(), options.persist(),
            request.changedIds().size());

        Predicate<String> fileExists = request.files() != null
            ? request.files()::contains
            : environment::fileExists;
        List<Component> withStatus = request.components().stream()
            .map(component -> component.withStatus(
                statusAnalyzer.analyze(component, request.project(), fileExists, request.testRun())))
            .toList();

        ComponentGraph graph = DependencyGraphBuilder.attach(ComponentGraph.of(withStatus), request.dependencies());

        Set<String> affected;
        if (options.force()) {
            affected = new LinkedHashSet<>(graph.ids());
            if (options.persist()) {
                clear(scope, "project", counters, () -> store.clearProject(scope));
            }
        } else {
            affected = new AffectedComponentIdentifier(options.propagation()).identify(graph, request.changedIds());
        }
        log.debug("Affected components: {}", affected.size());

        CheckContext context = new CheckContext(scope, request.project(), layout, environment,
            documentValidator, graph);

        List<Component> afterLocal = new ArrayList<>(graph.size());
        for (Component component : graph.components()) {
            if (affected.contains(component.id())) {
                afterLocal.add(component.withRequirements(checkLocal(context, component, options, counters)));
            } else {
                afterLocal.add(component.withRequirements(existingLocal(scope, component, options)));
            }
        }

        ComponentGraph snapshot = HierarchyTreeBuilder.attach(graph.withComponents(afterLocal));

        if (options.persist()) {
            clear(scope, "relational requirements", counters,
                () -> store.clearByNames(scope, snapshot.ids(), relationalNames(snapshot)));
        }

        // Dependents and ancestors read relational results written earlier in this loop
        ComponentGraph current = snapshot;
        for (Component next : DependencyGraphBuilder.relationalOrder(snapshot)) {
            Component component = current.component(next.id()).orElseThrow();
            List<Requirement> local = component.requirements();
            List<Requirement> relational = checkRelational(context.withGraph(current), component, options, counters);
            List<Requirement> merged = new ArrayList<>(local);
            merged.addAll(relational);
            current = current.withComponent(component.withRequirements(ordered(component, merged)));
        }
        List<Component> result = current.components();

        long durationMillis = (System.nanoTime() - started) / 1_000_000;
        SyncStatistics statistics = new SyncStatistics(result.size(), affected.size(),
            counters.localChecks, counters.relationalChecks, counters.persistenceFailures, durationMillis);
        log.info("Sync of {} finished: {} affected, {} local and {} relational checks, {} persistence failures in {} ms",
            scope.key(), statistics.affectedCount(), statistics.localChecks(), statistics.relationalChecks(),
            statistics.persistenceFailures(), durationMillis);

        return new SyncResult(result, affected, statistics);
    }

    private List<Requirement> checkLocal(CheckContext context, Component component,
                                         SyncOptions options, PassCounters counters) {
        List<Requirement> requirements = new ArrayList<>();
        for (RequirementDefinition definition : registry.localDefinitionsFor(component.type())) {
            counters.localChecks++;
            requirements.add(dispatcher.evaluate(context, definition, component, Map.of()));
        }
        if (!options.persist()) {
            return requirements;
        }
        return persist(context.scope(), component.id(), List.of(), requirements, !options.force(), counters);
    }

    private List<Requirement> checkRelational(CheckContext context, Component component,
                                              SyncOptions options, PassCounters counters) {
        List<Requirement> requirements = new ArrayList<>();
        for (RequirementDefinition definition : registry.relationalDefinitionsFor(component.type())) {
            counters.relationalChecks++;
            requirements.add(dispatcher.evaluate(context, definition, component, Map.of()));
        }
        if (!options.persist() || requirements.isEmpty()) {
            return requirements;
        }
        return persist(context.scope(), component.id(), component.requirements(), requirements, false, counters);
    }

    /**
     * Writes {@code kept} plus {@code fresh} as the component's stored requirements.
     *
     * @return the fresh requirements the store accepted
     */
    private List<Requirement> persist(Scope scope, String componentId, List<Requirement> kept,
                                      List<Requirement> fresh, boolean clearFirst, PassCounters counters) {
        List<Requirement> all = new ArrayList<>(kept);
        all.addAll(fresh);
        try {
            store.replaceAll(scope, componentId, all);
            return fresh;
        } catch (RequirementStoreException e) {
            log.warn("Batch write of {} requirements for component {} in {} failed, writing one by one: {}",
                all.size(), componentId, scope.key(), e.getMessage());
        }

        if (clearFirst) {
            clear(scope, "component " + componentId, counters, () -> store.clearAll(scope, componentId));
        }
        List<Requirement> accepted = new ArrayList<>();
        for (Requirement requirement : fresh) {
            try {
                accepted.add(store.create(scope, requirement));
            } catch (RequirementStoreException e) {
                counters.persistenceFailures++;
                log.error("Failed to persist requirement {} for component {} in {}: {}",
                    requirement.name(), requirement.componentId(), scope.key(), e.getMessage(), e);
            }
        }
        return accepted;
    }

    private void clear(Scope scope, String target, PassCounters counters, Runnable clear) {
        try {
            clear.run();
        } catch (RequirementStoreException e) {
            counters.persistenceFailures++;
            log.error("Failed to clear {} in {}: {}", target, scope.key(), e.getMessage(), e);
        }
    }

    private List<Requirement> existingLocal(Scope scope, Component component, SyncOptions options) {
        List<Requirement> existing = component.requirements();
        if (existing.isEmpty() && options.persist()) {
            existing = store.listForComponent(scope, component.id());
        }
        return existing.stream()
            .filter(requirement -> !requirement.isRelational())
            .toList();
    }

    private Set<String> relationalNames(ComponentGraph graph) {
        Set<String> names = new LinkedHashSet<>();
        registry.types().values().forEach(type -> type.requirements().stream()
            .filter(RequirementDefinition::isRelational)
            .forEach(definition -> names.add(definition.name())));
        for (Component component : graph.components()) {
            registry.relationalDefinitionsFor(component.type())
                .forEach(definition -> names.add(definition.name()));
        }
        return names;
    }

    private List<Requirement> ordered(Component component, List<Requirement> requirements) {
        return requirements.stream()
            .sorted(Comparator.comparingInt(requirement -> registry.orderIndex(component.type(), requirement.name())))
            .toList();
    }

    private static final class PassCounters {
        private int localChecks;
        private int relationalChecks;
        private int persistenceFailures;
    }
}
