package de.t14d3.folio.core;

import de.t14d3.folio.exceptions.UnitOfWorkException;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.FieldMapping;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Orders document classes so that every class is written after the classes it
 * references.
 * <p>
 * The graph is kept between commits and grows as new classes show up. Ties are
 * broken by the order in which classes were first added. Edges of required
 * references (non-nullable single references) must never form a cycle; optional
 * edges that would close one are dropped, since those references can be written
 * in the second pass after all inserts.
 */
public class CommitOrderCalculator {
    private final Map<Class<?>, ClassDescription> nodes = new LinkedHashMap<>();
    // depended-upon type -> (dependent type -> required)
    private final Map<Class<?>, Map<Class<?>, Boolean>> edges = new LinkedHashMap<>();
    private final Set<Class<?>> expanded = new HashSet<>();
    private final List<Reference> references = new ArrayList<>();

    private record Reference(Class<?> target, Class<?> owner, boolean required) {
    }

    public void addType(ClassDescription description) {
        nodes.putIfAbsent(description.getType(), description);
    }

    public boolean hasType(Class<?> type) {
        return nodes.containsKey(type);
    }

    /**
     * Declares that {@code dependedUpon} must be written before {@code dependent}.
     * A self-dependency is ignored; declaring an edge twice keeps it required if
     * either declaration was.
     */
    public void addDependency(Class<?> dependedUpon, Class<?> dependent, boolean required) {
        if (dependedUpon.equals(dependent)) {
            return;
        }
        edges.computeIfAbsent(dependedUpon, k -> new LinkedHashMap<>()).merge(dependent, required, Boolean::logicalOr);
    }

    public boolean hasDependency(Class<?> dependedUpon, Class<?> dependent) {
        Map<Class<?>, Boolean> dependents = edges.get(dependedUpon);
        return dependents != null && dependents.containsKey(dependent);
    }

    /**
     * Adds the given classes, derives the dependencies of every class not seen
     * before from its references (including references held by its embedded
     * documents) and returns the commit order. Embedded classes never appear in
     * the result.
     *
     * @param resolver looks up the description of referenced classes
     */
    public List<ClassDescription> calculate(Collection<ClassDescription> types,
                                            Function<Class<?>, ClassDescription> resolver) {
        for (ClassDescription description : types) {
            addType(description);
        }

        Deque<ClassDescription> pending = new ArrayDeque<>();
        for (ClassDescription description : nodes.values()) {
            if (!expanded.contains(description.getType())) {
                pending.add(description);
            }
        }
        while (!pending.isEmpty()) {
            ClassDescription description = pending.poll();
            if (!expanded.add(description.getType())) {
                continue;
            }
            Set<Class<?>> visitedEmbedded = new HashSet<>();
            collectReferences(description, description, visitedEmbedded, resolver, pending);
        }

        // a reference to a class also covers every known subclass of it
        for (Reference reference : references) {
            for (Class<?> node : nodes.keySet()) {
                if (reference.target().isAssignableFrom(node)) {
                    addDependency(node, reference.owner(), reference.required());
                }
            }
        }
        return getCommitOrder();
    }

    private void collectReferences(ClassDescription owner, ClassDescription current, Set<Class<?>> visitedEmbedded,
                                   Function<Class<?>, ClassDescription> resolver, Deque<ClassDescription> pending) {
        for (FieldMapping mapping : current.getAssociationMappings()) {
            ClassDescription target = resolver.apply(mapping.targetType());
            if (mapping.kind().isEmbedded()) {
                if (visitedEmbedded.add(target.getType())) {
                    collectReferences(owner, target, visitedEmbedded, resolver, pending);
                }
                continue;
            }
            if (!hasType(target.getType())) {
                addType(target);
                pending.add(target);
            }
            references.add(new Reference(target.getType(), owner.getType(), mapping.isRequiredReference()));
        }
    }

    /**
     * Topological order of all known classes (Kahn's algorithm, first-seen tie-break).
     *
     * @throws UnitOfWorkException of kind COMMIT_ORDER_CYCLE if required references form a cycle
     */
    public List<ClassDescription> getCommitOrder() {
        List<Class<?>> requiredCycle = findRequiredCycle();
        if (requiredCycle != null) {
            throw UnitOfWorkException.commitOrderCycle(requiredCycle);
        }

        Map<Class<?>, Map<Class<?>, Boolean>> incoming = new LinkedHashMap<>();
        for (Class<?> node : nodes.keySet()) {
            incoming.put(node, new LinkedHashMap<>());
        }
        edges.forEach((from, dependents) -> dependents.forEach((to, required) -> {
            if (incoming.containsKey(from) && incoming.containsKey(to)) {
                incoming.get(to).put(from, required);
            }
        }));

        Set<Class<?>> remaining = new LinkedHashSet<>(nodes.keySet());
        List<ClassDescription> order = new ArrayList<>();
        while (!remaining.isEmpty()) {
            Class<?> next = null;
            for (Class<?> candidate : remaining) {
                if (incoming.get(candidate).isEmpty()) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                next = breakOptionalCycle(remaining, incoming);
            }
            remaining.remove(next);
            for (Map<Class<?>, Boolean> dependencies : incoming.values()) {
                dependencies.remove(next);
            }
            ClassDescription description = nodes.get(next);
            if (!description.isEmbedded()) {
                order.add(description);
            }
        }
        return order;
    }

    /**
     * Every remaining class has incoming edges. As required edges are acyclic, some
     * class only has optional ones left; the first such class in first-seen order
     * loses them.
     */
    private Class<?> breakOptionalCycle(Set<Class<?>> remaining, Map<Class<?>, Map<Class<?>, Boolean>> incoming) {
        for (Class<?> candidate : remaining) {
            if (!incoming.get(candidate).containsValue(Boolean.TRUE)) {
                incoming.get(candidate).clear();
                return candidate;
            }
        }
        throw UnitOfWorkException.commitOrderCycle(new ArrayList<>(remaining));
    }

    private List<Class<?>> findRequiredCycle() {
        Set<Class<?>> done = new HashSet<>();
        for (Class<?> node : nodes.keySet()) {
            List<Class<?>> path = new ArrayList<>();
            List<Class<?>> cycle = visitRequired(node, path, new HashSet<>(), done);
            if (cycle != null) {
                return cycle;
            }
        }
        return null;
    }

    private List<Class<?>> visitRequired(Class<?> node, List<Class<?>> path, Set<Class<?>> onPath, Set<Class<?>> done) {
        if (onPath.contains(node)) {
            List<Class<?>> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
            cycle.add(node);
            return cycle;
        }
        if (!done.add(node)) {
            return null;
        }
        path.add(node);
        onPath.add(node);
        for (Map.Entry<Class<?>, Boolean> edge : edges.getOrDefault(node, Map.of()).entrySet()) {
            if (edge.getValue() && nodes.containsKey(edge.getKey())) {
                List<Class<?>> cycle = visitRequired(edge.getKey(), path, onPath, done);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(node);
        return null;
    }

    public void clear() {
        nodes.clear();
        edges.clear();
        expanded.clear();
        references.clear();
    }
}
