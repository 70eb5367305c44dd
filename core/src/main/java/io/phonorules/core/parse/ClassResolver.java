package io.phonorules.core.parse;

import io.phonorules.core.error.CyclicClassReferenceException;
import io.phonorules.core.error.UndefinedClassException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Expands class templates into fully resolved patterns.
 *
 * <p>
 * Class {@code A} depends on {@code B} when {@code A}'s template references {@code <B>}.
 * Classes are resolved depth-first in sorted name order, each one only after all of its
 * dependencies, by literal substitution of every reference with the dependency's resolved text.
 * An explicit in-progress marker set detects cycles, so resolution always terminates.
 *
 * <p>
 * The result does not depend on declaration order. Thread-safe and stateless.
 */
public final class ClassResolver {

    private final String source;
    private final Map<String, String> templates;
    private final Map<String, String> resolved = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();
    private final Deque<String> path = new ArrayDeque<>();

    private ClassResolver(Map<String, String> templates, String source) {
        this.templates = templates;
        this.source = source;
    }

    /**
     * Resolves every class in {@code templates}.
     *
     * @param templates class name to declared template
     * @param source    label used in error messages, may be {@code null}
     * @return class name to resolved pattern, in the iteration order of {@code templates}
     * @throws UndefinedClassException       if a template references an unknown class
     * @throws CyclicClassReferenceException if templates reference each other in a cycle
     */
    public static Map<String, String> resolve(Map<String, String> templates, String source) {
        Objects.requireNonNull(templates, "templates must not be null");
        ClassResolver resolver = new ClassResolver(templates, source);
        List<String> names = new ArrayList<>(templates.keySet());
        Collections.sort(names);
        for (String name : names) {
            resolver.visit(name);
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (String name : templates.keySet()) {
            result.put(name, resolver.resolved.get(name));
        }
        return result;
    }

    private void visit(String name) {
        if (resolved.containsKey(name)) {
            return;
        }
        if (inProgress.contains(name)) {
            throw new CyclicClassReferenceException(cycleFrom(name), source);
        }
        inProgress.add(name);
        path.addLast(name);

        String template = templates.get(name);
        for (String dependency : ClassReferences.names(template)) {
            if (!templates.containsKey(dependency)) {
                throw new UndefinedClassException(dependency, "class '" + name + "'", source, null);
            }
            visit(dependency);
        }
        resolved.put(name, ClassReferences.expand(template, resolved));

        path.removeLast();
        inProgress.remove(name);
    }

    /** The classes on the current path from the first visit of {@code name} onwards. */
    private Set<String> cycleFrom(String name) {
        Set<String> cycle = new LinkedHashSet<>();
        boolean inCycle = false;
        for (String step : path) {
            inCycle |= step.equals(name);
            if (inCycle) {
                cycle.add(step);
            }
        }
        return cycle;
    }
}
