package io.phonorules.core.error;

import java.util.Set;

/** Thrown when class templates reference each other in a cycle (including self-reference). */
public final class CyclicClassReferenceException extends SchemeLoadException {

    private static final long serialVersionUID = 1L;

    private final Set<String> names;

    public CyclicClassReferenceException(Set<String> names, String source) {
        super("Cyclic class reference between: " + String.join(", ", names), source, null);
        this.names = Set.copyOf(names);
    }

    /** The classes that form the cycle. */
    public Set<String> names() {
        return names;
    }
}
