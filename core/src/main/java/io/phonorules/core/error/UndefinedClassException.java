package io.phonorules.core.error;

/**
 * Thrown when a pattern references {@code <name>} and no class of that name exists in the scheme.
 */
public final class UndefinedClassException extends SchemeLoadException {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String referencedIn;

    public UndefinedClassException(String name, String referencedIn, String source, Integer line) {
        super(String.format("Undefined class '%s' referenced in %s", name, referencedIn), source, line);
        this.name = name;
        this.referencedIn = referencedIn;
    }

    /** The missing class name. */
    public String name() {
        return name;
    }

    /** Where the reference occurs, e.g. {@code "class 'V'"} or {@code "rule on line 4"}. */
    public String referencedIn() {
        return referencedIn;
    }
}
