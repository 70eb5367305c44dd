package io.phonorules.core.error;

/** Thrown when a class name is declared more than once in the same scheme. */
public final class DuplicateClassException extends SchemeParseException {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final int firstLine;

    public DuplicateClassException(String name, int firstLine, String statement, String source, int line) {
        super(
                String.format("Class '%s' on line %d is already defined on line %d", name, line, firstLine),
                statement,
                source,
                line);
        this.name = name;
        this.firstLine = firstLine;
    }

    /** The redefined class name. */
    public String name() {
        return name;
    }

    /** The line of the first definition. */
    public int firstLine() {
        return firstLine;
    }
}
