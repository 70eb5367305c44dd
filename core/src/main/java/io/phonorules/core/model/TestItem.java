package io.phonorules.core.model;

/**
 * An entry of the scheme's test stream: either a {@link TestCase} or a {@link Note}, kept in
 * declaration order.
 */
public sealed interface TestItem permits TestCase, Note {

    /** 1-based declaration line. */
    int line();

    /** Number of rules declared before this item; fixes its position relative to the rules. */
    int rulesBefore();
}
