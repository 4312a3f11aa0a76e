package io.rulegate.core;

/**
 * Operation kinds an access rule can be defined for.
 */
public enum RuleType {
    /** Listing/searching records. */
    LIST,
    /** Reading a single record; also gates realtime delivery. */
    VIEW,
    CREATE,
    UPDATE,
    DELETE
}
