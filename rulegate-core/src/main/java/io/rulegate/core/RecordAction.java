package io.rulegate.core;

import java.util.Locale;

/**
 * Kind of committed write carried by a record event.
 */
public enum RecordAction {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String wireValue;

    RecordAction(String wireValue) {
        this.wireValue = wireValue;
    }

    /** Value used in the {@code action} field of record messages. */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses a wire value, case-insensitively.
     *
     * @throws IllegalArgumentException if the value is not a known action
     */
    public static RecordAction fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (RecordAction action : values()) {
                if (action.wireValue.equals(normalized)) return action;
            }
        }
        throw new IllegalArgumentException("unknown record action: " + value);
    }
}
