package com.updates.dtree.api;

/**
 * The closed set of decision node variants.
 *
 * The enum name doubles as the persisted variant tag. Adding a constant
 * without registering a codec for it makes the serializer registry fail at
 * construction.
 */
public enum NodeType {
    TERMINAL,
    EQUALS_BRANCH,
    ORDERED_CUTOFF,
    SET_MEMBERSHIP,
    ENUMERATED,
    PROBABILISTIC;

    public String tag() {
        return name();
    }

    public static NodeType fromString(String text) {
        for (NodeType t : NodeType.values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }
}
