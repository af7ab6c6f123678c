package de.bsommerfeld.eventpulse.core.domain;

/**
 * Kind of a matched Reddit item. The {@link #prefix()} namespaces external
 * ids so a post and a comment can never collide even when Reddit hands out
 * the same base36 id in both id spaces.
 */
public enum MatchKind {

    POST("post"),
    COMMENT("comment");

    private final String value;

    MatchKind(String value) {
        this.value = value;
    }

    /** Lower-case storage value, also used as the external id prefix. */
    public String value() {
        return value;
    }

    public String prefix() {
        return value + "_";
    }

    public static MatchKind fromValue(String value) {
        for (MatchKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value))
                return kind;
        }
        throw new IllegalArgumentException("Unknown match kind: " + value);
    }
}
