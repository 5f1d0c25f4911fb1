package io.github.drompincen.polarionclient.protocol.field;

/**
 * Field kinds a Polarion custom field definition can declare.
 */
public enum FieldKind {
    STRING("string"),
    TEXT("text"),
    TEXT_HTML("text/html"),
    INTEGER("integer"),
    FLOAT("float"),
    TIME("time"),
    DATE("date"),
    DATE_TIME("date-time"),
    DURATION("duration"),
    BOOLEAN("boolean"),
    ENUMERATION("enumeration"),
    RELATIONSHIP("relationship"),
    CODE("code"),
    STRUCTURE("structure"),
    CURRENCY("currency"),
    TABLE("table");

    private final String wireName;

    FieldKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FieldKind fromWireName(String name) {
        for (FieldKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown field kind: " + name);
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == CURRENCY;
    }

    public boolean isRichText() {
        return this == TEXT || this == TEXT_HTML;
    }
}
