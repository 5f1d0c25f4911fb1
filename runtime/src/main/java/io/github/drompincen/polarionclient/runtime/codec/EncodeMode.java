package io.github.drompincen.polarionclient.runtime.codec;

public enum EncodeMode {
    /** Everything the resource holds, including links, meta and revision. */
    FULL,
    /** Request body of a create: data members only. */
    CREATE,
    /** Request body of an update: like CREATE, without read-only attributes. */
    UPDATE;

    boolean includesReadOnly() {
        return this != UPDATE;
    }

    boolean includesDocumentMembers() {
        return this == FULL;
    }
}
