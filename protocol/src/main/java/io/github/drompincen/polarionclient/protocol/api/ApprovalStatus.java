package io.github.drompincen.polarionclient.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalStatus {
    WAITING("waiting"),
    APPROVED("approved"),
    DISAPPROVED("disapproved");

    private final String wireValue;

    ApprovalStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ApprovalStatus fromWire(String value) {
        for (ApprovalStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown approval status: " + value);
    }
}
