package io.catalogconnector.client.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OperationType {
    READ("read"),
    WRITE("write");

    private final String value;

    OperationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
