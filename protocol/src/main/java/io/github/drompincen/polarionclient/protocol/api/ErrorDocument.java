package io.github.drompincen.polarionclient.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorDocument(List<ErrorDetail> errors) {

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
