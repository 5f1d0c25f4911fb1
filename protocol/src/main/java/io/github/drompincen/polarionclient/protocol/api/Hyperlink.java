package io.github.drompincen.polarionclient.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Hyperlink(String uri, String role) {
}
