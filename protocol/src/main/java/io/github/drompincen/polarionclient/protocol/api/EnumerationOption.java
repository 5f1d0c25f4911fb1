package io.github.drompincen.polarionclient.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_DEFAULT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnumerationOption(
        String id,
        String name,
        String description,
        String color,
        @JsonProperty("default") boolean defaultOption,
        boolean hidden,
        int sequence
) {}
