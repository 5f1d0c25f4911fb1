package io.github.drompincen.polarionclient.protocol.api;

import java.util.List;
import java.util.Optional;

/**
 * Options of one enumeration, in server order.
 */
public record Enumeration(EnumerationId id, List<EnumerationOption> options) {

    public Enumeration {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public Optional<EnumerationOption> option(String optionId) {
        return options.stream().filter(o -> o.id() != null && o.id().equals(optionId)).findFirst();
    }

    public Optional<EnumerationOption> defaultOption() {
        return options.stream().filter(EnumerationOption::defaultOption).findFirst();
    }

    public List<EnumerationOption> visibleOptions() {
        return options.stream().filter(o -> !o.hidden()).toList();
    }
}
