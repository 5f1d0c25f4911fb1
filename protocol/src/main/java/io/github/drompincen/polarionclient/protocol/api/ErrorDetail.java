package io.github.drompincen.polarionclient.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of a JSON:API {@code errors} array. The pointer, when present, locates the
 * offending member, e.g. {@code /data/0/attributes/customFieldX}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorDetail(
        String status,
        String title,
        String detail,
        Source source
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Source(String pointer, String parameter) {}

    public String pointer() {
        return source != null ? source.pointer() : null;
    }

    public String describe() {
        String pointer = pointer();
        if (pointer != null && !pointer.isEmpty()) {
            return "field '" + pointer + "': " + detail;
        }
        if (title != null && !title.isEmpty()) {
            return title + ": " + detail;
        }
        return detail;
    }
}
