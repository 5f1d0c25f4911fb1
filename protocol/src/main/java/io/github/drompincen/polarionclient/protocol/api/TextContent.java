package io.github.drompincen.polarionclient.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Rich text value: {@code {"type": "text/html", "value": "<p>...</p>"}}.
 */
public record TextContent(String type, String value) {

    public static final String HTML = "text/html";
    public static final String PLAIN = "text/plain";

    public static TextContent html(String html) {
        return new TextContent(HTML, html);
    }

    public static TextContent plain(String text) {
        return new TextContent(PLAIN, text);
    }

    @JsonIgnore
    public boolean isHtml() {
        return HTML.equals(type);
    }
}
