package io.github.drompincen.polarionclient.runtime.http;

import java.util.Map;
import java.util.Objects;

public final class BearerTokenAuthenticator implements RequestAuthenticator {

    private final String token;

    public BearerTokenAuthenticator(String token) {
        this.token = Objects.requireNonNull(token, "token");
        if (token.isBlank()) {
            throw new IllegalArgumentException("Bearer token must not be blank");
        }
    }

    @Override
    public Map<String, String> headers() {
        return Map.of("Authorization", "Bearer " + token);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthenticator[token=***]";
    }
}
