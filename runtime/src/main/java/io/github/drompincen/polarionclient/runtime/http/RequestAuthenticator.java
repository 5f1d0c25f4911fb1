package io.github.drompincen.polarionclient.runtime.http;

import java.util.Map;

/**
 * Supplies authentication headers for every request.
 */
@FunctionalInterface
public interface RequestAuthenticator {

    RequestAuthenticator NONE = Map::of;

    Map<String, String> headers();
}
