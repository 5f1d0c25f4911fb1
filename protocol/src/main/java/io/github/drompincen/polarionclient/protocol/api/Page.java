package io.github.drompincen.polarionclient.protocol.api;

import java.util.List;

public record Page<T>(
        List<T> items,
        boolean hasNext,
        int totalCount
) {
    public static <T> Page<T> empty() {
        return new Page<>(List.of(), false, 0);
    }
}
