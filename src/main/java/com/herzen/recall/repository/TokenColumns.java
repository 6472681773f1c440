package com.herzen.recall.repository;

import java.util.Arrays;
import java.util.List;

/** Token lists are stored space-joined; tokens never contain whitespace. */
final class TokenColumns {
    private TokenColumns() {}

    static String join(List<String> tokens) {
        return String.join(" ", tokens);
    }

    static List<String> split(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.trim().split(" ")).filter(s -> !s.isEmpty()).toList();
    }
}
