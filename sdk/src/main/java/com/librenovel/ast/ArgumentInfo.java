package com.librenovel.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Argument list of a call statement.
 *
 * @param arguments arguments in order; the name is null for positional ones
 * @param extraPositional expression passed with *, or null
 * @param extraKeyword expression passed with **, or null
 */
public record ArgumentInfo(List<Argument> arguments, String extraPositional, String extraKeyword) {

    public record Argument(String name, String value) {}

    public static ArgumentInfo positional(String... values) {
        return new ArgumentInfo(
            Arrays.stream(values).map(v -> new Argument(null, v)).toList(), null, null);
    }
}
