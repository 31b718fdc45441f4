package com.librenovel.decompiler.util;

import com.librenovel.ast.ArgumentInfo;
import com.librenovel.ast.ParameterInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds parameter signatures and argument lists.
 */
public final class ParameterFormatter {

    private ParameterFormatter() {}

    /**
     * Format a label or transform signature, e.g. "(a, b=1, *args, c, **kw)".
     * Returns an empty string when there is no signature.
     */
    public static String formatParameters(ParameterInfo info) {
        if (info == null) return "";

        List<String> parts = new ArrayList<>();
        List<ParameterInfo.Parameter> nameOnly = new ArrayList<>();

        for (ParameterInfo.Parameter parameter : info.parameters()) {
            if (info.isPositional(parameter)) {
                parts.add(formatParameter(parameter));
            } else {
                nameOnly.add(parameter);
            }
        }

        if (info.extraPositional() != null) {
            parts.add("*" + info.extraPositional());
        }

        if (!nameOnly.isEmpty()) {
            if (info.extraPositional() == null) {
                parts.add("*");
            }
            for (ParameterInfo.Parameter parameter : nameOnly) {
                parts.add(formatParameter(parameter));
            }
        }

        if (info.extraKeyword() != null) {
            parts.add("**" + info.extraKeyword());
        }

        return "(" + String.join(", ", parts) + ")";
    }

    /**
     * Format call arguments, e.g. "(1, x=2, *rest, **kw)".
     * Returns an empty string when there are no arguments.
     */
    public static String formatArguments(ArgumentInfo info) {
        if (info == null) return "";

        List<String> parts = new ArrayList<>();
        for (ArgumentInfo.Argument argument : info.arguments()) {
            if (argument.name() != null) {
                parts.add(argument.name() + "=" + argument.value());
            } else {
                parts.add(argument.value());
            }
        }
        if (info.extraPositional() != null) {
            parts.add("*" + info.extraPositional());
        }
        if (info.extraKeyword() != null) {
            parts.add("**" + info.extraKeyword());
        }

        return "(" + String.join(", ", parts) + ")";
    }

    private static String formatParameter(ParameterInfo.Parameter parameter) {
        if (parameter.defaultValue() == null) {
            return parameter.name();
        }
        return parameter.name() + "=" + parameter.defaultValue();
    }
}
