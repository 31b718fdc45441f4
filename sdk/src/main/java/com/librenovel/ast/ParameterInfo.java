package com.librenovel.ast;

import java.util.List;

/**
 * Parameter signature of a label or transform.
 *
 * @param parameters every parameter in declaration order
 * @param positional names of the parameters that may be passed positionally
 * @param extraPositional name of the *args parameter, or null
 * @param extraKeyword name of the **kwargs parameter, or null
 */
public record ParameterInfo(
    List<Parameter> parameters,
    List<String> positional,
    String extraPositional,
    String extraKeyword
) {

    /**
     * A parameter with an optional default value expression.
     */
    public record Parameter(String name, String defaultValue) {}

    public boolean isPositional(Parameter parameter) {
        return positional.contains(parameter.name());
    }
}
