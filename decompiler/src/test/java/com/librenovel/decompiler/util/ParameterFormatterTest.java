package com.librenovel.decompiler.util;

import com.librenovel.ast.ArgumentInfo;
import com.librenovel.ast.ParameterInfo;
import com.librenovel.ast.ParameterInfo.Parameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParameterFormatterTest {

    @Test
    void testFullSignature() {
        ParameterInfo info = new ParameterInfo(
            List.of(new Parameter("a", null), new Parameter("b", "1"), new Parameter("c", null)),
            List.of("a", "b"), "args", "kw");

        assertEquals("(a, b=1, *args, c, **kw)", ParameterFormatter.formatParameters(info));
    }

    @Test
    void testNameOnlyWithoutExtraPositional() {
        ParameterInfo info = new ParameterInfo(
            List.of(new Parameter("a", null), new Parameter("c", "2")),
            List.of("a"), null, null);

        assertEquals("(a, *, c=2)", ParameterFormatter.formatParameters(info));
    }

    @Test
    void testEmptySignature() {
        assertEquals("()", ParameterFormatter.formatParameters(new ParameterInfo(List.of(), List.of(), null, null)));
        assertEquals("", ParameterFormatter.formatParameters(null));
    }

    @Test
    void testArguments() {
        ArgumentInfo info = new ArgumentInfo(
            List.of(new ArgumentInfo.Argument(null, "1"), new ArgumentInfo.Argument("x", "2")),
            "rest", "kw");

        assertEquals("(1, x=2, *rest, **kw)", ParameterFormatter.formatArguments(info));
        assertEquals("(1, 2)", ParameterFormatter.formatArguments(ArgumentInfo.positional("1", "2")));
        assertEquals("", ParameterFormatter.formatArguments(null));
    }
}
