package org.graphdelta.util;

import org.graphdelta.dotEditor.errors.InternalEditorError;
import org.junit.Assert;
import org.junit.Test;

public class IndentStreamTest {
    @Test
    public void testIndentation() {
        StringBuilder builder = new StringBuilder();
        IIndentStream stream = new IndentStream(builder);
        stream.append("a {")
                .increase()
                .append("b;")
                .newline()
                .append("c {")
                .increase()
                .append("d;")
                .newline()
                .decrease()
                .append("}")
                .newline()
                .decrease()
                .append("}")
                .newline();
        Assert.assertEquals("a {\n    b;\n    c {\n        d;\n    }\n}\n", builder.toString());
    }

    @Test
    public void testIndentAmount() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder).setIndentAmount(2);
        stream.append("x").increase().append("y\nz").newline();
        Assert.assertEquals("x\n  y\n  z\n", builder.toString());
    }

    @Test
    public void testEmptyLinesAreNotIndented() {
        StringBuilder builder = new StringBuilder();
        IIndentStream stream = new IndentStream(builder);
        stream.append("x").increase().newline().append("y");
        Assert.assertEquals("x\n\n    y", builder.toString());
    }

    @Test
    public void testNegativeIndent() {
        IIndentStream stream = new IndentStream(new StringBuilder());
        Assert.assertThrows(InternalEditorError.class, stream::decrease);
    }

    @Test
    public void testLoggerRedirect() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        try {
            Logger.INSTANCE.setLoggingLevel(IndentStreamTest.class, 2);
            Logger.INSTANCE.belowLevel(IndentStreamTest.class, 1).append("visible").newline();
            Logger.INSTANCE.belowLevel(IndentStreamTest.class, 3).append("hidden").newline();
        } finally {
            Logger.INSTANCE.setLoggingLevel(IndentStreamTest.class, 0);
            Logger.INSTANCE.setDebugStream(save);
        }
        Assert.assertEquals("visible\n", builder.toString());
    }
}
