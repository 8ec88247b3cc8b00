/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.graphdelta.util;

import org.graphdelta.dotEditor.errors.InternalEditorError;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/** An {@link IIndentStream} writing to an {@link Appendable}.
 * Indentation is emitted lazily, before the first non-space character of each line. */
public class IndentStream implements IIndentStream {
    private Appendable stream;
    private int amount;
    private int level = 0;
    private boolean atLineStart = false;
    /** indents.get(i) is the prefix for level i */
    private final List<String> indents = new ArrayList<>();

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
        this.setIndentAmount(4);
    }

    /** Set the output stream.
     * @return The previous output stream. */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    /** Number of spaces per indentation level. */
    public IndentStream setIndentAmount(int amount) {
        Utilities.enforce(amount >= 0, () -> "Negative indent amount " + amount);
        this.amount = amount;
        this.indents.clear();
        this.indents.add("");
        return this;
    }

    private String currentIndent() {
        while (this.indents.size() <= this.level)
            this.indents.add(" ".repeat(this.amount * this.indents.size()));
        return this.indents.get(this.level);
    }

    private void write(CharSequence data) {
        try {
            this.stream.append(data);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            this.write("\n");
            this.atLineStart = true;
            return this;
        }
        if (this.atLineStart && !Character.isSpaceChar(c)) {
            this.atLineStart = false;
            this.write(this.currentIndent());
        }
        this.write(String.valueOf(c));
        return this;
    }

    @Override
    public IIndentStream appendFast(String s) {
        if (s.isEmpty())
            return this;
        if (this.atLineStart) {
            this.atLineStart = false;
            this.write(this.currentIndent());
        }
        this.write(s);
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.level++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        if (this.level == 0)
            throw new InternalEditorError("Negative indent");
        this.level--;
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
