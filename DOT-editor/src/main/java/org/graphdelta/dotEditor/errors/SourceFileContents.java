package org.graphdelta.dotEditor.errors;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** The text of an input (DOT or DSL), kept to decorate error messages with the offending fragment. */
public class SourceFileContents {
    @Nullable
    private String sourceFileName;
    private final List<String> lines = new ArrayList<>();

    public SourceFileContents() {
        this.sourceFileName = null;
    }

    public SourceFileContents(@Nullable String sourceFileName, String contents) {
        this.setEntireInput(sourceFileName, contents);
    }

    public void setEntireInput(@Nullable String sourceFileName, String contents) {
        this.sourceFileName = sourceFileName;
        this.lines.clear();
        this.lines.addAll(Arrays.asList(contents.split("\r?\n", -1)));
    }

    public String getSourceFileName() {
        return this.sourceFileName == null ? "(no input file)" : this.sourceFileName;
    }

    static String lineNo(int no) {
        return String.format("%5d|", no + 1);
    }

    /** Get the source lines covered by a range, with the first line's range underlined with ^^^. */
    public String getFragment(SourcePositionRange range) {
        if (!range.isValid())
            return "";
        int startLine = range.start.line - 1;
        if (startLine >= this.lines.size())
            return "";
        int endLine = Math.min(range.end.line - 1, this.lines.size() - 1);
        StringBuilder result = new StringBuilder();
        String line = this.lines.get(startLine);
        result.append(lineNo(startLine))
                .append(line)
                .append(System.lineSeparator());
        if (startLine == endLine) {
            int startCol = range.start.column - 1;
            int width = Math.max(1, range.end.column - range.start.column + 1);
            result.append(" ".repeat(startCol + 6))
                    .append("^".repeat(width))
                    .append(System.lineSeparator());
        } else if (endLine - startLine < 5) {
            for (int i = startLine + 1; i <= endLine; i++) {
                result.append(lineNo(i))
                        .append(this.lines.get(i))
                        .append(System.lineSeparator());
            }
        } else {
            result.append("      ...")
                    .append(System.lineSeparator())
                    .append(lineNo(endLine))
                    .append(this.lines.get(endLine))
                    .append(System.lineSeparator());
        }
        return result.toString();
    }
}
