package org.graphdelta.dotEditor.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.graphdelta.dotEditor.IErrorReporter;
import org.graphdelta.util.Utilities;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Collects the errors and warnings produced while processing one document. */
public class EditorMessages implements IErrorReporter {
    public static class Message implements IHasSourcePositionRange {
        public final SourcePositionRange range;
        public final boolean warning;
        public final String errorType;
        public final String message;

        public Message(IHasSourcePositionRange range, boolean warning, String errorType, String message) {
            this.range = range.getPositionRange();
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        public Message(BaseEditorException e) {
            this(e, false, e.getErrorKind(), e.getMessage() != null ? e.getMessage() : "");
        }

        public void format(SourceFileContents contents, StringBuilder output) {
            if (this.range.isValid()) {
                output.append(contents.getSourceFileName())
                        .append(":")
                        .append(this.range.start)
                        .append(": ");
            }
            output.append(this.warning ? "warning:" : "error:")
                    .append(" ")
                    .append(this.errorType)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator())
                    .append(contents.getFragment(this.range));
        }

        public JsonNode toJson(SourceFileContents contents, ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            this.range.appendAsJson(result);
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            result.put("snippet", contents.getFragment(this.range));
            return result;
        }

        @Override
        public SourcePositionRange getPositionRange() {
            return this.range;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(new SourceFileContents(), builder);
            return builder.toString();
        }
    }

    public final List<Message> messages;
    public SourceFileContents sources;
    public int exitCode = 0;
    public boolean emitJsonErrors = false;
    public boolean quiet = false;

    public EditorMessages(SourceFileContents sources) {
        this.sources = sources;
        this.messages = new ArrayList<>();
    }

    public EditorMessages() {
        this(new SourceFileContents());
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    void add(Message message) {
        this.messages.add(message);
        if (!message.warning)
            this.setExitCode(1);
    }

    @Override
    public void reportProblem(IHasSourcePositionRange range, boolean warning, String errorType, String message) {
        this.add(new Message(range, warning, errorType, message));
    }

    @Override
    public void reportError(BaseEditorException e) {
        this.add(new Message(e));
    }

    @Override
    public boolean hasErrors() {
        return this.errorCount() > 0;
    }

    public int errorCount() {
        return (int) this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int) this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getMessage(int index) {
        return this.messages.get(index);
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public void clear() {
        this.messages.clear();
    }

    public void show(PrintStream stream) {
        if (this.errorCount() + (this.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages)
            result.add(message.toJson(this.sources, mapper));
        return result;
    }

    @Override
    public String toString() {
        if (this.emitJsonErrors)
            return this.toJson().toPrettyString();
        StringBuilder builder = new StringBuilder();
        for (Message message: this.messages) {
            if (this.quiet && message.warning)
                continue;
            message.format(this.sources, builder);
        }
        return builder.toString();
    }
}
