package org.graphdelta.dotEditor.errors;

/** A command could not be applied to a chunk list, or a tool call could not be translated.
 * The chunk list is never modified when this exception is thrown. */
public class CommandException extends BaseEditorException {
    public enum ErrorCode {
        NODE_ALREADY_EXISTS("Node already exists"),
        NODE_NOT_FOUND("Node not found"),
        EDGE_ALREADY_EXISTS("Edge already exists"),
        EDGE_NOT_FOUND("Edge not found"),
        PARENT_SUBGRAPH_NOT_FOUND("Parent subgraph not found"),
        SUBGRAPH_NOT_FOUND("Subgraph not found"),
        SUBGRAPH_ALREADY_EXISTS("Subgraph already exists"),
        ATTRIBUTE_NOT_FOUND("Attribute not found"),
        UNKNOWN_TOOL("Unknown tool"),
        MISSING_PARAMETER("Missing parameter"),
        INVALID_COMMAND("Invalid command");

        public final String description;

        ErrorCode(String description) {
            this.description = description;
        }
    }

    public final ErrorCode code;

    public CommandException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CommandException(ErrorCode code, String message, Throwable cause) {
        super(message, SourcePositionRange.INVALID, cause);
        this.code = code;
    }

    @Override
    public String getErrorKind() {
        return this.code.description;
    }
}
