package org.graphdelta.dotEditor.commands;

import org.graphdelta.dotEditor.IErrorReporter;
import org.graphdelta.dotEditor.chunks.Chunk;
import org.graphdelta.dotEditor.chunks.Chunks;
import org.graphdelta.dotEditor.errors.BaseEditorException;
import org.graphdelta.util.IWritesLogs;
import org.graphdelta.util.Logger;

import java.util.List;

/** Applies sequences of commands. */
public class CommandBatch implements IWritesLogs {
    private final IErrorReporter reporter;

    public CommandBatch(IErrorReporter reporter) {
        this.reporter = reporter;
    }

    /**
     * Apply the commands in order.  A failing command is reported and skipped;
     * the effects of the commands before it are kept.
     * @return The number of commands which were applied.
     */
    public int applyAll(List<Chunk> chunks, List<DotCommand> commands) {
        CommandApplier applier = new CommandApplier(chunks);
        int applied = 0;
        for (DotCommand command: commands) {
            try {
                applier.apply(command);
                applied++;
            } catch (BaseEditorException ex) {
                Logger.INSTANCE.belowLevel(this, 1)
                        .append("Skipping ")
                        .append(command.getAction())
                        .append(": ")
                        .append(ex.getMessage())
                        .newline();
                this.reporter.reportError(ex);
            }
        }
        return applied;
    }

    /**
     * Apply all commands to a copy of the chunk list, and replace the contents of the
     * list with the copy only if every command succeeded.  On failure the error is
     * reported and the list is left untouched.
     * @return The number of commands applied: all of them, or 0.
     */
    public int applyAtomically(List<Chunk> chunks, List<DotCommand> commands) {
        List<Chunk> snapshot = Chunks.copy(chunks);
        CommandApplier applier = new CommandApplier(snapshot);
        for (DotCommand command: commands) {
            try {
                applier.apply(command);
            } catch (BaseEditorException ex) {
                this.reporter.reportError(ex);
                return 0;
            }
        }
        chunks.clear();
        chunks.addAll(snapshot);
        return commands.size();
    }
}
