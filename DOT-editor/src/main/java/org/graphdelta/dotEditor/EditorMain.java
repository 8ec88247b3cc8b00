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

package org.graphdelta.dotEditor;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.graphdelta.dotEditor.commands.CommandSchema;
import org.graphdelta.dotEditor.commands.DotCommand;
import org.graphdelta.dotEditor.errors.BaseEditorException;
import org.graphdelta.dotEditor.errors.EditorMessages;
import org.graphdelta.dotEditor.errors.SourceFileContents;
import org.graphdelta.dotEditor.errors.SourcePositionRange;
import org.graphdelta.dotEditor.tools.ToolCall;
import org.graphdelta.dotEditor.tools.ToolDefinitions;
import org.graphdelta.util.Logger;
import org.graphdelta.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/** Command-line entry point: reads a DOT file, applies edits, writes the result. */
public class EditorMain {
    final EditorOptions options;

    EditorMain() {
        this.options = new EditorOptions();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("dot-editor");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            commander.usage();
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (BaseEditorException ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        String outputFile = this.options.outputFile;
        if (outputFile.isEmpty())
            return System.out;
        return new PrintStream(Files.newOutputStream(Paths.get(outputFile)), false, StandardCharsets.UTF_8);
    }

    static String readInput(@Nullable String inputFile) throws IOException {
        if (inputFile == null)
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        return Utilities.readFile(inputFile);
    }

    /** Write the text to the output; false if an error was reported. */
    boolean write(String text, EditorMessages messages) {
        try {
            PrintStream stream = this.getOutputStream();
            stream.print(text);
            if (!text.endsWith("\n"))
                stream.println();
            if (stream != System.out)
                stream.close();
            else
                stream.flush();
            return true;
        } catch (IOException e) {
            messages.reportError(SourcePositionRange.INVALID,
                    "Error writing to output file", e.getMessage());
            return false;
        }
    }

    /** Run the editor; the exit code is in the returned messages. */
    EditorMessages run() {
        EditorMessages messages = new EditorMessages();
        messages.emitJsonErrors = this.options.emitJsonErrors;
        messages.quiet = this.options.quiet;

        if (this.options.printTools) {
            this.write(ToolDefinitions.toJson(ToolDefinitions.getToolDefinitions()).toPrettyString(), messages);
            return messages;
        }
        if (this.options.printPrompt) {
            this.write(ToolDefinitions.SYSTEM_PROMPT, messages);
            return messages;
        }
        if (this.options.printSchema) {
            this.write(CommandSchema.getSchema().toPrettyString(), messages);
            return messages;
        }
        if (this.options.printCommandExamples) {
            this.write(CommandSchema.examplesMarkdown(), messages);
            return messages;
        }
        if (this.options.printCommandPrompt) {
            this.write(CommandSchema.llmPrompt(), messages);
            return messages;
        }

        String dot;
        try {
            dot = readInput(this.options.inputFile);
        } catch (IOException e) {
            messages.reportError(SourcePositionRange.INVALID,
                    "Error reading file",
                    Utilities.singleQuote(this.options.inputFile) + " " + e.getMessage());
            return messages;
        }
        messages.sources = new SourceFileContents(this.options.inputFile, dot);

        DotDocument document;
        try {
            document = DotDocument.parse(dot, messages);
        } catch (BaseEditorException ex) {
            messages.reportError(ex);
            return messages;
        }
        if (this.options.graphName != null)
            document.setName(this.options.graphName);

        String file = null;
        try {
            if (this.options.commandsFile != null) {
                file = this.options.commandsFile;
                JsonNode json = Utilities.deterministicObjectMapper().readTree(Utilities.readFile(file));
                List<DotCommand> commands = DotCommand.listFromJson(json);
                if (this.options.atomic)
                    document.applyAtomically(commands, messages);
                else
                    document.applyAll(commands, messages);
            }
            if (this.options.dslFile != null) {
                file = this.options.dslFile;
                String script = Utilities.readFile(file);
                // Positions reported from here on refer to the script.
                messages.sources = new SourceFileContents(file, script);
                document.applyDsl(script, messages);
            }
            if (this.options.toolFile != null) {
                file = this.options.toolFile;
                ToolCall call = ToolCall.parse(Utilities.readFile(file));
                String answer = document.executeTool(call);
                if (answer != null) {
                    this.write(answer, messages);
                    return messages;
                }
            }
        } catch (JsonProcessingException e) {
            messages.reportError(SourcePositionRange.INVALID,
                    "Malformed JSON", Utilities.singleQuote(file) + " " + e.getOriginalMessage());
            return messages;
        } catch (IOException e) {
            messages.reportError(SourcePositionRange.INVALID,
                    "Error reading file", Utilities.singleQuote(file) + " " + e.getMessage());
            return messages;
        } catch (BaseEditorException ex) {
            messages.reportError(ex);
            return messages;
        }

        if (this.options.emitChunks)
            this.write(document.chunksToJson().toPrettyString(), messages);
        else
            this.write(document.toDot(), messages);
        return messages;
    }

    public static EditorMessages execute(String... argv) {
        EditorMain main = new EditorMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            // return empty messages
            EditorMessages result = new EditorMessages();
            result.setExitCode(exitCode);
            return result;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        EditorMessages messages = execute(argv);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
