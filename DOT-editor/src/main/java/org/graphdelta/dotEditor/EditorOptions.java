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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import org.graphdelta.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Command-line options of the editor. */
@SuppressWarnings("CanBeFinal")
public class EditorOptions {
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = "-o", description = "Output file; stdout if not specified")
    public String outputFile = "";
    @Nullable @Parameter(names = "--commands", description = "Apply the JSON commands (an object or an array) in the file")
    public String commandsFile = null;
    @Nullable @Parameter(names = "--dsl", description = "Apply the editing script in the file")
    public String dslFile = null;
    @Nullable @Parameter(names = "--tool", description = "Execute the tool call in the file; query results go to the output")
    public String toolFile = null;
    @Parameter(names = "--atomic", description = "Apply the JSON commands only if all of them succeed")
    public boolean atomic = false;
    @Nullable @Parameter(names = "--name", description = "Name of the output graph")
    public String graphName = null;
    @Parameter(names = "--tools", description = "Print the tool definitions as JSON and exit")
    public boolean printTools = false;
    @Parameter(names = "--prompt", description = "Print the system prompt for tool use and exit")
    public boolean printPrompt = false;
    @Parameter(names = "--schema", description = "Print the JSON schema of the commands accepted by --commands and exit")
    public boolean printSchema = false;
    @Parameter(names = "--command-examples", description = "Print examples of JSON commands as Markdown and exit")
    public boolean printCommandExamples = false;
    @Parameter(names = "--command-prompt", description = "Print the prompt for a model answering with JSON commands and exit")
    public boolean printCommandPrompt = false;
    @Parameter(names = "--chunks", description = "Output the chunk list as JSON instead of DOT")
    public boolean emitChunks = false;
    @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array to stderr")
    public boolean emitJsonErrors = false;
    @Parameter(names = "-q", description = "Quiet: do not print warnings")
    public boolean quiet = false;
    @Nullable @Parameter(description = "Input DOT file; stdin if not specified")
    public String inputFile = null;
    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;

    @Override
    public String toString() {
        return "EditorOptions{" +
                "loggingLevel=" + this.loggingLevel +
                ", outputFile=" + Utilities.singleQuote(this.outputFile) +
                ", commandsFile=" + this.commandsFile +
                ", dslFile=" + this.dslFile +
                ", toolFile=" + this.toolFile +
                ", atomic=" + this.atomic +
                ", graphName=" + this.graphName +
                ", emitChunks=" + this.emitChunks +
                ", emitJsonErrors=" + this.emitJsonErrors +
                ", inputFile=" + this.inputFile +
                '}';
    }
}
