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
 *
 *
 */

package org.ppl.logprob;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.ppl.logprob.compiler.CompilerOptions;
import org.ppl.logprob.compiler.MeasurableIR;
import org.ppl.logprob.compiler.MeasurableIRBuilder;
import org.ppl.logprob.compiler.backend.JsonDecoder;
import org.ppl.logprob.compiler.backend.ToJson;
import org.ppl.logprob.compiler.errors.BaseCompilerException;
import org.ppl.logprob.ir.Variable;
import org.ppl.util.IndentStream;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/** Reads a model in JSON, builds its measurable form, and writes the result. */
public class CompilerMain {
    final CompilerOptions options;
    final PrintStream err;

    CompilerMain(PrintStream err) {
        this.options = new CompilerOptions();
        this.err = err;
    }

    void usage(JCommander commander) {
        // JCommander mistakenly prints this as default value
        // if it manages to parse it partially.
        this.options.ioOptions.loggingLevel.clear();
        commander.usage();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("logprob-compiler");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            this.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        String outputFile = this.options.ioOptions.outputFile;
        if (outputFile.isEmpty())
            return System.out;
        return new PrintStream(Files.newOutputStream(Paths.get(outputFile)), true, StandardCharsets.UTF_8);
    }

    InputStream getInputFile(@Nullable String inputFile) throws IOException {
        if (inputFile == null)
            return System.in;
        return Files.newInputStream(Paths.get(inputFile));
    }

    void write(MeasurableIR result, PrintStream stream) {
        if (this.options.ioOptions.emitJson) {
            stream.println(ToJson.toJsonString(result.graph(), result.rvValues()));
            return;
        }
        IndentStream output = new IndentStream(stream);
        output.append(result.graph())
                .append("Bindings:")
                .increase();
        for (Map.Entry<Variable, Variable> entry: result.rvValues().entrySet())
            output.append(entry.getKey().toString())
                    .append(" -> ")
                    .append(entry.getValue().toString())
                    .newline();
        output.decrease();
    }

    /** Run the compiler, return the exit code. */
    int run() {
        this.options.ioOptions.configureLogging();
        String json;
        try (InputStream input = this.getInputFile(this.options.ioOptions.inputFile)) {
            json = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            this.err.println("Error reading file " +
                    Utilities.singleQuote(this.options.ioOptions.inputFile) + ": " + e.getMessage());
            return 1;
        }
        JsonDecoder.Model model = JsonDecoder.decode(json);
        MeasurableIR result = new MeasurableIRBuilder(this.options).construct(model.bindings());
        try {
            PrintStream stream = this.getOutputStream();
            try {
                this.write(result, stream);
            } finally {
                if (stream != System.out)
                    stream.close();
            }
        } catch (IOException e) {
            this.err.println("Error writing to file " +
                    Utilities.singleQuote(this.options.ioOptions.outputFile) + ": " + e.getMessage());
            return 1;
        }
        return 0;
    }

    /** Parse the options and run; errors are reported on 'err'.
     * @return The exit code. */
    public static int execute(PrintStream err, String... argv) {
        CompilerMain main = new CompilerMain(err);
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0)
            return exitCode;
        try {
            return main.run();
        } catch (BaseCompilerException ex) {
            err.println(ex.getErrorKind() + ": " + ex.getMessage());
            return 1;
        }
    }

    public static void main(String[] argv) {
        int exitCode = execute(System.err, argv);
        if (exitCode != 0)
            System.exit(exitCode);
    }
}
