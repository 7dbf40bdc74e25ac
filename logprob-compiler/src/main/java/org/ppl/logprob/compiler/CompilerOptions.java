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

package org.ppl.logprob.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.ppl.logprob.compiler.errors.ConfigurationError;
import org.ppl.util.Logger;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /** Options controlling the rewriting of the graph. */
    @SuppressWarnings("CanBeFinal")
    public static class Rewriting {
        @Parameter(names = "--maxSweeps",
                description = "Maximum number of sweeps of an equilibrium pass; 0 chooses a limit based on the graph size")
        public int maxSweeps = 0;
        @Parameter(names = "--exclude", description = "Name of a rewrite rule which should not be applied (can be repeated)")
        public List<String> excludedRules = new ArrayList<>();
        @Parameter(names = "--noCanonicalize", description = "Do not simplify the graph before and after rewriting")
        public boolean noCanonicalize = false;

        public void validate() {
            if (this.maxSweeps < 0)
                throw new ConfigurationError("--maxSweeps must not be negative: " + this.maxSweeps);
        }

        @Override
        public String toString() {
            return "Rewriting{" +
                    "\n\tmaxSweeps=" + this.maxSweeps +
                    ",\n\texcludedRules=" + this.excludedRules +
                    ",\n\tnoCanonicalize=" + this.noCanonicalize +
                    '}';
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-o", description = "Output file; stdout if not specified")
        public String outputFile = "";
        @Parameter(names = "--json", description = "Emit the rewritten graph as JSON instead of text")
        public boolean emitJson = false;
        @Parameter(description = "Input JSON model; stdin if not specified")
        @Nullable
        public String inputFile = null;

        /** Set the logging levels specified with -T. */
        public void configureLogging() {
            for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
                int level;
                try {
                    level = Integer.parseInt(entry.getValue());
                } catch (NumberFormatException ex) {
                    throw new ConfigurationError("-T option must be followed by 'class=number'; could not parse " +
                            Utilities.singleQuote(entry.getKey() + "=" + entry.getValue()));
                }
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            }
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                    ",\n\temitJson=" + this.emitJson +
                    ",\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    ",\n\tloggingLevel=" + this.loggingLevel +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Rewriting rewriting = new Rewriting();

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    public void validate() {
        this.rewriting.validate();
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nrewriting=" + this.rewriting +
                "\n}";
    }
}
