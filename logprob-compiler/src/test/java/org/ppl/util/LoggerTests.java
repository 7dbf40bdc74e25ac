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

package org.ppl.util;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.ppl.logprob.compiler.errors.ConfigurationError;
import org.ppl.logprob.compiler.passes.EquilibriumPass;
import org.ppl.logprob.compiler.rewrite.MeasurableRewrites;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;

import java.util.List;

public class LoggerTests {
    @After
    public void reset() {
        Logger.INSTANCE.reset();
        Logger.INSTANCE.setDebugStream(System.err);
    }

    @Test
    public void levelsByClassName() {
        StringBuilder builder = new StringBuilder();
        Logger.INSTANCE.setDebugStream(builder);
        int previous = Logger.INSTANCE.setLoggingLevel("EquilibriumPass", 1);
        Assert.assertEquals(0, previous);
        Assert.assertEquals(1, Logger.INSTANCE.getLoggingLevel(EquilibriumPass.class));

        Variable v = Tensors.vector("v", 3);
        FunctionGraph graph = new FunctionGraph(List.of(Tensors.exp(Tensors.diracDelta(v))));
        new EquilibriumPass("Lifting", MeasurableRewrites.measurableRules()).apply(graph);
        String log = builder.toString();
        Assert.assertTrue(log, log.contains("Lifting sweep 1: 1 rewrites"));
        Assert.assertTrue(log, log.contains("Lifting converged after 3 sweeps"));
        // Level 2 messages are not shown
        Assert.assertFalse(log, log.contains("LiftDiracDelta:"));
    }

    @Test
    public void silentByDefault() {
        StringBuilder builder = new StringBuilder();
        Logger.INSTANCE.setDebugStream(builder);
        Logger.INSTANCE.belowLevel(LoggerTests.class, 1).append("hidden").newline();
        Assert.assertEquals("", builder.toString());
        Logger.INSTANCE.setLoggingLevel(LoggerTests.class, 1);
        Logger.INSTANCE.belowLevel(LoggerTests.class, 1).append("shown").newline();
        Assert.assertTrue(builder.toString().contains("shown"));
    }

    @Test
    public void unknownClass() {
        Assert.assertThrows(ConfigurationError.class, () -> Logger.INSTANCE.setLoggingLevel("NoSuchClass", 1));
    }

    @Test
    public void indentation() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder);
        stream.append("a").increase().append("b").newline().decrease().append("c").newline();
        Assert.assertEquals("a\n    b\nc\n", builder.toString());
    }
}
