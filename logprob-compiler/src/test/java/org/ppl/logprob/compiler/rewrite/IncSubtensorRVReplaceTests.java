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

package org.ppl.logprob.compiler.rewrite;

import org.junit.Assert;
import org.junit.Test;
import org.ppl.logprob.compiler.ProvenanceTracker;
import org.ppl.logprob.compiler.passes.EquilibriumPass;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.IndexEntry;
import org.ppl.logprob.ir.value.NDArray;
import org.ppl.simulator.GraphEvaluator;

import java.util.List;
import java.util.Map;

public class IncSubtensorRVReplaceTests extends RewriteTestBase {
    static final List<IndexEntry> EVEN = List.of(IndexEntry.array(0, 2));

    static Variable draw() {
        return Tensors.normal(Tensors.constant(0.0), Tensors.constant(1.0), List.of(4));
    }

    @Test
    public void partialObservation() {
        Variable x = draw();
        Variable written = Tensors.setSubtensor(x, EVEN, Tensors.constant(10, 20));
        Variable y = Tensors.vector("y", 4);
        FunctionGraph graph = trackedGraph(bindings(written, y), written);

        EquilibriumPass pass = pass(new IncSubtensorRVReplace());
        pass.apply(graph);
        Assert.assertEquals(1, pass.getFirings());
        Assert.assertSame(x, graph.getOutput(0));

        ProvenanceTracker tracker = tracker(graph);
        Assert.assertEquals(1, tracker.getBindings().size());
        Assert.assertFalse(tracker.isBound(written));
        Variable value = tracker.getValue(x);
        Assert.assertNotNull(value);
        Assert.assertSame(y, tracker.getOriginalValue(value));
        NDArray result = new GraphEvaluator(Map.of(y, NDArray.vector(1, 2, 3, 4))).evaluate(value);
        Assert.assertEquals(NDArray.vector(10, 2, 20, 4), result);
    }

    @Test
    public void incrementTreatedAsWrite() {
        Variable x = draw();
        Variable written = Tensors.incSubtensor(x, EVEN, Tensors.constant(10, 20));
        Variable y = Tensors.vector("y", 4);
        FunctionGraph graph = trackedGraph(bindings(written, y), written);

        pass(new IncSubtensorRVReplace()).apply(graph);
        Variable value = tracker(graph).getValue(x);
        Assert.assertNotNull(value);
        NDArray result = new GraphEvaluator(Map.of(y, NDArray.vector(1, 2, 3, 4))).evaluate(value);
        Assert.assertEquals(NDArray.vector(10, 2, 20, 4), result);
    }

    @Test
    public void noTracker() {
        Variable written = Tensors.setSubtensor(draw(), EVEN, Tensors.constant(10, 20));
        FunctionGraph graph = new FunctionGraph(List.of(written));
        Assert.assertNull(new IncSubtensorRVReplace().transform(graph, written.owner));
    }

    @Test
    public void unboundWrite() {
        Variable written = Tensors.setSubtensor(draw(), EVEN, Tensors.constant(10, 20));
        FunctionGraph graph = trackedGraph(written);
        Assert.assertNull(new IncSubtensorRVReplace().transform(graph, written.owner));
    }

    @Test
    public void boundBase() {
        Variable x = draw();
        Variable written = Tensors.setSubtensor(x, EVEN, Tensors.constant(10, 20));
        Map<Variable, Variable> bindings = bindings(written, Tensors.vector("y", 4));
        bindings.put(x, Tensors.vector("x", 4));
        FunctionGraph graph = trackedGraph(bindings, written);
        Assert.assertNull(new IncSubtensorRVReplace().transform(graph, written.owner));
        Assert.assertEquals(2, tracker(graph).getBindings().size());
    }

    @Test
    public void baseNotMeasurable() {
        Variable written = Tensors.setSubtensor(Tensors.exp(draw()), EVEN, Tensors.constant(10, 20));
        FunctionGraph graph = trackedGraph(bindings(written, Tensors.vector("y", 4)), written);
        Assert.assertNull(new IncSubtensorRVReplace().transform(graph, written.owner));

        Variable free = Tensors.setSubtensor(Tensors.vector("v", 4), EVEN, Tensors.constant(10, 20));
        FunctionGraph other = trackedGraph(bindings(free, Tensors.vector("y", 4)), free);
        Assert.assertNull(new IncSubtensorRVReplace().transform(other, free.owner));
    }
}
