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

import org.junit.Assert;
import org.junit.Test;
import org.ppl.logprob.compiler.errors.ConfigurationError;
import org.ppl.logprob.ir.Constant;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.IndexEntry;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.logprob.ir.value.NDArray;
import org.ppl.simulator.GraphEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class MeasurableIRBuilderTests {
    static final List<IndexEntry> EVEN = List.of(IndexEntry.array(0, 2));

    static OpKind kind(Variable variable) {
        Assert.assertNotNull(variable.owner);
        return variable.owner.op.kind();
    }

    @Test
    public void noBindings() {
        MeasurableIR result = new MeasurableIRBuilder().construct(new LinkedHashMap<>());
        Assert.assertTrue(result.graph().getOutputs().isEmpty());
        Assert.assertTrue(result.rvValues().isEmpty());
        Assert.assertTrue(result.originalValues().isEmpty());
    }

    @Test
    public void clonesBoundVariables() {
        Variable mu = Tensors.scalar("mu");
        Variable x = Tensors.normal(mu, Tensors.constant(1.0));
        Variable value = Tensors.scalar("x");
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(x, value);

        MeasurableIR result = new MeasurableIRBuilder().construct(bindings);
        Variable clone = result.getClone(x);
        Assert.assertNotSame(x, clone);
        Assert.assertSame(clone, result.graph().getOutput(0));
        // Values and free inputs are not cloned
        Assert.assertSame(value, result.rvValues().get(clone));
        Assert.assertSame(mu, result.getClone(mu));
        Assert.assertSame(value, result.originalValues().get(value));
        // The caller's map is unchanged
        Assert.assertEquals(1, bindings.size());
        Assert.assertSame(value, bindings.get(x));
    }

    @Test
    public void outputsFollowBindingOrder() {
        Variable first = Tensors.normal(Tensors.scalar("mu"), Tensors.constant(1.0));
        Variable second = Tensors.exp(first);
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(second, Tensors.scalar("s"));
        bindings.put(first, Tensors.scalar("f"));

        MeasurableIR result = new MeasurableIRBuilder().construct(bindings);
        Assert.assertEquals(List.of(result.getClone(second), result.getClone(first)), result.graph().getOutputs());
        Assert.assertEquals(List.of(result.getClone(second), result.getClone(first)),
                List.copyOf(result.rvValues().keySet()));
        // Shared nodes are cloned once
        Assert.assertSame(result.getClone(first), result.getClone(second).owner.getInput(0));
    }

    @Test
    public void partialObservation() {
        Variable x = Tensors.normal(Tensors.constant(0.0), Tensors.constant(1.0), List.of(4));
        Variable written = Tensors.setSubtensor(x, EVEN, Tensors.constant(10, 20));
        Variable y = Tensors.vector("y", 4);
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(written, y);

        MeasurableIR result = new MeasurableIRBuilder().construct(bindings);
        Variable rv = result.getClone(x);
        Assert.assertSame(rv, result.graph().getOutput(0));
        Assert.assertEquals(1, result.rvValues().size());
        Variable value = result.rvValues().get(rv);
        Assert.assertNotNull(value);
        Assert.assertSame(y, result.originalValues().get(value));
        NDArray actual = new GraphEvaluator(Map.of(y, NDArray.vector(1, 2, 3, 4))).evaluate(value);
        Assert.assertEquals(NDArray.vector(10, 2, 20, 4), actual);

        // The input graph is not modified
        Assert.assertSame(x, written.owner.getInput(0));
        Assert.assertTrue(result.memo().containsKey(written));
    }

    @Test
    public void broadcastLifted() {
        Variable mu = Tensors.scalar("mu");
        Variable rv = Tensors.normal(mu, Tensors.constant(1.0));
        Variable broadcast = Tensors.broadcastTo(rv, 3);
        Variable value = Tensors.vector("value", 3);
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(broadcast, value);

        MeasurableIR result = new MeasurableIRBuilder().construct(bindings);
        Variable output = result.graph().getOutput(0);
        Assert.assertEquals(OpKind.RANDOM_VARIABLE, kind(output));
        Assert.assertEquals(List.of(3), output.type.shape);
        Assert.assertSame(value, result.rvValues().get(output));
        Assert.assertEquals(OpKind.BROADCAST_TO, kind(output.owner.getInput(0)));
        // The broadcast constant is folded
        Variable sigma = output.owner.getInput(1);
        Assert.assertTrue(sigma instanceof Constant);
        Assert.assertEquals(NDArray.vector(1, 1, 1), ((Constant) sigma).value);

        Assert.assertSame(rv, broadcast.owner.getInput(0));
    }

    @Test
    public void excludedRule() {
        CompilerOptions options = new CompilerOptions();
        options.rewriting.excludedRules.add("IncSubtensorRVReplace");
        Variable x = Tensors.normal(Tensors.constant(0.0), Tensors.constant(1.0), List.of(4));
        Variable written = Tensors.setSubtensor(x, EVEN, Tensors.constant(10, 20));
        Variable y = Tensors.vector("y", 4);
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(written, y);

        MeasurableIR result = new MeasurableIRBuilder(options).construct(bindings);
        Variable output = result.graph().getOutput(0);
        Assert.assertEquals(OpKind.INC_SUBTENSOR, kind(output));
        Assert.assertSame(y, result.rvValues().get(output));
    }

    @Test
    public void badOptions() {
        CompilerOptions unknown = new CompilerOptions();
        unknown.rewriting.excludedRules.add("NoSuchRule");
        Assert.assertThrows(ConfigurationError.class, () -> new MeasurableIRBuilder(unknown));

        CompilerOptions negative = new CompilerOptions();
        negative.rewriting.maxSweeps = -1;
        Assert.assertThrows(ConfigurationError.class, () -> new MeasurableIRBuilder(negative));
    }

    @Test
    public void withoutCanonicalization() {
        CompilerOptions options = new CompilerOptions();
        options.rewriting.noCanonicalize = true;
        Variable rv = Tensors.normal(Tensors.scalar("mu"), Tensors.constant(1.0));
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(Tensors.broadcastTo(rv, 3), Tensors.vector("value", 3));

        MeasurableIR result = new MeasurableIRBuilder(options).construct(bindings);
        Variable output = result.graph().getOutput(0);
        Assert.assertEquals(OpKind.RANDOM_VARIABLE, kind(output));
        Assert.assertEquals(OpKind.BROADCAST_TO, kind(output.owner.getInput(1)));
    }

    @Test
    public void excludedLiftRemovesMarker() {
        CompilerOptions options = new CompilerOptions();
        options.rewriting.excludedRules.add("LiftDiracDelta");
        Variable v = Tensors.scalar("v");
        Variable x = Tensors.normal(Tensors.exp(Tensors.diracDelta(v)), Tensors.constant(1.0));
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(x, Tensors.scalar("x"));

        MeasurableIR result = new MeasurableIRBuilder(options).construct(bindings);
        Variable mu = result.graph().getOutput(0).owner.getInput(0);
        Assert.assertEquals(OpKind.ELEMWISE, kind(mu));
        Assert.assertSame(v, mu.owner.getInput(0));
    }

    /** Builds the measurable form of a partially observed vector and checks the bound value. */
    static void buildPartialObservation(MeasurableIRBuilder builder, double observed) {
        Variable x = Tensors.normal(Tensors.constant(0.0), Tensors.constant(1.0), List.of(4));
        Variable written = Tensors.setSubtensor(x, EVEN, Tensors.constant(observed, observed + 1));
        Variable y = Tensors.vector("y", 4);
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(Tensors.exp(Tensors.diracDelta(Tensors.broadcastTo(Tensors.scalar("s"), 3))),
                Tensors.vector("z", 3));
        bindings.put(written, y);

        MeasurableIR result = builder.construct(bindings);
        Variable rv = result.getClone(x);
        Variable value = result.rvValues().get(rv);
        Assert.assertNotNull(value);
        NDArray actual = new GraphEvaluator(Map.of(y, NDArray.vector(1, 2, 3, 4))).evaluate(value);
        Assert.assertEquals(NDArray.vector(observed, 2, observed + 1, 4), actual);
        Assert.assertEquals(2, result.rvValues().size());
    }

    @Test
    public void concurrentBuilds() throws Exception {
        MeasurableIRBuilder builder = new MeasurableIRBuilder();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                double observed = 10 * i;
                results.add(executor.submit(() -> {
                    for (int j = 0; j < 20; j++)
                        buildPartialObservation(builder, observed);
                }));
            }
            // Rethrows the first failure
            for (Future<?> result: results)
                result.get();
        } finally {
            executor.shutdownNow();
        }
    }
}
