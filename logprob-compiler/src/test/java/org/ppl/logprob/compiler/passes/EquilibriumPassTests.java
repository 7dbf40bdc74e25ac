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

package org.ppl.logprob.compiler.passes;

import org.junit.Assert;
import org.junit.Test;
import org.ppl.logprob.compiler.ProvenanceTracker;
import org.ppl.logprob.compiler.ShapeFeature;
import org.ppl.logprob.compiler.errors.InternalCompilerError;
import org.ppl.logprob.compiler.rewrite.MeasurableRewrites;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.DimShuffleOp;
import org.ppl.logprob.ir.op.ElemwiseOp;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.logprob.ir.op.ScalarOpcode;
import org.ppl.util.Linq;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class EquilibriumPassTests {
    static FunctionGraph graph(Variable... outputs) {
        FunctionGraph graph = new FunctionGraph(List.of(outputs));
        graph.attachFeature(new ShapeFeature());
        graph.attachFeature(new ProvenanceTracker(new LinkedHashMap<>()));
        return graph;
    }

    @Test
    public void pointMassLiftedThroughChain() {
        Variable v = Tensors.vector("v", 3);
        Variable result = Tensors.dimShuffle(Tensors.broadcastTo(Tensors.diracDelta(v), 2, 3), 1, 0);
        FunctionGraph graph = graph(result);

        EquilibriumPass pass = new EquilibriumPass("test", MeasurableRewrites.measurableRules());
        pass.apply(graph);
        Assert.assertEquals(3, pass.getFirings());
        Assert.assertEquals(3, pass.getSweeps());
        Assert.assertEquals(Map.of("LiftDiracDelta", 2, "RemoveDiracDelta", 1), pass.getFiringsPerRule());

        List<OpKind> kinds = Linq.map(graph.toposort(), (Apply a) -> a.op.kind());
        Assert.assertEquals(List.of(OpKind.BROADCAST_TO, OpKind.DIMSHUFFLE), kinds);
        Variable output = graph.getOutput(0);
        Assert.assertEquals(List.of(3, 2), output.type.shape);
        Assert.assertEquals(List.of(1, 0), output.owner.op.to(DimShuffleOp.class).newOrder);
        Assert.assertSame(v, output.owner.getInput(0).owner.getInput(0));
    }

    @Test
    public void sweepsBoundedByGraphSize() {
        Variable v = Tensors.vector("v", 3);
        Variable chain = Tensors.diracDelta(v);
        for (int i = 0; i < 8; i++)
            chain = i % 2 == 0 ? Tensors.exp(chain) : Tensors.neg(chain);
        Variable transposed = Tensors.dimShuffle(Tensors.broadcastTo(chain, 2, 3), 1, 0);
        Variable broadcast = Tensors.broadcastTo(Tensors.normal(Tensors.scalar("mu"), Tensors.constant(1.0)), 3);
        FunctionGraph graph = graph(transposed, broadcast);
        int size = graph.size();
        Assert.assertEquals(13, size);

        // The limit is the number of nodes
        EquilibriumPass pass = new EquilibriumPass("test", MeasurableRewrites.measurableRules(), size);
        pass.apply(graph);
        Assert.assertTrue(pass.getSweeps() <= size);
        Assert.assertEquals(Integer.valueOf(10), pass.getFiringsPerRule().get("LiftDiracDelta"));
        List<OpKind> kinds = Linq.map(graph.toposort(), (Apply a) -> a.op.kind());
        Assert.assertFalse(kinds.contains(OpKind.DIRAC_DELTA));
        Assert.assertEquals(OpKind.DIMSHUFFLE, graph.getOutput(0).owner.op.kind());
        Assert.assertEquals(OpKind.RANDOM_VARIABLE, graph.getOutput(1).owner.op.kind());
    }

    @Test
    public void fixpointReached() {
        Variable v = Tensors.vector("v", 3);
        FunctionGraph graph = graph(Tensors.exp(v));
        RecordingRule rule = RecordingRule.never("never", OpKind.ELEMWISE);
        EquilibriumPass pass = new EquilibriumPass("test", new RuleTable().register(rule, 0));
        pass.apply(graph);
        Assert.assertEquals(1, pass.getSweeps());
        Assert.assertEquals(0, pass.getFirings());
        Assert.assertEquals(1, rule.calls);
    }

    @Test
    public void nonConvergence() {
        Variable v = Tensors.vector("v", 3);
        FunctionGraph graph = graph(Tensors.exp(v));
        // Always produces a fresh node
        RecordingRule rule = new RecordingRule("flip", EnumSet.of(OpKind.ELEMWISE),
                (g, n) -> List.of(Tensors.exp(n.getInput(0))));
        EquilibriumPass pass = new EquilibriumPass("flip", new RuleTable().register(rule, 0), 5);
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class, () -> pass.apply(graph));
        Assert.assertTrue(error.getMessage().contains("Repeated optimization flip 5 times without convergence"));
        Assert.assertEquals(5, rule.calls);
    }

    @Test
    public void sameOutputsIgnored() {
        Variable v = Tensors.vector("v", 3);
        FunctionGraph graph = graph(Tensors.exp(v));
        RecordingRule identity = new RecordingRule("identity", EnumSet.of(OpKind.ELEMWISE), (g, n) -> n.getOutputs());
        RecordingRule after = RecordingRule.never("after", OpKind.ELEMWISE);
        EquilibriumPass pass = new EquilibriumPass("test", new RuleTable()
                .register(identity, 0)
                .register(after, 1));
        pass.apply(graph);
        Assert.assertEquals(0, pass.getFirings());
        // The next rule is still tried
        Assert.assertEquals(1, after.calls);
    }

    static boolean isExp(Apply node) {
        return node.op.to(ElemwiseOp.class).opcode == ScalarOpcode.EXP;
    }

    @Test
    public void firstMatchWins() {
        Variable v = Tensors.vector("v", 3);
        FunctionGraph graph = graph(Tensors.exp(v));
        RecordingRule toLog = new RecordingRule("toLog", EnumSet.of(OpKind.ELEMWISE),
                (g, n) -> isExp(n) ? List.of(Tensors.log(n.getInput(0))) : null);
        RecordingRule toNeg = new RecordingRule("toNeg", EnumSet.of(OpKind.ELEMWISE),
                (g, n) -> isExp(n) ? List.of(Tensors.neg(n.getInput(0))) : null);
        EquilibriumPass pass = new EquilibriumPass("test", new RuleTable()
                .register(toLog, 1)
                .register(toNeg, 0));
        pass.apply(graph);
        Assert.assertEquals(Map.of("toNeg", 1), pass.getFiringsPerRule());
        Assert.assertEquals(ScalarOpcode.NEG, graph.getOutput(0).owner.op.to(ElemwiseOp.class).opcode);
    }

    @Test
    public void wrongNumberOfReplacements() {
        Variable v = Tensors.vector("v", 3);
        FunctionGraph graph = graph(Tensors.exp(v));
        RecordingRule rule = new RecordingRule("empty", EnumSet.of(OpKind.ELEMWISE), (g, n) -> List.of());
        EquilibriumPass pass = new EquilibriumPass("test", new RuleTable().register(rule, 0));
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class, () -> pass.apply(graph));
        Assert.assertTrue(error.getMessage().contains("empty produced 0 replacements"));
    }

    @Test
    public void ruleExceptionsPropagate() {
        Variable v = Tensors.vector("v", 3);
        FunctionGraph graph = graph(Tensors.exp(v));
        RecordingRule rule = new RecordingRule("failing", EnumSet.of(OpKind.ELEMWISE), (g, n) -> {
            throw new IllegalStateException("failing rule");
        });
        EquilibriumPass pass = new EquilibriumPass("test", new RuleTable().register(rule, 0));
        IllegalStateException error = Assert.assertThrows(IllegalStateException.class, () -> pass.apply(graph));
        Assert.assertEquals("failing rule", error.getMessage());
    }

    @Test
    public void collapseToInput() {
        Variable v = Tensors.vector("v", 3);
        Variable inner = Tensors.neg(v);
        FunctionGraph graph = graph(Tensors.exp(inner));
        RecordingRule collapse = new RecordingRule("collapse", EnumSet.of(OpKind.ELEMWISE), (g, n) -> {
            Variable input = n.getInput(0);
            if (input.owner == null)
                return null;
            return List.of(input.owner.getInput(0));
        });
        EquilibriumPass pass = new EquilibriumPass("test", new RuleTable().register(collapse, 0));
        pass.apply(graph);
        Assert.assertSame(v, graph.getOutput(0));
        Assert.assertEquals(0, graph.size());
    }
}
