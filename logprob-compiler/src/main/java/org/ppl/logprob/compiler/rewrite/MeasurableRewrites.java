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

import org.ppl.logprob.compiler.ProvenanceTracker;
import org.ppl.logprob.compiler.passes.EquilibriumPass;
import org.ppl.logprob.compiler.passes.GraphTransform;
import org.ppl.logprob.compiler.passes.RuleTable;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.logprob.ir.op.RandomVariableOp;

import javax.annotation.Nullable;

/** The standard rule tables, and helpers shared by the rules. */
public final class MeasurableRewrites {
    private MeasurableRewrites() {}

    public static final int DEFAULT_PRIORITY = -5;

    /** Rules which convert a graph into its measurable form. */
    public static RuleTable measurableRules() {
        return new RuleTable()
                .register(new DimShuffleRVLift(), DEFAULT_PRIORITY)
                .register(new SubtensorRVLift(), DEFAULT_PRIORITY)
                .register(new NaiveBroadcastRVLift(), DEFAULT_PRIORITY)
                .register(new IncSubtensorRVReplace(), DEFAULT_PRIORITY)
                .register(new LiftDiracDelta(), DEFAULT_PRIORITY)
                .register(new RemoveDiracDelta(), DEFAULT_PRIORITY);
    }

    /** Algebraic simplifications. */
    public static RuleTable canonicalRules() {
        return new RuleTable()
                .register(new RemoveUselessDimShuffle(), 0)
                .register(new MergeDimShuffles(), 0)
                .register(new RemoveUselessBroadcast(), 0)
                .register(new ConstantFolding(), 10);
    }

    public static GraphTransform canonicalize(int maxSweeps) {
        return new EquilibriumPass("Canonicalize", canonicalRules(), maxSweeps);
    }

    /** True if 'variable' is bound to a value by the tracker of 'graph'. */
    public static boolean isBound(FunctionGraph graph, Variable variable) {
        ProvenanceTracker tracker = graph.getFeature(ProvenanceTracker.class);
        return tracker != null && tracker.isBound(variable);
    }

    /** The node producing 'rv' if an operation consuming it can be moved into
     * its parameters: it must be a univariate random variable which is not bound,
     * and 'consumer' must be its only client. */
    @Nullable
    static Apply liftableRandomVariable(FunctionGraph graph, Variable rv, Apply consumer) {
        Apply node = rv.owner;
        if (node == null || node.op.kind() != OpKind.RANDOM_VARIABLE)
            return null;
        if (!node.op.to(RandomVariableOp.class).isUnivariate())
            return null;
        if (isBound(graph, rv))
            return null;
        var clients = graph.getClients(rv);
        if (clients.size() != 1 || clients.get(0).node() != consumer)
            return null;
        return node;
    }
}
