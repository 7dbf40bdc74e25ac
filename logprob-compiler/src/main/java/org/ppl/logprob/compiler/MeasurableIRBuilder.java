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

import org.ppl.logprob.compiler.passes.EquilibriumPass;
import org.ppl.logprob.compiler.passes.GraphTransform;
import org.ppl.logprob.compiler.passes.Passes;
import org.ppl.logprob.compiler.passes.RuleTable;
import org.ppl.logprob.compiler.rewrite.MeasurableRewrites;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Variable;
import org.ppl.util.IWritesLogs;
import org.ppl.util.Logger;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds the measurable form of a graph.
 *
 * <p>The subgraph computing the bound random variables is cloned, so the
 * caller's graph is never modified; the values are not cloned.
 * The clone is then rewritten in three stages: canonicalization, the
 * measurable rewrites run to a fixpoint, and canonicalization again.
 *
 * <p>Each call works on its own clone with its own passes, so a builder
 * can be used by several threads at once.
 */
public class MeasurableIRBuilder implements IWritesLogs {
    final CompilerOptions options;
    final RuleTable rules;
    /** Creates the canonicalization pass for each graph.
     * If null the graph is not canonicalized. */
    @Nullable
    final Supplier<GraphTransform> canonicalizer;

    public MeasurableIRBuilder(CompilerOptions options, RuleTable rules,
                               @Nullable Supplier<GraphTransform> canonicalizer) {
        options.validate();
        this.options = options;
        this.rules = rules;
        this.canonicalizer = canonicalizer;
    }

    public MeasurableIRBuilder(CompilerOptions options) {
        this(options,
                MeasurableRewrites.measurableRules().without(options.rewriting.excludedRules),
                options.rewriting.noCanonicalize ? null :
                        () -> MeasurableRewrites.canonicalize(options.rewriting.maxSweeps));
    }

    public MeasurableIRBuilder() {
        this(CompilerOptions.getDefault());
    }

    GraphTransform getPasses() {
        Passes passes = new Passes("MeasurableIR", new ArrayList<>());
        if (this.canonicalizer != null)
            passes.add(this.canonicalizer.get());
        passes.add(new EquilibriumPass("MeasurableRewrites", this.rules, this.options.rewriting.maxSweeps));
        if (this.canonicalizer != null)
            passes.add(this.canonicalizer.get());
        return passes;
    }

    /**
     * Build the measurable form of the graph computing the random variables
     * in 'rvValues'.
     *
     * @param rvValues  Maps random variables to the values they are bound to.
     *                  Not modified.
     */
    public MeasurableIR construct(Map<Variable, Variable> rvValues) {
        // Values are pinned, so the clone uses them as they are
        Map<Variable, Variable> memo = new HashMap<>();
        for (Variable value: rvValues.values())
            memo.put(value, value);
        FunctionGraph graph = FunctionGraph.clone(new ArrayList<>(rvValues.keySet()), memo);
        graph.attachFeature(new ShapeFeature());

        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        for (Map.Entry<Variable, Variable> entry: rvValues.entrySet())
            Utilities.putNew(bindings, Utilities.getExists(memo, entry.getKey()), entry.getValue());
        ProvenanceTracker tracker = new ProvenanceTracker(bindings);
        graph.attachFeature(tracker);

        Logger.INSTANCE.belowLevel(this, 1)
                .append("Building measurable form of ")
                .append(graph.size())
                .append(" nodes with ")
                .append(bindings.size())
                .append(" bound variables")
                .newline();
        graph = this.getPasses().apply(graph);
        return new MeasurableIR(graph, bindings, new LinkedHashMap<>(tracker.getOriginalValues()), memo);
    }
}
