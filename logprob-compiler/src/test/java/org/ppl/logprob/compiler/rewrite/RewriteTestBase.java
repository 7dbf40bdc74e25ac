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
import org.ppl.logprob.compiler.ShapeFeature;
import org.ppl.logprob.compiler.passes.EquilibriumPass;
import org.ppl.logprob.compiler.passes.RuleTable;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.util.Linq;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers for testing rewrite rules. */
public class RewriteTestBase {
    /** A graph computing 'outputs' with a tracker for 'bindings'. */
    static FunctionGraph trackedGraph(Map<Variable, Variable> bindings, Variable... outputs) {
        FunctionGraph graph = new FunctionGraph(List.of(outputs));
        graph.attachFeature(new ShapeFeature());
        graph.attachFeature(new ProvenanceTracker(bindings));
        return graph;
    }

    static FunctionGraph trackedGraph(Variable... outputs) {
        return trackedGraph(new LinkedHashMap<>(), outputs);
    }

    static Map<Variable, Variable> bindings(Variable rv, Variable value) {
        Map<Variable, Variable> result = new LinkedHashMap<>();
        result.put(rv, value);
        return result;
    }

    static EquilibriumPass pass(LocalRewriter... rules) {
        RuleTable table = new RuleTable();
        for (LocalRewriter rule: rules)
            table.register(rule, 0);
        return new EquilibriumPass("test", table);
    }

    static ProvenanceTracker tracker(FunctionGraph graph) {
        ProvenanceTracker result = graph.getFeature(ProvenanceTracker.class);
        assert result != null;
        return result;
    }

    /** The kinds of the nodes of the graph, in topological order. */
    static List<OpKind> kinds(FunctionGraph graph) {
        return Linq.map(graph.toposort(), (Apply a) -> a.op.kind());
    }

    static OpKind kind(Variable variable) {
        assert variable.owner != null;
        return variable.owner.op.kind();
    }
}
