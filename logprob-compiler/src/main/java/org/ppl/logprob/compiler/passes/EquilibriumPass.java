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

import org.ppl.logprob.compiler.errors.InternalCompilerError;
import org.ppl.logprob.compiler.rewrite.LocalRewriter;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.ChangeInputEvent;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.GraphFeature;
import org.ppl.logprob.ir.Variable;
import org.ppl.util.IWritesLogs;
import org.ppl.util.Linq;
import org.ppl.util.Logger;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the rules of a {@link RuleTable} until none of them fires.
 * Each sweep visits the nodes in topological order; a node is offered to the
 * rules for its kind, and the first rule that matches replaces its outputs.
 * Nodes removed by an earlier replacement in the same sweep are skipped.
 * Exceptions thrown by rules are not caught.
 * Runs share no state, so one pass can rewrite several graphs at once;
 * the statistics are those of the last run which converged.
 */
public class EquilibriumPass implements GraphTransform, IWritesLogs {
    final String name;
    final RuleTable rules;
    /** Maximum number of sweeps; if 0 the limit depends on the graph size. */
    final int maxSweeps;

    /** Counts of a completed run. */
    record Statistics(int sweeps, int firings, Map<String, Integer> firingsPerRule) {}

    /** Statistics of the last run which converged. */
    volatile Statistics last;

    public EquilibriumPass(String name, RuleTable rules, int maxSweeps) {
        this.name = name;
        this.rules = rules;
        this.maxSweeps = maxSweeps;
        this.last = new Statistics(0, 0, Map.of());
    }

    public EquilibriumPass(String name, RuleTable rules) {
        this(name, rules, 0);
    }

    /** Try the rules on a node.  Returns the name of the rule which fired, or null. */
    @Nullable
    String rewrite(FunctionGraph graph, Apply node) {
        for (LocalRewriter rule: this.rules.rulesFor(node.op.kind())) {
            List<Variable> replacement = rule.transform(graph, node);
            if (replacement == null)
                continue;
            if (replacement.size() != node.getOutputs().size())
                throw new InternalCompilerError(rule.getName() + " produced " + replacement.size() +
                        " replacements for " + node.getOutputs().size() + " outputs", node);
            if (Linq.same(replacement, node.getOutputs()))
                continue;
            List<ChangeInputEvent> events = graph.replaceAll(node.getOutputs(), replacement, rule.getName());
            for (ChangeInputEvent event: events)
                for (GraphFeature feature: graph.getFeatures())
                    feature.onChangeInput(graph, event);
            return rule.getName();
        }
        return null;
    }

    @Override
    public FunctionGraph apply(FunctionGraph graph) {
        int limit = this.maxSweeps > 0 ? this.maxSweeps : Math.max(graph.size(), 10);
        int sweeps = 0;
        int firings = 0;
        Map<String, Integer> firingsPerRule = new LinkedHashMap<>();
        while (true) {
            int fired = 0;
            for (Apply node: graph.toposort()) {
                if (!graph.contains(node))
                    continue;
                String rule = this.rewrite(graph, node);
                if (rule != null) {
                    firingsPerRule.merge(rule, 1, Integer::sum);
                    fired++;
                }
            }
            sweeps++;
            firings += fired;
            Logger.INSTANCE.belowLevel(this, 1)
                    .append(this.name)
                    .append(" sweep ")
                    .append(sweeps)
                    .append(": ")
                    .append(fired)
                    .append(" rewrites")
                    .newline();
            if (this.getDebugLevel() >= 4)
                Logger.INSTANCE.belowLevel(this, 4)
                        .append("After sweep ")
                        .append(sweeps)
                        .increase()
                        .append(graph)
                        .decrease()
                        .newline();
            if (fired == 0)
                break;
            if (sweeps >= limit)
                throw new InternalCompilerError("Repeated optimization " + this.name + " " +
                        sweeps + " times without convergence");
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append(this.name)
                .append(" converged after ")
                .append(sweeps)
                .append(" sweeps, rewrites: ")
                .appendSupplier(firingsPerRule::toString)
                .newline();
        this.last = new Statistics(sweeps, firings, Collections.unmodifiableMap(firingsPerRule));
        return graph;
    }

    public int getSweeps() {
        return this.last.sweeps();
    }

    public int getFirings() {
        return this.last.firings();
    }

    public Map<String, Integer> getFiringsPerRule() {
        return this.last.firingsPerRule();
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public String toString() {
        return "EquilibriumPass " + this.name + "(" + this.rules.size() + " rules)";
    }
}
