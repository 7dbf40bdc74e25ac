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

import org.ppl.logprob.compiler.passes.RuleTable;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.Client;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.OpKind;

import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.List;

/** Replaces DiracDelta(V) by V.
 * The point mass is kept when it is bound to a value, and while a rule of the
 * table holding this rule can still lift a consumer through it.
 * Outside a table no consumer is considered liftable. */
public class RemoveDiracDelta implements LocalRewriter {
    @Nullable
    final RuleTable table;

    public RemoveDiracDelta() {
        this(null);
    }

    RemoveDiracDelta(@Nullable RuleTable table) {
        this.table = table;
    }

    @Override
    public LocalRewriter registeredIn(RuleTable table) {
        return new RemoveDiracDelta(table);
    }

    /** True if a rule of the table can lift 'consumer' through its input 'index'. */
    boolean canBeLifted(Apply consumer, int index) {
        if (this.table == null)
            return false;
        for (LocalRewriter rule: this.table.rulesFor(consumer.op.kind()))
            if (rule instanceof ILiftsPointMass && ((ILiftsPointMass) rule).canLiftThrough(consumer, index))
                return true;
        return false;
    }

    @Override
    public String getName() {
        return "RemoveDiracDelta";
    }

    @Override
    public EnumSet<OpKind> tracks() {
        return EnumSet.of(OpKind.DIRAC_DELTA);
    }

    @Override
    @Nullable
    public List<Variable> transform(FunctionGraph graph, Apply node) {
        Variable output = node.output();
        if (MeasurableRewrites.isBound(graph, output))
            return null;
        for (Client client: graph.getClients(output)) {
            Apply consumer = client.node();
            if (consumer != null && this.canBeLifted(consumer, client.index()))
                return null;
        }
        return List.of(node.getInput(0));
    }
}
