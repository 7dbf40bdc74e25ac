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
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.IncSubtensorOp;
import org.ppl.logprob.ir.op.OpKind;

import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.List;

/**
 * Handles partially observed random variables.
 * For z = set(Y, idx, data) with z bound to y, where Y is measurable,
 * the log-density of z at y is the log-density of Y at set(y, idx, data).
 * The binding moves from z to Y with the new value, and z is replaced by Y.
 * Increments are treated the same way as writes.
 */
public class IncSubtensorRVReplace implements LocalRewriter {
    @Override
    public String getName() {
        return "IncSubtensorRVReplace";
    }

    @Override
    public EnumSet<OpKind> tracks() {
        return EnumSet.of(OpKind.INC_SUBTENSOR);
    }

    @Override
    @Nullable
    public List<Variable> transform(FunctionGraph graph, Apply node) {
        ProvenanceTracker tracker = graph.getFeature(ProvenanceTracker.class);
        if (tracker == null)
            return null;
        Variable written = node.output();
        Variable value = tracker.getValue(written);
        if (value == null)
            return null;
        Variable base = node.getInput(0);
        if (base.owner == null || !base.owner.op.isMeasurable() || tracker.isBound(base))
            return null;

        IncSubtensorOp op = node.op.to(IncSubtensorOp.class);
        Variable newValue = Tensors.setSubtensor(value, op.indices, node.getInput(1));
        tracker.updateBinding(written, newValue, base);
        return List.of(base);
    }
}
