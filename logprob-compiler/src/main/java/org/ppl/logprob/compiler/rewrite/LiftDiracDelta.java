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

import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.OpKind;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/** Rewrites op(DiracDelta(V)) into DiracDelta(op(V)) for simple deterministic operations. */
public class LiftDiracDelta implements LocalRewriter, ILiftsPointMass {
    static final EnumSet<OpKind> KINDS = EnumSet.of(
            OpKind.ELEMWISE, OpKind.DIMSHUFFLE, OpKind.BROADCAST_TO, OpKind.SUBTENSOR);

    @Override
    public String getName() {
        return "LiftDiracDelta";
    }

    @Override
    public EnumSet<OpKind> tracks() {
        return KINDS;
    }

    @Override
    public boolean canLiftThrough(Apply node, int index) {
        if (index != 0 || !KINDS.contains(node.op.kind()))
            return false;
        if (node.getOutputs().size() != 1)
            return false;
        // Only unary elementwise operations
        return node.op.kind() != OpKind.ELEMWISE || node.inputCount() == 1;
    }

    @Override
    @Nullable
    public List<Variable> transform(FunctionGraph graph, Apply node) {
        if (!this.canLiftThrough(node, 0))
            return null;
        Variable marked = node.getInput(0);
        if (marked.owner == null || marked.owner.op.kind() != OpKind.DIRAC_DELTA)
            return null;
        List<Variable> inputs = new ArrayList<>(node.getInputs());
        inputs.set(0, marked.owner.getInput(0));
        Variable lifted = node.op.makeNode(inputs).output();
        return List.of(Tensors.diracDelta(lifted));
    }
}
