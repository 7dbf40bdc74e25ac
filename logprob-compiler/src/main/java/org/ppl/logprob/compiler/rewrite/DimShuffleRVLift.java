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
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.DimShuffleOp;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.logprob.ir.op.RandomVariableOp;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/** Lifts DimShuffle(rv) into the parameters and the size of a univariate random variable. */
public class DimShuffleRVLift implements LocalRewriter {
    @Override
    public String getName() {
        return "DimShuffleRVLift";
    }

    @Override
    public EnumSet<OpKind> tracks() {
        return EnumSet.of(OpKind.DIMSHUFFLE);
    }

    @Override
    @Nullable
    public List<Variable> transform(FunctionGraph graph, Apply node) {
        Variable rv = node.getInput(0);
        Apply rvNode = MeasurableRewrites.liftableRandomVariable(graph, rv, node);
        if (rvNode == null)
            return null;
        RandomVariableOp op = rvNode.op.to(RandomVariableOp.class);
        DimShuffleOp shuffle = node.op.to(DimShuffleOp.class);
        for (int axis = 0; axis < rv.ndim(); axis++)
            // Dropping axes is not supported
            if (!shuffle.newOrder.contains(axis))
                return null;

        List<Integer> size = op.size == null ? null : shuffle.applyToShape(op.size);
        List<Variable> params = new ArrayList<>();
        for (Variable param: rvNode.getInputs()) {
            Variable padded = param;
            if (param.ndim() < rv.ndim())
                padded = DimShuffleOp.expandLeft(param.ndim(), rv.ndim()).makeNode(param).output();
            params.add(shuffle.makeNode(padded).output());
        }
        return List.of(op.withSize(size).makeNode(params).output());
    }
}
