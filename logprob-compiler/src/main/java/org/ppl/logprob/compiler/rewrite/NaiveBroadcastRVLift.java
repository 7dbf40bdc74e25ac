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

import org.ppl.logprob.compiler.ShapeFeature;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.BroadcastToOp;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.logprob.ir.op.RandomVariableOp;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Lifts BroadcastTo(rv) into the parameters of the random variable:
 * the parameters are broadcast and a new random variable is built.
 * The result does not produce independent samples the way the original
 * graph would, but it has the same log-density.
 *
 * <p>Only univariate distributions are handled; broadcasting the
 * parameters of a multivariate draw would also broadcast its support.
 */
public class NaiveBroadcastRVLift implements LocalRewriter {
    @Override
    public String getName() {
        return "NaiveBroadcastRVLift";
    }

    @Override
    public EnumSet<OpKind> tracks() {
        return EnumSet.of(OpKind.BROADCAST_TO);
    }

    /** Parameters of 'rv' with an explicit size broadcast into them. */
    static List<Variable> liftSize(RandomVariableOp op, Apply rv) {
        List<Variable> result = new ArrayList<>(rv.getInputs());
        if (op.size == null)
            return result;
        for (int i = 0; i < result.size(); i++) {
            Variable param = result.get(i);
            if (!param.type.shape.equals(op.size))
                result.set(i, Tensors.broadcastTo(param, op.size.toArray(new Integer[0])));
        }
        return result;
    }

    @Override
    @Nullable
    public List<Variable> transform(FunctionGraph graph, Apply node) {
        Variable rv = node.getInput(0);
        Apply rvNode = rv.owner;
        if (rvNode == null || rvNode.op.kind() != OpKind.RANDOM_VARIABLE)
            return null;
        if (MeasurableRewrites.isBound(graph, rv))
            return null;
        List<Integer> target = node.op.to(BroadcastToOp.class).shape;
        if (target.isEmpty()) {
            // Broadcasting a scalar to a scalar
            Utilities.enforce(rv.ndim() == 0, () -> "Broadcasting " + rv + " to a scalar");
            return List.of(rv);
        }
        if (ShapeFeature.shapeOf(graph, rv).equals(target))
            return List.of(rv);
        RandomVariableOp op = rvNode.op.to(RandomVariableOp.class);
        if (!op.isUnivariate())
            return null;

        List<Variable> params = liftSize(op, rvNode);
        List<Variable> broadcast = new ArrayList<>(params.size());
        for (Variable param: params) {
            List<Integer> shape = TensorType.broadcastShapes(ShapeFeature.shapeOf(graph, param), target);
            if (shape.equals(param.type.shape))
                broadcast.add(param);
            else
                broadcast.add(Tensors.broadcastTo(param, shape.toArray(new Integer[0])));
        }
        return List.of(op.withSize(null).makeNode(broadcast).output());
    }
}
