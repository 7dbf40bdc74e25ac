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

package org.ppl.simulator;

import org.ppl.logprob.compiler.errors.CompilationError;
import org.ppl.logprob.compiler.errors.UnimplementedException;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.Constant;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.BroadcastToOp;
import org.ppl.logprob.ir.op.DimShuffleOp;
import org.ppl.logprob.ir.op.ElemwiseOp;
import org.ppl.logprob.ir.op.IncSubtensorOp;
import org.ppl.logprob.ir.op.Indexing;
import org.ppl.logprob.ir.op.ScalarOpcode;
import org.ppl.logprob.ir.op.SubtensorOp;
import org.ppl.logprob.ir.value.NDArray;
import org.ppl.util.Linq;
import org.ppl.util.Utilities;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Computes concrete values of graph variables.
 * Free variables and random variables must be given a value;
 * a point mass evaluates to its input. */
public class GraphEvaluator {
    final Map<Variable, NDArray> values;

    /** @param givens Values of the free variables and random variables. */
    public GraphEvaluator(Map<Variable, NDArray> givens) {
        this.values = new HashMap<>();
        for (Map.Entry<Variable, NDArray> entry: givens.entrySet()) {
            Variable variable = entry.getKey();
            NDArray value = entry.getValue();
            Utilities.enforce(value.fits(variable.type),
                    () -> "Value with shape " + value.getShape() + " given for " + variable + " of type " + variable.type);
            this.values.put(variable, value);
        }
    }

    public NDArray evaluate(Variable variable) {
        NDArray result = this.values.get(variable);
        if (result != null)
            return result;
        if (variable instanceof Constant)
            result = ((Constant) variable).value;
        else if (variable.owner == null)
            throw new CompilationError("No value given for free variable " + variable);
        else
            result = this.evaluate(variable.owner);
        this.values.put(variable, result);
        return result;
    }

    NDArray evaluate(Apply node) {
        switch (node.op.kind()) {
            case RANDOM_VARIABLE:
                throw new UnimplementedException("Cannot evaluate a random variable without a given value", node);
            case DIRAC_DELTA:
                return this.evaluate(node.getInput(0));
            case ELEMWISE: {
                ScalarOpcode opcode = node.op.to(ElemwiseOp.class).opcode;
                NDArray first = this.evaluate(node.getInput(0));
                if (opcode.arity() == 1)
                    return first.map(opcode.getUnary());
                return NDArray.zip(first, this.evaluate(node.getInput(1)), opcode.getBinary());
            }
            case BROADCAST_TO:
                return this.evaluate(node.getInput(0)).broadcastTo(node.op.to(BroadcastToOp.class).shape);
            case DIMSHUFFLE:
                return dimShuffle(node.op.to(DimShuffleOp.class), this.evaluate(node.getInput(0)));
            case SUBTENSOR: {
                NDArray input = this.evaluate(node.getInput(0));
                Indexing indexing = node.op.to(SubtensorOp.class).indexing(input.getShape());
                int[] offsets = indexing.sourceOffsets();
                double[] data = new double[offsets.length];
                for (int i = 0; i < offsets.length; i++)
                    data[i] = input.get(offsets[i]);
                return new NDArray(indexing.resultShape(), data);
            }
            case INC_SUBTENSOR: {
                IncSubtensorOp op = node.op.to(IncSubtensorOp.class);
                NDArray input = this.evaluate(node.getInput(0));
                Indexing indexing = op.indexing(input.getShape());
                NDArray written = this.evaluate(node.getInput(1)).broadcastTo(indexing.resultShape());
                int[] offsets = indexing.sourceOffsets();
                double[] data = input.toArray();
                for (int i = 0; i < offsets.length; i++) {
                    if (op.setInstead)
                        data[offsets[i]] = written.get(i);
                    else
                        data[offsets[i]] += written.get(i);
                }
                return new NDArray(input.getShape(), data);
            }
            default:
                throw new UnimplementedException("Evaluating", node);
        }
    }

    static NDArray dimShuffle(DimShuffleOp op, NDArray input) {
        List<Integer> shape = op.applyToShape(input.getShape());
        int[] strides = NDArray.strides(input.getShape());
        double[] data = new double[input.size()];
        for (int i = 0; i < data.length; i++) {
            int[] coordinates = NDArray.unravel(i, shape);
            int source = 0;
            for (int axis = 0; axis < coordinates.length; axis++) {
                int inputAxis = op.newOrder.get(axis);
                if (inputAxis != DimShuffleOp.NEW_AXIS)
                    source += coordinates[axis] * strides[inputAxis];
            }
            data[i] = input.get(source);
        }
        return new NDArray(shape, data);
    }

    /** Evaluate several variables with the same givens. */
    public static List<NDArray> evaluate(List<Variable> variables, Map<Variable, NDArray> givens) {
        GraphEvaluator evaluator = new GraphEvaluator(givens);
        return Linq.map(variables, evaluator::evaluate);
    }
}
