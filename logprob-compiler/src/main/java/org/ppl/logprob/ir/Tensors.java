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

package org.ppl.logprob.ir;

import org.ppl.logprob.ir.op.BroadcastToOp;
import org.ppl.logprob.ir.op.DimShuffleOp;
import org.ppl.logprob.ir.op.DiracDeltaOp;
import org.ppl.logprob.ir.op.Distributions;
import org.ppl.logprob.ir.op.ElemwiseOp;
import org.ppl.logprob.ir.op.IncSubtensorOp;
import org.ppl.logprob.ir.op.IndexEntry;
import org.ppl.logprob.ir.op.RandomVariableOp;
import org.ppl.logprob.ir.op.ScalarOpcode;
import org.ppl.logprob.ir.op.SubtensorOp;
import org.ppl.logprob.ir.type.DType;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.logprob.ir.value.NDArray;

import javax.annotation.Nullable;
import java.util.List;

/** Helpers for building graphs.  Each method creates a new Apply node
 * and returns its single output. */
public final class Tensors {
    private Tensors() {}

    public static Variable scalar(String name) {
        return new Variable(TensorType.scalar(DType.FLOAT64), name);
    }

    public static Variable vector(String name, int size) {
        return new Variable(TensorType.vector(DType.FLOAT64, size), name);
    }

    public static Variable tensor(String name, DType dtype, Integer... shape) {
        return new Variable(new TensorType(dtype, List.of(shape)), name);
    }

    public static Constant constant(double value) {
        return new Constant(NDArray.scalar(value));
    }

    public static Constant constant(double... values) {
        return new Constant(NDArray.vector(values));
    }

    public static Constant constant(NDArray value) {
        return new Constant(value);
    }

    public static Variable randomVariable(RandomVariableOp op, Variable... parameters) {
        return op.makeNode(parameters).output();
    }

    public static Variable normal(Variable mu, Variable sigma) {
        return randomVariable(Distributions.normal(null), mu, sigma);
    }

    public static Variable normal(Variable mu, Variable sigma, @Nullable List<Integer> size) {
        return randomVariable(Distributions.normal(size), mu, sigma);
    }

    public static Variable diracDelta(Variable value) {
        return DiracDeltaOp.INSTANCE.makeNode(value).output();
    }

    public static Variable elemwise(ScalarOpcode opcode, Variable... inputs) {
        return new ElemwiseOp(opcode).makeNode(inputs).output();
    }

    public static Variable exp(Variable input) {
        return elemwise(ScalarOpcode.EXP, input);
    }

    public static Variable log(Variable input) {
        return elemwise(ScalarOpcode.LOG, input);
    }

    public static Variable neg(Variable input) {
        return elemwise(ScalarOpcode.NEG, input);
    }

    public static Variable abs(Variable input) {
        return elemwise(ScalarOpcode.ABS, input);
    }

    public static Variable add(Variable left, Variable right) {
        return elemwise(ScalarOpcode.ADD, left, right);
    }

    public static Variable mul(Variable left, Variable right) {
        return elemwise(ScalarOpcode.MUL, left, right);
    }

    /** Reorder axes; {@link DimShuffleOp#NEW_AXIS} inserts a new axis. */
    public static Variable dimShuffle(Variable input, Integer... newOrder) {
        return new DimShuffleOp(List.of(newOrder)).makeNode(input).output();
    }

    public static Variable broadcastTo(Variable input, Integer... shape) {
        return new BroadcastToOp(List.of(shape)).makeNode(input).output();
    }

    public static Variable subtensor(Variable input, IndexEntry... indices) {
        return new SubtensorOp(List.of(indices)).makeNode(input).output();
    }

    /** A copy of 'input' with the elements selected by 'indices' replaced by 'data'. */
    public static Variable setSubtensor(Variable input, List<IndexEntry> indices, Variable data) {
        return new IncSubtensorOp(indices, true).makeNode(input, data).output();
    }

    /** A copy of 'input' with 'data' added to the elements selected by 'indices'. */
    public static Variable incSubtensor(Variable input, List<IndexEntry> indices, Variable data) {
        return new IncSubtensorOp(indices, false).makeNode(input, data).output();
    }
}
