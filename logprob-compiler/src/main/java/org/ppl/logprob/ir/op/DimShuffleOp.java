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

package org.ppl.logprob.ir.op;

import org.ppl.logprob.compiler.errors.CompilationError;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.util.Linq;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Reorders the axes of its input.
 * Each entry of the new order is either the index of an input axis,
 * or {@link #NEW_AXIS}, which inserts an axis of size 1.
 * Input axes that do not appear must have size 1; they are dropped. */
public final class DimShuffleOp extends Op {
    public static final int NEW_AXIS = -1;

    public final List<Integer> newOrder;

    public DimShuffleOp(List<Integer> newOrder) {
        this.newOrder = List.copyOf(newOrder);
        Set<Integer> seen = new HashSet<>();
        for (int axis: this.newOrder) {
            if (axis < NEW_AXIS)
                throw new CompilationError("Illegal axis " + axis + " in DimShuffle order " + newOrder);
            if (axis != NEW_AXIS && !seen.add(axis))
                throw new CompilationError("Axis " + axis + " repeated in DimShuffle order " + newOrder);
        }
    }

    @Override
    public OpKind kind() {
        return OpKind.DIMSHUFFLE;
    }

    @Override
    public String getName() {
        StringBuilder builder = new StringBuilder("DimShuffle{");
        boolean first = true;
        for (int axis: this.newOrder) {
            if (!first)
                builder.append(",");
            first = false;
            builder.append(axis == NEW_AXIS ? "x" : Integer.toString(axis));
        }
        return builder.append("}").toString();
    }

    /** Shape of the result when applied to an input with the specified shape. */
    public List<Integer> applyToShape(List<Integer> shape) {
        for (int axis: this.newOrder)
            if (axis >= shape.size())
                throw new CompilationError(this.getName() + " cannot be applied to a tensor with shape " + shape);
        for (int i = 0; i < shape.size(); i++)
            if (!this.newOrder.contains(i) && shape.get(i) != 1)
                throw new CompilationError(this.getName() + " drops axis " + i +
                        " of shape " + shape + ", which does not have size 1");
        List<Integer> result = new ArrayList<>(this.newOrder.size());
        for (int axis: this.newOrder)
            result.add(axis == NEW_AXIS ? 1 : shape.get(axis));
        return result;
    }

    @Override
    protected List<TensorType> outputTypes(List<Variable> inputs) {
        this.checkArity(inputs, 1);
        TensorType type = inputs.get(0).type;
        return List.of(type.withShape(this.applyToShape(type.shape)));
    }

    /** True if applying this to an input with 'ndim' dimensions does nothing. */
    public boolean isIdentity(int ndim) {
        return this.newOrder.equals(Linq.range(0, ndim));
    }

    /** The single shuffle equivalent to applying 'inner' and then this. */
    public DimShuffleOp after(DimShuffleOp inner) {
        List<Integer> result = new ArrayList<>(this.newOrder.size());
        for (int axis: this.newOrder)
            result.add(axis == NEW_AXIS ? NEW_AXIS : inner.newOrder.get(axis));
        return new DimShuffleOp(result);
    }

    /** A shuffle which prepends new axes to reach 'ndim' dimensions. */
    public static DimShuffleOp expandLeft(int inputDims, int ndim) {
        List<Integer> order = new ArrayList<>(Linq.fill(ndim - inputDims, NEW_AXIS));
        order.addAll(Linq.range(0, inputDims));
        return new DimShuffleOp(order);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        return this.newOrder.equals(((DimShuffleOp) o).newOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.newOrder);
    }
}
