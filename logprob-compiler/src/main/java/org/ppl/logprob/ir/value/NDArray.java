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

package org.ppl.logprob.ir.value;

import org.ppl.logprob.compiler.errors.CompilationError;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.util.Linq;

import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/** A dense immutable n-dimensional array of numbers, stored in row-major order.
 * All element types are represented as doubles. */
public final class NDArray {
    private final List<Integer> shape;
    private final double[] data;

    public NDArray(List<Integer> shape, double[] data) {
        this.shape = List.copyOf(shape);
        if (Linq.product(shape) != data.length)
            throw new CompilationError("Array with shape " + shape + " cannot hold " + data.length + " elements");
        this.data = data.clone();
    }

    public static NDArray scalar(double value) {
        return new NDArray(List.of(), new double[] { value });
    }

    public static NDArray vector(double... values) {
        return new NDArray(List.of(values.length), values);
    }

    public static NDArray filled(List<Integer> shape, double value) {
        double[] data = new double[Linq.product(shape)];
        Arrays.fill(data, value);
        return new NDArray(shape, data);
    }

    public List<Integer> getShape() {
        return this.shape;
    }

    public int size() {
        return this.data.length;
    }

    public int ndim() {
        return this.shape.size();
    }

    public double get(int flatIndex) {
        return this.data[flatIndex];
    }

    public double[] toArray() {
        return this.data.clone();
    }

    public boolean fits(TensorType type) {
        return this.shape.equals(type.shape);
    }

    /** Row-major strides for a shape. */
    public static int[] strides(List<Integer> shape) {
        int[] result = new int[shape.size()];
        int stride = 1;
        for (int i = shape.size() - 1; i >= 0; i--) {
            result[i] = stride;
            stride *= shape.get(i);
        }
        return result;
    }

    /** Convert a flat row-major index into per-axis coordinates. */
    public static int[] unravel(int flatIndex, List<Integer> shape) {
        int[] result = new int[shape.size()];
        for (int i = shape.size() - 1; i >= 0; i--) {
            int dim = shape.get(i);
            result[i] = flatIndex % dim;
            flatIndex /= dim;
        }
        return result;
    }

    public NDArray broadcastTo(List<Integer> target) {
        if (target.equals(this.shape))
            return this;
        if (!TensorType.canBroadcastTo(this.shape, target))
            throw new CompilationError("Cannot broadcast shape " + this.shape + " to " + target);
        int[] strides = strides(this.shape);
        int offset = target.size() - this.shape.size();
        double[] result = new double[Linq.product(target)];
        for (int i = 0; i < result.length; i++) {
            int[] coordinates = unravel(i, target);
            int source = 0;
            for (int axis = 0; axis < this.shape.size(); axis++) {
                if (this.shape.get(axis) != 1)
                    source += coordinates[axis + offset] * strides[axis];
            }
            result[i] = this.data[source];
        }
        return new NDArray(target, result);
    }

    public NDArray map(DoubleUnaryOperator function) {
        double[] result = new double[this.data.length];
        for (int i = 0; i < result.length; i++)
            result[i] = function.applyAsDouble(this.data[i]);
        return new NDArray(this.shape, result);
    }

    /** Apply a binary function elementwise after broadcasting both arguments. */
    public static NDArray zip(NDArray left, NDArray right, DoubleBinaryOperator function) {
        List<Integer> shape = TensorType.broadcastShapes(left.shape, right.shape);
        NDArray l = left.broadcastTo(shape);
        NDArray r = right.broadcastTo(shape);
        double[] result = new double[l.data.length];
        for (int i = 0; i < result.length; i++)
            result[i] = function.applyAsDouble(l.data[i], r.data[i]);
        return new NDArray(shape, result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        NDArray that = (NDArray) o;
        return this.shape.equals(that.shape) && Arrays.equals(this.data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * this.shape.hashCode() + Arrays.hashCode(this.data);
    }

    private void toString(StringBuilder builder, int axis, int offset) {
        if (axis == this.shape.size()) {
            builder.append(this.data[offset]);
            return;
        }
        int[] strides = strides(this.shape);
        builder.append("[");
        for (int i = 0; i < this.shape.get(axis); i++) {
            if (i > 0)
                builder.append(", ");
            this.toString(builder, axis + 1, offset + i * strides[axis]);
        }
        builder.append("]");
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        this.toString(builder, 0, 0);
        return builder.toString();
    }
}
