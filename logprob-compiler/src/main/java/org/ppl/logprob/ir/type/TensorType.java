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

package org.ppl.logprob.ir.type;

import org.ppl.logprob.compiler.errors.CompilationError;
import org.ppl.util.Linq;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Static type of a tensor variable: element type and a fully known shape.
 * A scalar has an empty shape. */
public final class TensorType {
    public final DType dtype;
    public final List<Integer> shape;

    public TensorType(DType dtype, List<Integer> shape) {
        this.dtype = dtype;
        for (int dim: shape)
            if (dim < 0)
                throw new CompilationError("Negative dimension in shape " + shape);
        this.shape = List.copyOf(shape);
    }

    public static TensorType scalar(DType dtype) {
        return new TensorType(dtype, List.of());
    }

    public static TensorType vector(DType dtype, int size) {
        return new TensorType(dtype, List.of(size));
    }

    public int ndim() {
        return this.shape.size();
    }

    public boolean isScalar() {
        return this.shape.isEmpty();
    }

    /** Number of elements. */
    public int size() {
        return Linq.product(this.shape);
    }

    public TensorType withShape(List<Integer> shape) {
        return new TensorType(this.dtype, shape);
    }

    public TensorType withDType(DType dtype) {
        return new TensorType(dtype, this.shape);
    }

    public boolean sameType(TensorType other) {
        return this.equals(other);
    }

    /** Compute the shape obtained by broadcasting the given shapes together,
     * following numpy rules: shapes are right-aligned and each dimension
     * must be equal or 1. */
    public static List<Integer> broadcastShapes(List<List<Integer>> shapes) {
        int ndim = 0;
        for (List<Integer> s: shapes)
            ndim = Math.max(ndim, s.size());
        List<Integer> result = new ArrayList<>(Linq.fill(ndim, 1));
        for (List<Integer> s: shapes) {
            int offset = ndim - s.size();
            for (int i = 0; i < s.size(); i++) {
                int current = result.get(offset + i);
                int dim = s.get(i);
                if (dim == current || dim == 1)
                    continue;
                if (current == 1)
                    result.set(offset + i, dim);
                else
                    throw new CompilationError("Shapes cannot be broadcast together: " + shapes);
            }
        }
        return result;
    }

    public static List<Integer> broadcastShapes(List<Integer> left, List<Integer> right) {
        return broadcastShapes(List.of(left, right));
    }

    /** True if a tensor with shape 'from' can be broadcast to shape 'to'. */
    public static boolean canBroadcastTo(List<Integer> from, List<Integer> to) {
        if (from.size() > to.size())
            return false;
        int offset = to.size() - from.size();
        for (int i = 0; i < from.size(); i++) {
            int dim = from.get(i);
            if (dim != 1 && dim != to.get(offset + i))
                return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        TensorType that = (TensorType) o;
        return this.dtype == that.dtype && this.shape.equals(that.shape);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.dtype, this.shape);
    }

    @Override
    public String toString() {
        return this.dtype + this.shape.toString();
    }
}
