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
import org.ppl.logprob.compiler.errors.UnimplementedException;
import org.ppl.logprob.ir.value.NDArray;
import org.ppl.util.Linq;

import java.util.ArrayList;
import java.util.List;

/** The elements selected by an index list from a tensor with a static shape. */
public final class Indexing {
    /** For each input axis the selected positions. */
    final List<List<Integer>> positions;
    final List<Boolean> keepsAxis;
    final List<Integer> inputShape;

    Indexing(List<Integer> inputShape, List<List<Integer>> positions, List<Boolean> keepsAxis) {
        this.inputShape = inputShape;
        this.positions = positions;
        this.keepsAxis = keepsAxis;
    }

    public static Indexing compute(List<Integer> shape, List<IndexEntry> indices) {
        if (indices.size() > shape.size())
            throw new CompilationError("Too many indices " + indices + " for shape " + shape);
        if (Linq.where(indices, i -> i instanceof IndexEntry.Array).size() > 1)
            throw new UnimplementedException("Indexing with more than one array " + indices);
        List<List<Integer>> positions = new ArrayList<>();
        List<Boolean> keeps = new ArrayList<>();
        for (int axis = 0; axis < shape.size(); axis++) {
            IndexEntry entry = axis < indices.size() ? indices.get(axis) : IndexEntry.all();
            positions.add(entry.positions(shape.get(axis)));
            keeps.add(entry.keepsAxis());
        }
        return new Indexing(shape, positions, keeps);
    }

    public List<Integer> resultShape() {
        List<Integer> result = new ArrayList<>();
        for (int axis = 0; axis < this.positions.size(); axis++)
            if (this.keepsAxis.get(axis))
                result.add(this.positions.get(axis).size());
        return result;
    }

    /** For each element of the result, in row-major order, the flat
     * offset of the corresponding element in the input. */
    public int[] sourceOffsets() {
        int[] strides = NDArray.strides(this.inputShape);
        List<Integer> counts = Linq.map(this.positions, List::size);
        int total = Linq.product(counts);
        int[] result = new int[total];
        for (int i = 0; i < total; i++) {
            int[] coordinates = NDArray.unravel(i, counts);
            int offset = 0;
            for (int axis = 0; axis < coordinates.length; axis++)
                offset += this.positions.get(axis).get(coordinates[axis]) * strides[axis];
            result[i] = offset;
        }
        return result;
    }
}
