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

import java.util.List;
import java.util.Objects;

/** Returns a copy of its first input where the elements selected by
 * a static index list are overwritten with (or incremented by)
 * the second input, broadcast to the selected shape. */
public final class IncSubtensorOp extends Op {
    public final List<IndexEntry> indices;
    /** If true the selected elements are set, otherwise they are incremented. */
    public final boolean setInstead;

    public IncSubtensorOp(List<IndexEntry> indices, boolean setInstead) {
        this.indices = List.copyOf(indices);
        this.setInstead = setInstead;
    }

    @Override
    public OpKind kind() {
        return OpKind.INC_SUBTENSOR;
    }

    @Override
    public String getName() {
        return (this.setInstead ? "SetSubtensor" : "IncSubtensor") + this.indices;
    }

    public Indexing indexing(List<Integer> shape) {
        return Indexing.compute(shape, this.indices);
    }

    @Override
    protected List<TensorType> outputTypes(List<Variable> inputs) {
        this.checkArity(inputs, 2);
        TensorType type = inputs.get(0).type;
        List<Integer> selected = this.indexing(type.shape).resultShape();
        List<Integer> data = inputs.get(1).type.shape;
        if (!TensorType.canBroadcastTo(data, selected))
            throw new CompilationError("Cannot write " + inputs.get(1) + " with shape " + data +
                    " into " + selected + " elements of " + inputs.get(0));
        return List.of(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        IncSubtensorOp that = (IncSubtensorOp) o;
        return this.setInstead == that.setInstead && this.indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.indices, this.setInstead);
    }
}
