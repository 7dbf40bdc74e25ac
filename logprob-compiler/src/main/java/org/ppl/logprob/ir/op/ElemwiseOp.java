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

import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.type.DType;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.util.Linq;

import java.util.List;
import java.util.Objects;

/** A scalar operation applied elementwise; inputs are broadcast together. */
public final class ElemwiseOp extends Op {
    public final ScalarOpcode opcode;

    public ElemwiseOp(ScalarOpcode opcode) {
        this.opcode = opcode;
    }

    @Override
    public OpKind kind() {
        return OpKind.ELEMWISE;
    }

    @Override
    public String getName() {
        return "Elemwise{" + this.opcode + "}";
    }

    @Override
    protected List<TensorType> outputTypes(List<Variable> inputs) {
        this.checkArity(inputs, this.opcode.arity());
        List<Integer> shape = TensorType.broadcastShapes(Linq.map(inputs, i -> i.type.shape));
        DType dtype = this.opcode.producesFloat() ? DType.FLOAT64 : DType.BOOL;
        for (Variable input: inputs)
            dtype = dtype.upcast(input.type.dtype);
        return List.of(new TensorType(dtype, shape));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        return this.opcode == ((ElemwiseOp) o).opcode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.opcode);
    }
}
