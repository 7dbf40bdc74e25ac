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
import org.ppl.logprob.ir.type.DType;
import org.ppl.logprob.ir.type.TensorType;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A draw from a parametrized distribution.  The inputs are the distribution parameters.
 * Each parameter has a number of "core" trailing dimensions; the remaining leading
 * dimensions are batch dimensions, which are broadcast together.
 * The output has the batch shape (or the explicit size, when present)
 * followed by the support shape. */
public final class RandomVariableOp extends Op {
    public final String distribution;
    /** Number of dimensions of a single draw; 0 for univariate distributions. */
    public final int ndimSupp;
    /** Number of core dimensions of each parameter. */
    public final List<Integer> paramNdims;
    public final DType dtype;
    /** Explicit batch shape of the draw. */
    @Nullable
    public final List<Integer> size;

    public RandomVariableOp(String distribution, int ndimSupp, List<Integer> paramNdims,
                            DType dtype, @Nullable List<Integer> size) {
        this.distribution = distribution;
        this.ndimSupp = ndimSupp;
        this.paramNdims = List.copyOf(paramNdims);
        this.dtype = dtype;
        this.size = size == null ? null : List.copyOf(size);
    }

    public RandomVariableOp withSize(@Nullable List<Integer> size) {
        return new RandomVariableOp(this.distribution, this.ndimSupp, this.paramNdims, this.dtype, size);
    }

    public boolean isUnivariate() {
        return this.ndimSupp == 0;
    }

    @Override
    public OpKind kind() {
        return OpKind.RANDOM_VARIABLE;
    }

    @Override
    public String getName() {
        String result = this.distribution + "_rv";
        if (this.size != null)
            result += "{size=" + this.size + "}";
        return result;
    }

    @Override
    public boolean isMeasurable() {
        return true;
    }

    /** The batch dimensions of a parameter. */
    public List<Integer> batchShape(Variable parameter, int index) {
        List<Integer> shape = parameter.type.shape;
        int core = this.paramNdims.get(index);
        if (shape.size() < core)
            throw new CompilationError("Parameter " + index + " of " + this.getName() +
                    " must have at least " + core + " dimensions, but has shape " + shape);
        return shape.subList(0, shape.size() - core);
    }

    @Override
    protected List<TensorType> outputTypes(List<Variable> inputs) {
        this.checkArity(inputs, this.paramNdims.size());
        List<List<Integer>> batches = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++)
            batches.add(this.batchShape(inputs.get(i), i));
        List<Integer> batch;
        if (this.size != null) {
            for (List<Integer> b: batches)
                if (!TensorType.canBroadcastTo(b, this.size))
                    throw new CompilationError("Parameters of " + this.getName() +
                            " with batch shape " + b + " do not match size " + this.size);
            batch = this.size;
        } else {
            batch = TensorType.broadcastShapes(batches);
        }
        List<Integer> shape = new ArrayList<>(batch);
        if (this.ndimSupp > 0) {
            List<Integer> first = inputs.get(0).type.shape;
            if (first.size() < this.ndimSupp)
                throw new CompilationError("First parameter of " + this.getName() +
                        " does not determine the support shape");
            shape.addAll(first.subList(first.size() - this.ndimSupp, first.size()));
        }
        return List.of(new TensorType(this.dtype, shape));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        RandomVariableOp that = (RandomVariableOp) o;
        return this.ndimSupp == that.ndimSupp &&
                this.distribution.equals(that.distribution) &&
                this.paramNdims.equals(that.paramNdims) &&
                this.dtype == that.dtype &&
                Objects.equals(this.size, that.size);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.distribution, this.ndimSupp, this.paramNdims, this.dtype, this.size);
    }
}
