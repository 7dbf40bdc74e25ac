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
import org.ppl.logprob.ir.type.DType;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.util.List;

/** The distributions known to the graph builder.
 * Only the shape signature of a distribution matters here;
 * log-density formulas live elsewhere. */
public final class Distributions {
    private Distributions() {}

    public static RandomVariableOp normal(@Nullable List<Integer> size) {
        return new RandomVariableOp("normal", 0, List.of(0, 0), DType.FLOAT64, size);
    }

    public static RandomVariableOp uniform(@Nullable List<Integer> size) {
        return new RandomVariableOp("uniform", 0, List.of(0, 0), DType.FLOAT64, size);
    }

    public static RandomVariableOp halfNormal(@Nullable List<Integer> size) {
        return new RandomVariableOp("halfnormal", 0, List.of(0, 0), DType.FLOAT64, size);
    }

    public static RandomVariableOp exponential(@Nullable List<Integer> size) {
        return new RandomVariableOp("exponential", 0, List.of(0), DType.FLOAT64, size);
    }

    public static RandomVariableOp poisson(@Nullable List<Integer> size) {
        return new RandomVariableOp("poisson", 0, List.of(0), DType.INT64, size);
    }

    public static RandomVariableOp bernoulli(@Nullable List<Integer> size) {
        return new RandomVariableOp("bernoulli", 0, List.of(0), DType.INT64, size);
    }

    /** Parameters: mean vector and covariance matrix. */
    public static RandomVariableOp multivariateNormal(@Nullable List<Integer> size) {
        return new RandomVariableOp("multivariate_normal", 1, List.of(1, 2), DType.FLOAT64, size);
    }

    public static RandomVariableOp dirichlet(@Nullable List<Integer> size) {
        return new RandomVariableOp("dirichlet", 1, List.of(1), DType.FLOAT64, size);
    }

    public static RandomVariableOp fromName(String name, @Nullable List<Integer> size) {
        switch (name) {
            case "normal": return normal(size);
            case "uniform": return uniform(size);
            case "halfnormal": return halfNormal(size);
            case "exponential": return exponential(size);
            case "poisson": return poisson(size);
            case "bernoulli": return bernoulli(size);
            case "multivariate_normal": return multivariateNormal(size);
            case "dirichlet": return dirichlet(size);
            default:
                throw new CompilationError("Unknown distribution " + Utilities.singleQuote(name));
        }
    }
}
