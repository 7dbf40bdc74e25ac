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
import org.ppl.logprob.ir.type.TensorType;

import java.util.List;

/** A point-mass distribution around its input: a random variable
 * collapsed to a known value. */
public final class DiracDeltaOp extends Op {
    public static final DiracDeltaOp INSTANCE = new DiracDeltaOp();

    private DiracDeltaOp() {}

    @Override
    public OpKind kind() {
        return OpKind.DIRAC_DELTA;
    }

    @Override
    public String getName() {
        return "DiracDelta";
    }

    @Override
    protected List<TensorType> outputTypes(List<Variable> inputs) {
        this.checkArity(inputs, 1);
        return List.of(inputs.get(0).type);
    }

    @Override
    public boolean isMeasurable() {
        return true;
    }
}
