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
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.util.ICastable;

import java.util.List;

/** A pure function from input variables to output variables.
 * Operations are immutable; an operation can be applied many times. */
public abstract class Op implements ICastable {
    public abstract OpKind kind();

    public abstract String getName();

    /** Check that the inputs are legal and compute the output types. */
    protected abstract List<TensorType> outputTypes(List<Variable> inputs);

    /** True if the output of this operation has a log-density given a bound value. */
    public boolean isMeasurable() {
        return false;
    }

    public Apply makeNode(List<Variable> inputs) {
        return new Apply(this, inputs, this.outputTypes(inputs));
    }

    public Apply makeNode(Variable... inputs) {
        return this.makeNode(List.of(inputs));
    }

    protected void checkArity(List<Variable> inputs, int expected) {
        if (inputs.size() != expected)
            throw new CompilationError(this.getName() + " expects " + expected +
                    " inputs, but received " + inputs.size());
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
