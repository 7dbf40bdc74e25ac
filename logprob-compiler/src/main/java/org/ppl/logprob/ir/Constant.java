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

package org.ppl.logprob.ir;

import org.ppl.logprob.ir.type.DType;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.logprob.ir.value.NDArray;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;

/** A variable with a known value.  Constants are never cloned. */
public final class Constant extends Variable {
    public final NDArray value;

    public Constant(DType dtype, NDArray value, @Nullable String name) {
        super(new TensorType(dtype, value.getShape()), name);
        this.value = value;
    }

    public Constant(NDArray value) {
        this(DType.FLOAT64, value, null);
    }

    /** The scalar value; fails if this is not a scalar. */
    public double scalarValue() {
        Utilities.enforce(this.type.isScalar(), () -> "Constant " + this + " is not a scalar");
        return this.value.get(0);
    }

    @Override
    public String toString() {
        if (this.getName() != null)
            return this.getName();
        return this.value.toString();
    }
}
