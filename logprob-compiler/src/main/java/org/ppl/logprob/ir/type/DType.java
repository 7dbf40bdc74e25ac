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
import org.ppl.util.Utilities;

/** Element type of a tensor. */
public enum DType {
    BOOL("bool"),
    INT64("int64"),
    FLOAT64("float64");

    public final String name;

    DType(String name) {
        this.name = name;
    }

    public boolean isFloat() {
        return this == FLOAT64;
    }

    /** The type of the result of arithmetic between this and other. */
    public DType upcast(DType other) {
        return this.ordinal() >= other.ordinal() ? this : other;
    }

    public static DType fromName(String name) {
        for (DType type: DType.values())
            if (type.name.equals(name))
                return type;
        throw new CompilationError("Unknown element type " + Utilities.singleQuote(name));
    }

    @Override
    public String toString() {
        return this.name;
    }
}
