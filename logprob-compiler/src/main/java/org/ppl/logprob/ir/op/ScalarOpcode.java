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
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/** Scalar functions which can be applied elementwise. */
public enum ScalarOpcode {
    NEG("neg", x -> -x),
    EXP("exp", Math::exp),
    LOG("log", Math::log),
    ABS("abs", Math::abs),
    SQRT("sqrt", Math::sqrt),
    ADD("add", Double::sum),
    SUB("sub", (x, y) -> x - y),
    MUL("mul", (x, y) -> x * y),
    DIV("div", (x, y) -> x / y),
    POW("pow", Math::pow),
    MAXIMUM("maximum", Math::max),
    MINIMUM("minimum", Math::min);

    public final String name;
    @Nullable
    final DoubleUnaryOperator unary;
    @Nullable
    final DoubleBinaryOperator binary;

    ScalarOpcode(String name, DoubleUnaryOperator unary) {
        this.name = name;
        this.unary = unary;
        this.binary = null;
    }

    ScalarOpcode(String name, DoubleBinaryOperator binary) {
        this.name = name;
        this.unary = null;
        this.binary = binary;
    }

    public int arity() {
        return this.unary != null ? 1 : 2;
    }

    /** True if the result is always a floating point number. */
    public boolean producesFloat() {
        return this == EXP || this == LOG || this == SQRT || this == DIV;
    }

    public DoubleUnaryOperator getUnary() {
        Utilities.enforce(this.unary != null, () -> this.name + " is not unary");
        return this.unary;
    }

    public DoubleBinaryOperator getBinary() {
        Utilities.enforce(this.binary != null, () -> this.name + " is not binary");
        return this.binary;
    }

    public static ScalarOpcode fromName(String name) {
        for (ScalarOpcode opcode: ScalarOpcode.values())
            if (opcode.name.equals(name))
                return opcode;
        throw new CompilationError("Unknown scalar operation " + Utilities.singleQuote(name));
    }

    @Override
    public String toString() {
        return this.name;
    }
}
