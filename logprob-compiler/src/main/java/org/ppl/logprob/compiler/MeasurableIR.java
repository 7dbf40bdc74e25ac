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

package org.ppl.logprob.compiler;

import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Variable;
import org.ppl.util.Utilities;

import java.util.Map;

/**
 * Result of {@link MeasurableIRBuilder#construct}.
 *
 * @param graph           The rewritten graph; it has one output for each
 *                        random variable of the input bindings, in the same order.
 * @param rvValues        Bindings between the random variables of 'graph' and their values.
 * @param originalValues  Maps each value in 'rvValues' to the value it was derived from.
 * @param memo            Maps each variable of the original graph to its clone.
 */
public record MeasurableIR(
        FunctionGraph graph,
        Map<Variable, Variable> rvValues,
        Map<Variable, Variable> originalValues,
        Map<Variable, Variable> memo) {
    /** The clone of a variable of the original graph. */
    public Variable getClone(Variable original) {
        return Utilities.getExists(this.memo, original);
    }
}
