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

package org.ppl.simulator;

import org.junit.Assert;
import org.junit.Test;
import org.ppl.logprob.compiler.errors.CompilationError;
import org.ppl.logprob.compiler.errors.InternalCompilerError;
import org.ppl.logprob.compiler.errors.UnimplementedException;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.IndexEntry;
import org.ppl.logprob.ir.type.DType;
import org.ppl.logprob.ir.value.NDArray;

import java.util.List;
import java.util.Map;

public class GraphEvaluatorTests {
    static final NDArray MATRIX = new NDArray(List.of(2, 3), new double[] { 0, 1, 2, 3, 4, 5 });

    static NDArray evaluate(Variable output, Variable input, NDArray value) {
        return new GraphEvaluator(Map.of(input, value)).evaluate(output);
    }

    @Test
    public void elemwise() {
        Variable v = Tensors.vector("v", 3);
        Variable sum = Tensors.add(Tensors.neg(v), Tensors.constant(1.0));
        Assert.assertEquals(NDArray.vector(0, -1, -2), evaluate(sum, v, NDArray.vector(1, 2, 3)));
        Variable abs = Tensors.abs(Tensors.diracDelta(v));
        Assert.assertEquals(NDArray.vector(1, 2, 3), evaluate(abs, v, NDArray.vector(-1, 2, -3)));
    }

    @Test
    public void transpose() {
        Variable m = Tensors.tensor("m", DType.FLOAT64, 2, 3);
        Variable t = Tensors.dimShuffle(m, 1, 0);
        NDArray expected = new NDArray(List.of(3, 2), new double[] { 0, 3, 1, 4, 2, 5 });
        Assert.assertEquals(expected, evaluate(t, m, MATRIX));
    }

    @Test
    public void broadcast() {
        Variable v = Tensors.vector("v", 3);
        Variable b = Tensors.broadcastTo(v, 2, 3);
        NDArray expected = new NDArray(List.of(2, 3), new double[] { 1, 2, 3, 1, 2, 3 });
        Assert.assertEquals(expected, evaluate(b, v, NDArray.vector(1, 2, 3)));
    }

    @Test
    public void indexing() {
        Variable m = Tensors.tensor("m", DType.FLOAT64, 2, 3);
        Assert.assertEquals(NDArray.vector(3, 4, 5), evaluate(Tensors.subtensor(m, IndexEntry.at(-1)), m, MATRIX));
        Assert.assertEquals(NDArray.vector(2, 5),
                evaluate(Tensors.subtensor(m, IndexEntry.all(), IndexEntry.at(2)), m, MATRIX));
        Variable reversed = Tensors.subtensor(m, IndexEntry.at(0), IndexEntry.slice(null, null, -1));
        Assert.assertEquals(NDArray.vector(2, 1, 0), evaluate(reversed, m, MATRIX));
    }

    @Test
    public void writes() {
        Variable v = Tensors.vector("v", 4);
        List<IndexEntry> odd = List.of(IndexEntry.slice(1, null, 2));
        Variable set = Tensors.setSubtensor(v, odd, Tensors.constant(0.0));
        Variable inc = Tensors.incSubtensor(v, odd, Tensors.constant(10, 20));
        NDArray value = NDArray.vector(1, 2, 3, 4);
        Assert.assertEquals(NDArray.vector(1, 0, 3, 0), evaluate(set, v, value));
        Assert.assertEquals(NDArray.vector(1, 12, 3, 24), evaluate(inc, v, value));
    }

    @Test
    public void randomVariables() {
        Variable x = Tensors.normal(Tensors.scalar("mu"), Tensors.constant(1.0));
        Variable e = Tensors.exp(x);
        Assert.assertThrows(UnimplementedException.class, () -> new GraphEvaluator(Map.of()).evaluate(e));
        Assert.assertEquals(NDArray.scalar(1), evaluate(e, x, NDArray.scalar(0)));
    }

    @Test
    public void missingInput() {
        Variable v = Tensors.vector("v", 3);
        CompilationError error = Assert.assertThrows(CompilationError.class,
                () -> new GraphEvaluator(Map.of()).evaluate(Tensors.exp(v)));
        Assert.assertEquals("Compilation error", error.getErrorKind());
        Assert.assertTrue(error.getMessage().contains("No value given for free variable"));
    }

    @Test
    public void wrongShape() {
        Variable v = Tensors.vector("v", 3);
        Assert.assertThrows(InternalCompilerError.class,
                () -> new GraphEvaluator(Map.of(v, NDArray.vector(1, 2))));
    }
}
