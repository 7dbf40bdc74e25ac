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

package org.ppl.logprob.compiler.rewrite;

import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.Constant;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.logprob.ir.value.NDArray;
import org.ppl.simulator.GraphEvaluator;
import org.ppl.util.Linq;

import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/** Replaces deterministic operations whose inputs are all constants with their value. */
public class ConstantFolding implements LocalRewriter {
    @Override
    public String getName() {
        return "ConstantFolding";
    }

    @Override
    public EnumSet<OpKind> tracks() {
        return EnumSet.of(OpKind.ELEMWISE, OpKind.DIMSHUFFLE, OpKind.BROADCAST_TO,
                OpKind.SUBTENSOR, OpKind.INC_SUBTENSOR);
    }

    @Override
    @Nullable
    public List<Variable> transform(FunctionGraph graph, Apply node) {
        if (!Linq.all(node.getInputs(), i -> i instanceof Constant))
            return null;
        Variable output = node.output();
        if (MeasurableRewrites.isBound(graph, output))
            return null;
        NDArray value = new GraphEvaluator(Map.of()).evaluate(output);
        return List.of(new Constant(output.type.dtype, value, null));
    }
}
