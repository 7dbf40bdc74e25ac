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

import org.ppl.logprob.compiler.passes.RuleTable;
import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Variable;
import org.ppl.logprob.ir.op.OpKind;

import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.List;

/** A rewrite rule which looks at a single node. */
public interface LocalRewriter {
    /** Name used in logs and for excluding the rule. */
    String getName();

    /** Kinds of nodes the rule applies to. */
    EnumSet<OpKind> tracks();

    /** Try to rewrite 'node'.
     * Rules must not modify the graph structure; the caller performs the replacement.
     * @return null if the rule does not apply, otherwise one replacement
     *         for each output of the node. */
    @Nullable
    List<Variable> transform(FunctionGraph graph, Apply node);

    /** The rule to use when registered in 'table'.
     * Rules which consult the other rules of their table return a copy bound to it. */
    default LocalRewriter registeredIn(RuleTable table) {
        return this;
    }
}
