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

package org.ppl.logprob.compiler.passes;

import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.util.IWritesLogs;
import org.ppl.util.Linq;
import org.ppl.util.Logger;

import java.util.List;

/** Applies a sequence of transforms in order. */
public class Passes implements IWritesLogs, GraphTransform {
    public final List<GraphTransform> passes;
    final String name;

    public Passes(String name, GraphTransform... passes) {
        this(name, Linq.list(passes));
    }

    public Passes(String name, List<GraphTransform> passes) {
        this.passes = passes;
        this.name = name;
    }

    public void add(GraphTransform pass) {
        this.passes.add(pass);
    }

    @Override
    public FunctionGraph apply(FunctionGraph graph) {
        int details = this.getDebugLevel();
        if (details >= 3)
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("Before ")
                    .append(this.toString())
                    .increase()
                    .append(graph)
                    .decrease()
                    .newline();
        long begin = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 2)
                .append(this.toString())
                .append(" starting ")
                .append(this.passes.size())
                .append(" passes")
                .increase();
        for (GraphTransform pass: this.passes) {
            long start = System.currentTimeMillis();
            int before = graph.size();
            graph = pass.apply(graph);
            long end = System.currentTimeMillis();
            Logger.INSTANCE.belowLevel(this, 1)
                    .append(pass.getName())
                    .append(" took ")
                    .append(end - start)
                    .append("ms, nodes ")
                    .append(before)
                    .append(" -> ")
                    .append(graph.size())
                    .newline();
            if (details >= 3)
                Logger.INSTANCE.belowLevel(this, 3)
                        .append("After ")
                        .append(pass.getName())
                        .increase()
                        .append(graph)
                        .decrease()
                        .newline();
        }
        long finish = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 2)
                .decrease()
                .append(this.toString())
                .append(" took ")
                .append(finish - begin)
                .append("ms.")
                .newline();
        return graph;
    }

    @Override
    public String toString() {
        return this.name + "(" + this.passes.size() + ")";
    }

    @Override
    public String getName() {
        return this.name;
    }
}
