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

import org.ppl.logprob.ir.Apply;
import org.ppl.logprob.ir.ChangeInputEvent;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.GraphFeature;
import org.ppl.logprob.ir.Variable;
import org.ppl.util.IWritesLogs;
import org.ppl.util.Logger;
import org.ppl.util.Utilities;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Caches the static shape of the variables of a graph, so that rewrites can
 * query shapes without looking at the producing nodes.
 * Replacements must preserve shapes; this is checked on every change. */
public class ShapeFeature implements GraphFeature, IWritesLogs {
    private final Map<Variable, List<Integer>> shapes = new HashMap<>();

    @Override
    public void onAttach(FunctionGraph graph) {
        for (Variable input: graph.getInputs())
            this.shapes.put(input, input.type.shape);
        for (Apply node: graph.toposort()) {
            for (Variable input: node.getInputs())
                this.shapes.putIfAbsent(input, input.type.shape);
            for (Variable output: node.getOutputs())
                this.shapes.put(output, output.type.shape);
        }
        Logger.INSTANCE.belowLevel(this, 3)
                .append("Shapes of ")
                .append(this.shapes.size())
                .append(" variables")
                .newline();
    }

    @Override
    public void onChangeInput(FunctionGraph graph, ChangeInputEvent event) {
        List<Integer> old = this.getShape(event.oldVariable());
        List<Integer> shape = this.getShape(event.newVariable());
        Utilities.enforce(old.equals(shape),
                () -> event.reason() + " changed shape " + old + " of " + event.oldVariable() + " to " + shape);
    }

    public List<Integer> getShape(Variable variable) {
        return this.shapes.computeIfAbsent(variable, v -> v.type.shape);
    }

    /** Shape of 'variable' using the shape feature of 'graph', if there is one. */
    public static List<Integer> shapeOf(FunctionGraph graph, Variable variable) {
        ShapeFeature feature = graph.getFeature(ShapeFeature.class);
        if (feature == null)
            return variable.type.shape;
        return feature.getShape(variable);
    }
}
