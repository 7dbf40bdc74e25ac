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

import org.ppl.logprob.compiler.errors.ConfigurationError;
import org.ppl.logprob.compiler.errors.InternalCompilerError;
import org.ppl.logprob.ir.ChangeInputEvent;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.GraphFeature;
import org.ppl.logprob.ir.Variable;
import org.ppl.util.IWritesLogs;
import org.ppl.util.Logger;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps track of the random variables of a graph and the values bound to them
 * while the graph is rewritten.
 *
 * <p>When a bound random variable is replaced, the binding moves to the
 * replacement.  Rewrites can also change a binding explicitly with
 * {@link #updateBinding}; the value a binding started from is kept
 * in the original-values map.
 *
 * <p>A graph can have at most one tracker, and a tracker can be attached
 * to a single graph.
 */
public class ProvenanceTracker implements GraphFeature, IWritesLogs {
    /** Maps random variables to their values.  Updated in place. */
    private final Map<Variable, Variable> rvValues;
    /** Maps each current value to the value it was derived from. */
    private final Map<Variable, Variable> originalValues;
    @Nullable
    private FunctionGraph graph;

    /** @param rvValues Bindings to maintain.  The map is updated in place. */
    public ProvenanceTracker(Map<Variable, Variable> rvValues) {
        this.rvValues = rvValues;
        this.originalValues = new LinkedHashMap<>();
        for (Variable value: rvValues.values())
            this.originalValues.put(value, value);
        this.graph = null;
    }

    @Override
    public void onAttach(FunctionGraph graph) {
        if (this.graph != null)
            throw new ConfigurationError("Provenance tracker is already attached to a graph");
        if (graph.getFeature(ProvenanceTracker.class) != null)
            throw new ConfigurationError("Graph already has a provenance tracker attached");
        this.graph = graph;
    }

    @Nullable
    public FunctionGraph getGraph() {
        return this.graph;
    }

    /** Replace the binding of 'oldRv' with 'newValue', keeping the original value.
     * @param oldRv     Random variable whose binding changes; must be bound.
     * @param newValue  The new value.
     * @param newRv     If not null the binding is moved to this random variable. */
    public void updateBinding(Variable oldRv, Variable newValue, @Nullable Variable newRv) {
        Variable oldValue = this.rvValues.remove(oldRv);
        if (oldValue == null)
            throw new InternalCompilerError("Updating the binding of unbound variable " + oldRv, oldRv.owner);
        Variable original = this.originalValues.remove(oldValue);
        Utilities.enforce(original != null, () -> "Value " + oldValue + " has no original value");
        Variable rv = newRv == null ? oldRv : newRv;
        if (this.rvValues.containsKey(rv))
            throw new InternalCompilerError("Moving the binding of " + oldRv + " to " + rv +
                    ", which is already bound", rv.owner);
        this.rvValues.put(rv, newValue);
        this.originalValues.put(newValue, original);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Binding ")
                .append(rv.toString())
                .append(" -> ")
                .append(newValue.toString())
                .append(" (was ")
                .append(oldRv.toString())
                .append(" -> ")
                .append(oldValue.toString())
                .append(")")
                .newline();
    }

    public void updateBinding(Variable oldRv, Variable newValue) {
        this.updateBinding(oldRv, newValue, null);
    }

    @Override
    public void onChangeInput(FunctionGraph graph, ChangeInputEvent event) {
        Variable value = this.rvValues.remove(event.oldVariable());
        if (value == null)
            return;
        if (this.rvValues.containsKey(event.newVariable()))
            throw new InternalCompilerError(event.reason() + ": replacing " + event.oldVariable() +
                    " by " + event.newVariable() + " would merge two bindings", event.node());
        this.rvValues.put(event.newVariable(), value);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Binding moved from ")
                .append(event.oldVariable().toString())
                .append(" to ")
                .append(event.newVariable().toString())
                .newline();
    }

    public boolean isBound(Variable rv) {
        return this.rvValues.containsKey(rv);
    }

    @Nullable
    public Variable getValue(Variable rv) {
        return this.rvValues.get(rv);
    }

    @Nullable
    public Variable getOriginalValue(Variable value) {
        return this.originalValues.get(value);
    }

    public Map<Variable, Variable> getBindings() {
        return Collections.unmodifiableMap(this.rvValues);
    }

    public Map<Variable, Variable> getOriginalValues() {
        return Collections.unmodifiableMap(this.originalValues);
    }
}
