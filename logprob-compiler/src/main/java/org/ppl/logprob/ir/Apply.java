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

import org.ppl.logprob.ir.op.Op;
import org.ppl.logprob.ir.type.TensorType;
import org.ppl.util.IHasId;
import org.ppl.util.Utilities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Application of an {@link Op} to a list of input variables.
 * Inputs can only be changed by a {@link FunctionGraph} replacement. */
public final class Apply implements IHasId {
    static long crtId = 0;

    public final long id;
    public final Op op;
    private final List<Variable> inputs;
    private final List<Variable> outputs;

    /** Use {@link Op#makeNode} to build nodes; it validates the inputs. */
    public Apply(Op op, List<Variable> inputs, List<TensorType> outputTypes) {
        this.id = nextId();
        this.op = op;
        this.inputs = new ArrayList<>(inputs);
        List<Variable> outputs = new ArrayList<>(outputTypes.size());
        for (int i = 0; i < outputTypes.size(); i++)
            outputs.add(new Variable(outputTypes.get(i), null, this, i));
        this.outputs = Collections.unmodifiableList(outputs);
    }

    static synchronized long nextId() {
        return crtId++;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public List<Variable> getInputs() {
        return Collections.unmodifiableList(this.inputs);
    }

    public Variable getInput(int index) {
        return this.inputs.get(index);
    }

    public int inputCount() {
        return this.inputs.size();
    }

    public List<Variable> getOutputs() {
        return this.outputs;
    }

    /** The single output of this node. */
    public Variable output() {
        Utilities.enforce(this.outputs.size() == 1,
                () -> "Node " + this + " has " + this.outputs.size() + " outputs");
        return this.outputs.get(0);
    }

    void setInput(int index, Variable variable) {
        this.inputs.set(index, variable);
    }

    /** A new node computing the same function on other inputs. */
    public Apply cloneWithInputs(List<Variable> newInputs) {
        return this.op.makeNode(newInputs);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.op).append("(");
        boolean first = true;
        for (Variable input: this.inputs) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(input);
        }
        return builder.append(") [id ").append(this.id).append("]").toString();
    }
}
