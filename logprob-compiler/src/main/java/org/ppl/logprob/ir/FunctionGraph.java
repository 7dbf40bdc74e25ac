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

import org.ppl.logprob.compiler.errors.InternalCompilerError;
import org.ppl.util.IIndentStream;
import org.ppl.util.IWritesLogs;
import org.ppl.util.IndentStreamBuilder;
import org.ppl.util.Linq;
import org.ppl.util.Logger;
import org.ppl.util.ToIndentableString;
import org.ppl.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** A dataflow graph computing a list of output variables.
 * The graph contains every {@link Apply} node reachable from the outputs,
 * and keeps track of the clients (uses) of every variable.
 * Nodes are only rewritten by {@link #replace}, which redirects uses
 * and removes the nodes that are no longer used.
 * Replacing mutates the inputs of the Apply nodes involved, so a graph should
 * be built on a clone when the original nodes must be preserved. */
public class FunctionGraph implements IWritesLogs, ToIndentableString {
    private final List<Variable> inputs;
    private final Set<Variable> inputSet;
    private final List<Variable> outputs;
    private final Set<Apply> nodes;
    private final Map<Variable, List<Client>> clients;
    private final List<GraphFeature> features;

    public FunctionGraph(List<Variable> outputs) {
        this.inputs = new ArrayList<>();
        this.inputSet = new HashSet<>();
        this.outputs = new ArrayList<>(outputs);
        this.nodes = new LinkedHashSet<>();
        this.clients = new HashMap<>();
        this.features = new ArrayList<>();
        for (int i = 0; i < outputs.size(); i++) {
            Variable output = outputs.get(i);
            this.importVariable(output);
            this.addClient(output, Client.output(i));
        }
    }

    /** Clone the subgraph computing 'outputs' and build a graph out of the clone.
     * Free variables and constants are not cloned.
     * @param outputs  Variables to compute.
     * @param memo     Variables already present in this map are pinned: they
     *                 are mapped to their value and their ancestors are not visited.
     *                 On return it maps every reachable variable to its clone. */
    public static FunctionGraph clone(List<Variable> outputs, Map<Variable, Variable> memo) {
        for (Variable output: outputs)
            cloneVariable(output, memo);
        return new FunctionGraph(Linq.map(outputs, o -> Utilities.getExists(memo, o)));
    }

    static Variable cloneVariable(Variable variable, Map<Variable, Variable> memo) {
        Variable result = memo.get(variable);
        if (result != null)
            return result;
        Apply node = variable.owner;
        if (node == null) {
            memo.put(variable, variable);
            return variable;
        }
        List<Variable> inputs = new ArrayList<>(node.inputCount());
        for (Variable input: node.getInputs())
            inputs.add(cloneVariable(input, memo));
        Apply clone = node.cloneWithInputs(inputs);
        for (int i = 0; i < node.getOutputs().size(); i++) {
            Variable output = clone.getOutputs().get(i);
            output.setName(node.getOutputs().get(i).getName());
            memo.putIfAbsent(node.getOutputs().get(i), output);
        }
        return memo.get(variable);
    }

    private void addClient(Variable variable, Client client) {
        this.clients.computeIfAbsent(variable, v -> new ArrayList<>()).add(client);
    }

    private void removeClient(Variable variable, Client client) {
        List<Client> uses = this.clients.get(variable);
        Utilities.enforce(uses != null && uses.remove(client),
                () -> "Variable " + variable + " does not have client " + client);
    }

    /** Add to the graph the nodes needed to compute 'variable'. */
    private void importVariable(Variable variable) {
        Apply node = variable.owner;
        if (node == null) {
            this.clients.computeIfAbsent(variable, v -> new ArrayList<>());
            if (!(variable instanceof Constant) && this.inputSet.add(variable))
                this.inputs.add(variable);
            return;
        }
        if (this.nodes.contains(node))
            return;
        for (Variable input: node.getInputs())
            this.importVariable(input);
        this.nodes.add(node);
        for (int i = 0; i < node.inputCount(); i++)
            this.addClient(node.getInput(i), new Client(node, i));
        for (Variable output: node.getOutputs())
            this.clients.computeIfAbsent(output, v -> new ArrayList<>());
    }

    /** Remove the owner of 'variable' if none of its outputs is used, recursively. */
    private void prune(Variable variable) {
        Apply node = variable.owner;
        if (node == null || !this.nodes.contains(node))
            return;
        for (Variable output: node.getOutputs())
            if (!this.getClients(output).isEmpty())
                return;
        this.nodes.remove(node);
        for (Variable output: node.getOutputs())
            this.clients.remove(output);
        Logger.INSTANCE.belowLevel(this, 3)
                .append("Removing ")
                .appendSupplier(node::toString)
                .newline();
        for (int i = 0; i < node.inputCount(); i++) {
            Variable input = node.getInput(i);
            this.removeClient(input, new Client(node, i));
            this.prune(input);
        }
    }

    /** True if 'variable' is computed using 'target'. */
    static boolean dependsOn(Variable variable, Variable target, Set<Apply> visited) {
        if (variable == target)
            return true;
        Apply node = variable.owner;
        if (node == null || !visited.add(node))
            return false;
        for (Variable input: node.getInputs())
            if (dependsOn(input, target, visited))
                return true;
        return false;
    }

    /** Redirect all uses of 'old' to 'replacement'.
     * @param old          Variable to replace; must be part of this graph.
     * @param replacement  Variable replacing it; must have the same type.
     * @param reason       Name of the rewrite requesting the replacement.
     * @return The list of inputs that were changed.  The graph does not notify
     *         its features; the caller is responsible for dispatching the events. */
    public List<ChangeInputEvent> replace(Variable old, Variable replacement, String reason) {
        if (!this.clients.containsKey(old))
            throw new InternalCompilerError(reason + ": replacing variable " + old + " which is not in the graph");
        if (!old.type.sameType(replacement.type))
            throw new InternalCompilerError(reason + ": replacing " + old + " with type " + old.type +
                    " by " + replacement + " with type " + replacement.type, old.owner);
        if (old == replacement)
            return List.of();
        if (dependsOn(replacement, old, new HashSet<>()))
            throw new InternalCompilerError(reason + ": replacing " + old + " by " + replacement +
                    " would create a cycle", old.owner);
        Logger.INSTANCE.belowLevel(this, 2)
                .append(reason)
                .append(": ")
                .appendSupplier(() -> old.owner != null ? old.owner.toString() : old.toString())
                .append(" -> ")
                .appendSupplier(() -> replacement.owner != null ? replacement.owner.toString() : replacement.toString())
                .newline();
        this.importVariable(replacement);
        List<ChangeInputEvent> events = new ArrayList<>();
        for (Client client: new ArrayList<>(this.getClients(old))) {
            Apply node = client.node();
            if (node == null)
                this.outputs.set(client.index(), replacement);
            else
                node.setInput(client.index(), replacement);
            this.removeClient(old, client);
            this.addClient(replacement, client);
            events.add(new ChangeInputEvent(node, client.index(), old, replacement, reason));
        }
        this.prune(old);
        return events;
    }

    /** Replace each variable in 'olds' with the corresponding one in 'replacements'. */
    public List<ChangeInputEvent> replaceAll(List<Variable> olds, List<Variable> replacements, String reason) {
        Utilities.enforce(olds.size() == replacements.size(),
                () -> reason + ": replacing " + olds.size() + " variables with " + replacements.size());
        List<ChangeInputEvent> events = new ArrayList<>();
        for (int i = 0; i < olds.size(); i++)
            events.addAll(this.replace(olds.get(i), replacements.get(i), reason));
        return events;
    }

    public void attachFeature(GraphFeature feature) {
        feature.onAttach(this);
        this.features.add(feature);
    }

    public List<GraphFeature> getFeatures() {
        return Collections.unmodifiableList(this.features);
    }

    @Nullable
    public <T extends GraphFeature> T getFeature(Class<T> clazz) {
        for (GraphFeature feature: this.features)
            if (clazz.isInstance(feature))
                return clazz.cast(feature);
        return null;
    }

    public List<Client> getClients(Variable variable) {
        List<Client> result = this.clients.get(variable);
        if (result == null)
            return List.of();
        return Collections.unmodifiableList(result);
    }

    public boolean contains(Apply node) {
        return this.nodes.contains(node);
    }

    public boolean contains(Variable variable) {
        return this.clients.containsKey(variable);
    }

    public List<Variable> getInputs() {
        return Collections.unmodifiableList(this.inputs);
    }

    public List<Variable> getOutputs() {
        return Collections.unmodifiableList(this.outputs);
    }

    public Variable getOutput(int index) {
        return this.outputs.get(index);
    }

    /** Number of Apply nodes. */
    public int size() {
        return this.nodes.size();
    }

    public Set<Apply> getNodes() {
        return Collections.unmodifiableSet(this.nodes);
    }

    private void toposort(Variable variable, Set<Apply> visited, List<Apply> result) {
        Apply node = variable.owner;
        if (node == null || !visited.add(node))
            return;
        for (Variable input: node.getInputs())
            this.toposort(input, visited, result);
        result.add(node);
    }

    /** The Apply nodes of the graph; each node appears after the nodes computing its inputs. */
    public List<Apply> toposort() {
        List<Apply> result = new ArrayList<>(this.nodes.size());
        Set<Apply> visited = new HashSet<>();
        for (Variable output: this.outputs)
            this.toposort(output, visited, result);
        return result;
    }

    private void print(IIndentStream stream, Variable variable, Set<Apply> printed) {
        Apply node = variable.owner;
        if (node == null) {
            stream.append(variable.toString())
                    .append(" ")
                    .append(variable.type.toString())
                    .newline();
            return;
        }
        stream.append(node.op.getName())
                .append(" [id ")
                .append(node.id)
                .append("] ")
                .append(variable.type.toString());
        if (!printed.add(node)) {
            stream.append(" ...").newline();
            return;
        }
        stream.increase();
        for (Variable input: node.getInputs())
            this.print(stream, input, printed);
        stream.decrease();
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        Set<Apply> printed = new HashSet<>();
        for (Variable output: this.outputs)
            this.print(builder, output, printed);
        return builder;
    }

    @Override
    public String toString() {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        this.toString(builder);
        return builder.toString();
    }
}
