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

import org.junit.Assert;
import org.junit.Test;
import org.ppl.logprob.compiler.errors.ConfigurationError;
import org.ppl.logprob.compiler.errors.InternalCompilerError;
import org.ppl.logprob.ir.ChangeInputEvent;
import org.ppl.logprob.ir.FunctionGraph;
import org.ppl.logprob.ir.Tensors;
import org.ppl.logprob.ir.Variable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ProvenanceTrackerTests {
    static Variable normal() {
        return Tensors.normal(Tensors.scalar("mu"), Tensors.constant(1.0));
    }

    @Test
    public void secondTrackerRejected() {
        FunctionGraph graph = new FunctionGraph(List.of(normal()));
        graph.attachFeature(new ProvenanceTracker(new LinkedHashMap<>()));
        Assert.assertThrows(ConfigurationError.class,
                () -> graph.attachFeature(new ProvenanceTracker(new LinkedHashMap<>())));
        Assert.assertEquals(1, graph.getFeatures().size());
    }

    @Test
    public void trackerAttachedOnce() {
        ProvenanceTracker tracker = new ProvenanceTracker(new LinkedHashMap<>());
        FunctionGraph first = new FunctionGraph(List.of(normal()));
        first.attachFeature(tracker);
        Assert.assertSame(first, tracker.getGraph());
        FunctionGraph second = new FunctionGraph(List.of(normal()));
        Assert.assertThrows(ConfigurationError.class, () -> second.attachFeature(tracker));
    }

    @Test
    public void updateBinding() {
        Variable x = normal();
        Variable value = Tensors.scalar("x");
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(x, value);
        ProvenanceTracker tracker = new ProvenanceTracker(bindings);
        Assert.assertSame(value, tracker.getOriginalValue(value));

        Variable newValue = Tensors.exp(value);
        tracker.updateBinding(x, newValue);
        Assert.assertSame(newValue, tracker.getValue(x));
        // The map passed to the constructor is updated in place
        Assert.assertSame(newValue, bindings.get(x));
        Assert.assertSame(value, tracker.getOriginalValue(newValue));
        Assert.assertNull(tracker.getOriginalValue(value));

        // The original value survives several updates
        Variable z = normal();
        Variable last = Tensors.neg(newValue);
        tracker.updateBinding(x, last, z);
        Assert.assertFalse(tracker.isBound(x));
        Assert.assertSame(last, tracker.getValue(z));
        Assert.assertSame(value, tracker.getOriginalValue(last));
        Assert.assertEquals(1, tracker.getBindings().size());
        Assert.assertEquals(1, tracker.getOriginalValues().size());
    }

    @Test
    public void updateUnbound() {
        ProvenanceTracker tracker = new ProvenanceTracker(new LinkedHashMap<>());
        Assert.assertThrows(InternalCompilerError.class,
                () -> tracker.updateBinding(normal(), Tensors.scalar("v")));
    }

    @Test
    public void replacementMovesBinding() {
        Variable x = normal();
        Variable value = Tensors.scalar("x");
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(x, value);
        FunctionGraph graph = new FunctionGraph(List.of(x));
        ProvenanceTracker tracker = new ProvenanceTracker(bindings);
        graph.attachFeature(tracker);

        Variable replacement = normal();
        for (ChangeInputEvent event: graph.replace(x, replacement, "test"))
            tracker.onChangeInput(graph, event);
        Assert.assertFalse(tracker.isBound(x));
        Assert.assertSame(value, tracker.getValue(replacement));
        Assert.assertSame(value, tracker.getOriginalValue(value));
    }

    @Test
    public void replacementOfUnboundVariable() {
        Variable x = normal();
        Variable y = Tensors.exp(x);
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(y, Tensors.scalar("y"));
        FunctionGraph graph = new FunctionGraph(List.of(y));
        ProvenanceTracker tracker = new ProvenanceTracker(bindings);
        graph.attachFeature(tracker);

        for (ChangeInputEvent event: graph.replace(x, normal(), "test"))
            tracker.onChangeInput(graph, event);
        Assert.assertTrue(tracker.isBound(y));
        Assert.assertEquals(1, tracker.getBindings().size());
    }

    @Test
    public void mergingBindingsFails() {
        Variable first = normal();
        Variable second = normal();
        Map<Variable, Variable> bindings = new LinkedHashMap<>();
        bindings.put(first, Tensors.scalar("first"));
        bindings.put(second, Tensors.scalar("second"));
        FunctionGraph graph = new FunctionGraph(List.of(first, second));
        ProvenanceTracker tracker = new ProvenanceTracker(bindings);
        graph.attachFeature(tracker);

        List<ChangeInputEvent> events = graph.replace(first, second, "test");
        Assert.assertThrows(InternalCompilerError.class,
                () -> tracker.onChangeInput(graph, events.get(0)));
    }
}
