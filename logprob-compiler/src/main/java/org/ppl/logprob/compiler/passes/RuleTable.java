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

import org.ppl.logprob.compiler.errors.ConfigurationError;
import org.ppl.logprob.compiler.rewrite.LocalRewriter;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.util.Linq;
import org.ppl.util.Utilities;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A table of rewrite rules ordered by priority and indexed by the kind of
 * node they apply to.  Rules with a lower priority are tried first;
 * rules with the same priority are tried in registration order.
 * Once built a table can be queried by several threads. */
public class RuleTable {
    record Entry(LocalRewriter rewriter, int priority, int order) {}

    private final Map<String, Entry> entries;
    private final Map<OpKind, List<LocalRewriter>> byKind;

    public RuleTable() {
        this.entries = new LinkedHashMap<>();
        this.byKind = new EnumMap<>(OpKind.class);
    }

    /** Register a rule.  The table holds the rule returned by
     * {@link LocalRewriter#registeredIn}, which may be a copy of 'rewriter'. */
    public synchronized RuleTable register(LocalRewriter rewriter, int priority) {
        String name = rewriter.getName();
        if (this.entries.containsKey(name))
            throw new ConfigurationError("Rewrite rule " + Utilities.singleQuote(name) + " registered twice");
        this.entries.put(name, new Entry(rewriter.registeredIn(this), priority, this.entries.size()));
        this.byKind.clear();
        return this;
    }

    /** The rules which apply to nodes of the specified kind, in the order they are tried. */
    public synchronized List<LocalRewriter> rulesFor(OpKind kind) {
        return this.byKind.computeIfAbsent(kind, k -> {
            List<Entry> matching = Linq.where(this.entries.values(), e -> e.rewriter().tracks().contains(k));
            matching.sort(Comparator.comparingInt(Entry::priority).thenComparingInt(Entry::order));
            return Collections.unmodifiableList(Linq.map(matching, Entry::rewriter));
        });
    }

    /** The rule with the specified name. */
    public synchronized LocalRewriter get(String name) {
        Entry entry = this.entries.get(name);
        if (entry == null)
            throw new ConfigurationError("Unknown rewrite rule " + Utilities.singleQuote(name));
        return entry.rewriter();
    }

    /** A copy of this table without the rules with the specified names. */
    public synchronized RuleTable without(Collection<String> names) {
        for (String name: names)
            if (!this.entries.containsKey(name))
                throw new ConfigurationError("Unknown rewrite rule " + Utilities.singleQuote(name) +
                        "; known rules are " + this.names());
        RuleTable result = new RuleTable();
        for (Entry entry: this.entries.values())
            if (!names.contains(entry.rewriter().getName()))
                result.register(entry.rewriter(), entry.priority());
        return result;
    }

    public synchronized List<String> names() {
        return new ArrayList<>(this.entries.keySet());
    }

    public synchronized int size() {
        return this.entries.size();
    }

    public synchronized boolean isEmpty() {
        return this.entries.isEmpty();
    }
}
