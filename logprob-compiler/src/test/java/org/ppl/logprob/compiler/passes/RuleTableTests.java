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

import org.junit.Assert;
import org.junit.Test;
import org.ppl.logprob.compiler.errors.ConfigurationError;
import org.ppl.logprob.compiler.rewrite.MeasurableRewrites;
import org.ppl.logprob.ir.op.OpKind;
import org.ppl.util.Linq;

import java.util.List;

public class RuleTableTests {
    static List<String> names(RuleTable table, OpKind kind) {
        return Linq.map(table.rulesFor(kind), r -> r.getName());
    }

    @Test
    public void orderByPriority() {
        RuleTable table = new RuleTable()
                .register(RecordingRule.never("late", OpKind.ELEMWISE), 10)
                .register(RecordingRule.never("first", OpKind.ELEMWISE), 0)
                .register(RecordingRule.never("second", OpKind.ELEMWISE), 0)
                .register(RecordingRule.never("shuffle", OpKind.DIMSHUFFLE), 0);
        Assert.assertEquals(List.of("first", "second", "late"), names(table, OpKind.ELEMWISE));
        Assert.assertEquals(List.of("shuffle"), names(table, OpKind.DIMSHUFFLE));
        Assert.assertTrue(table.rulesFor(OpKind.RANDOM_VARIABLE).isEmpty());
        Assert.assertEquals(4, table.size());
    }

    @Test
    public void registerAfterQuery() {
        RuleTable table = new RuleTable().register(RecordingRule.never("a", OpKind.ELEMWISE), 0);
        Assert.assertEquals(List.of("a"), names(table, OpKind.ELEMWISE));
        table.register(RecordingRule.never("b", OpKind.ELEMWISE), -1);
        Assert.assertEquals(List.of("b", "a"), names(table, OpKind.ELEMWISE));
    }

    @Test
    public void duplicateName() {
        RuleTable table = new RuleTable().register(RecordingRule.never("a", OpKind.ELEMWISE), 0);
        Assert.assertThrows(ConfigurationError.class,
                () -> table.register(RecordingRule.never("a", OpKind.SUBTENSOR), 1));
    }

    @Test
    public void without() {
        RuleTable table = MeasurableRewrites.measurableRules();
        RuleTable smaller = table.without(List.of("RemoveDiracDelta"));
        Assert.assertEquals(table.size() - 1, smaller.size());
        Assert.assertFalse(smaller.names().contains("RemoveDiracDelta"));
        Assert.assertTrue(smaller.rulesFor(OpKind.DIRAC_DELTA).isEmpty());
        // The original is unchanged
        Assert.assertEquals(1, table.rulesFor(OpKind.DIRAC_DELTA).size());

        ConfigurationError error = Assert.assertThrows(ConfigurationError.class,
                () -> table.without(List.of("NoSuchRule")));
        Assert.assertTrue(error.getMessage().contains("NoSuchRule"));
    }
}
