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

import org.ppl.logprob.ir.type.TensorType;
import org.ppl.util.ICastable;
import org.ppl.util.IHasId;

import javax.annotation.Nullable;

/** A node of the dataflow graph carrying a tensor.
 * Variables are compared by identity.
 * A variable without an owner is a free input of the graph. */
public class Variable implements IHasId, ICastable {
    static long crtId = 0;

    public final long id;
    public final TensorType type;
    @Nullable
    private String name;
    /** Operation application producing this variable. */
    @Nullable
    public final Apply owner;
    /** Index of this variable in the outputs of the owner. */
    public final int index;

    Variable(TensorType type, @Nullable String name, @Nullable Apply owner, int index) {
        this.id = nextId();
        this.type = type;
        this.name = name;
        this.owner = owner;
        this.index = index;
    }

    /** Create a free variable. */
    public Variable(TensorType type, @Nullable String name) {
        this(type, name, null, 0);
    }

    static synchronized long nextId() {
        return crtId++;
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Nullable
    public String getName() {
        return this.name;
    }

    /** Names are only used for display. */
    public void setName(@Nullable String name) {
        this.name = name;
    }

    public boolean isFree() {
        return this.owner == null;
    }

    public int ndim() {
        return this.type.ndim();
    }

    /** A new free variable with the same type and name. */
    public Variable freshCopy() {
        return new Variable(this.type, this.name);
    }

    @Override
    public String toString() {
        if (this.name != null)
            return this.name;
        if (this.owner != null)
            return this.owner.op + "." + this.id;
        return "v" + this.id;
    }
}
