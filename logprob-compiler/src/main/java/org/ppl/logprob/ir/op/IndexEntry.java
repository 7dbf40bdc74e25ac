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

package org.ppl.logprob.ir.op;

import org.ppl.logprob.compiler.errors.CompilationError;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** One entry of a static index list, applying to one axis of a tensor.
 * Negative positions count from the end of the axis, as in python. */
public abstract class IndexEntry {
    /** Positions selected on an axis of the specified size. */
    public abstract List<Integer> positions(int dimension);

    /** True if the axis is kept in the result. */
    public abstract boolean keepsAxis();

    static int normalize(int position, int dimension) {
        int result = position < 0 ? position + dimension : position;
        if (result < 0 || result >= dimension)
            throw new CompilationError("Index " + position + " is out of bounds for axis with size " + dimension);
        return result;
    }

    public static IndexEntry at(int position) {
        return new Scalar(position);
    }

    public static IndexEntry slice(@Nullable Integer start, @Nullable Integer stop, @Nullable Integer step) {
        return new Slice(start, stop, step);
    }

    /** Selects the whole axis. */
    public static IndexEntry all() {
        return new Slice(null, null, null);
    }

    public static IndexEntry array(int... positions) {
        return new Array(positions);
    }

    /** A single position; the axis is dropped. */
    public static final class Scalar extends IndexEntry {
        public final int position;

        Scalar(int position) {
            this.position = position;
        }

        @Override
        public List<Integer> positions(int dimension) {
            return List.of(normalize(this.position, dimension));
        }

        @Override
        public boolean keepsAxis() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Scalar && ((Scalar) o).position == this.position;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(this.position);
        }

        @Override
        public String toString() {
            return Integer.toString(this.position);
        }
    }

    /** A python slice start:stop:step. */
    public static final class Slice extends IndexEntry {
        @Nullable
        public final Integer start;
        @Nullable
        public final Integer stop;
        @Nullable
        public final Integer step;

        Slice(@Nullable Integer start, @Nullable Integer stop, @Nullable Integer step) {
            if (step != null && step == 0)
                throw new CompilationError("Slice step cannot be zero");
            this.start = start;
            this.stop = stop;
            this.step = step;
        }

        static int clamp(int position, int dimension, int low, int high) {
            int result = position < 0 ? position + dimension : position;
            return Math.max(low, Math.min(high, result));
        }

        @Override
        public List<Integer> positions(int dimension) {
            int step = this.step == null ? 1 : this.step;
            List<Integer> result = new ArrayList<>();
            if (step > 0) {
                int begin = this.start == null ? 0 : clamp(this.start, dimension, 0, dimension);
                int end = this.stop == null ? dimension : clamp(this.stop, dimension, 0, dimension);
                for (int i = begin; i < end; i += step)
                    result.add(i);
            } else {
                int begin = this.start == null ? dimension - 1 : clamp(this.start, dimension, -1, dimension - 1);
                int end = this.stop == null ? -1 : clamp(this.stop, dimension, -1, dimension - 1);
                for (int i = begin; i > end; i += step)
                    result.add(i);
            }
            return result;
        }

        @Override
        public boolean keepsAxis() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Slice))
                return false;
            Slice other = (Slice) o;
            return Objects.equals(this.start, other.start) &&
                    Objects.equals(this.stop, other.stop) &&
                    Objects.equals(this.step, other.step);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.start, this.stop, this.step);
        }

        @Override
        public String toString() {
            String result = (this.start == null ? "" : this.start.toString()) + ":" +
                    (this.stop == null ? "" : this.stop.toString());
            if (this.step != null)
                result += ":" + this.step;
            return result;
        }
    }

    /** An explicit list of positions on one axis. */
    public static final class Array extends IndexEntry {
        private final int[] positions;

        Array(int[] positions) {
            this.positions = positions.clone();
        }

        public int[] getPositions() {
            return this.positions.clone();
        }

        @Override
        public List<Integer> positions(int dimension) {
            List<Integer> result = new ArrayList<>(this.positions.length);
            for (int position: this.positions)
                result.add(normalize(position, dimension));
            return result;
        }

        @Override
        public boolean keepsAxis() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Array && Arrays.equals(((Array) o).positions, this.positions);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(this.positions);
        }

        @Override
        public String toString() {
            return Arrays.toString(this.positions);
        }
    }
}
