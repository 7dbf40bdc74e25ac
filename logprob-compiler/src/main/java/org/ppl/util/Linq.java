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

package org.ppl.util;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/** Minimal implementation of some LINQ-like methods on collections. */
public class Linq {
    private Linq() {}

    public static <T, S> List<S> map(List<T> data, Function<T, S> function) {
        List<S> result = new ArrayList<>(data.size());
        for (T aData : data)
            result.add(function.apply(aData));
        return result;
    }

    public static List<Integer> range(int start, int exclusiveEnd) {
        List<Integer> result = new ArrayList<>();
        for (int i = start; i < exclusiveEnd; i++)
            result.add(i);
        return result;
    }

    public static <T> List<T> fill(int count, T value) {
        List<T> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++)
            result.add(value);
        return result;
    }

    /** True if the two collections contain the same objects (by identity), in the same order. */
    public static <T> boolean same(@Nullable Collection<T> left, @Nullable Collection<T> right) {
        if (left == null)
            return right == null;
        if (right == null)
            return false;
        if (left.size() != right.size())
            return false;
        Iterator<T> rightIt = right.iterator();
        for (T l: left) {
            if (l != rightIt.next())
                return false;
        }
        return true;
    }

    public static <T, S, R> List<R> zipSameLength(List<T> left, List<S> right, BiFunction<T, S, R> function) {
        Utilities.enforce(left.size() == right.size(),
                "Lists of different lengths: " + left.size() + " and " + right.size());
        List<R> result = new ArrayList<>(left.size());
        for (int i = 0; i < left.size(); i++)
            result.add(function.apply(left.get(i), right.get(i)));
        return result;
    }

    @SafeVarargs
    public static <T> List<T> list(T... data) {
        return new ArrayList<>(List.of(data));
    }

    public static <T> List<T> concat(List<T> left, List<T> right) {
        List<T> result = new ArrayList<>(left);
        result.addAll(right);
        return result;
    }

    public static <T> List<T> where(Collection<T> data, Predicate<T> function) {
        List<T> result = new ArrayList<>();
        for (T d: data)
            if (function.test(d))
                result.add(d);
        return result;
    }

    public static <T> boolean any(Iterable<T> data, Predicate<T> test) {
        for (T d: data)
            if (test.test(d))
                return true;
        return false;
    }

    public static <T> boolean all(Iterable<T> data, Predicate<T> test) {
        for (T d: data)
            if (!test.test(d))
                return false;
        return true;
    }

    public static int product(List<Integer> data) {
        int result = 1;
        for (int d: data)
            result *= d;
        return result;
    }
}
