/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.tidelog.core.replay;

import dev.mars.tidelog.api.EventKey;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Merges two iterators that are each sorted by {@link EventKey}. When both
 * sides hold the same key, the primary element is emitted and the secondary
 * one is dropped.
 */
class MergingIterator<T> implements Iterator<T> {

    private final Iterator<T> primary;
    private final Iterator<T> secondary;
    private final Function<T, EventKey> keyOf;
    private T primaryHead;
    private T secondaryHead;

    MergingIterator(Iterator<T> primary, Iterator<T> secondary, Function<T, EventKey> keyOf) {
        this.primary = primary;
        this.secondary = secondary;
        this.keyOf = keyOf;
    }

    @Override
    public boolean hasNext() {
        fill();
        return primaryHead != null || secondaryHead != null;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        if (secondaryHead == null) {
            return takePrimary();
        }
        if (primaryHead == null) {
            return takeSecondary();
        }
        int cmp = keyOf.apply(primaryHead).compareTo(keyOf.apply(secondaryHead));
        if (cmp == 0) {
            secondaryHead = null;
            return takePrimary();
        }
        return cmp < 0 ? takePrimary() : takeSecondary();
    }

    private void fill() {
        if (primaryHead == null && primary.hasNext()) {
            primaryHead = primary.next();
        }
        if (secondaryHead == null && secondary.hasNext()) {
            secondaryHead = secondary.next();
        }
    }

    private T takePrimary() {
        T value = primaryHead;
        primaryHead = null;
        return value;
    }

    private T takeSecondary() {
        T value = secondaryHead;
        secondaryHead = null;
        return value;
    }
}
