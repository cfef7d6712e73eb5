/*
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
package io.disjoint.forest;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Partitions the elements it creates into disjoint sets. Each set is a tree
 * whose root is the set's representative. Merges attach the lower-ranked root
 * under the higher-ranked one and lookups halve the path they walk, which
 * together give amortized near-constant time per operation.
 * <p>
 * Lookups rewrite parent links, so every operation, including
 * {@link #findRepresentative}, needs exclusive access to the forest.
 * Elements from different forests must never be mixed.
 */
@NotThreadSafe
public class DisjointSetForest<T>
{
    private long elementCount;

    public Element<T> createSingleton()
    {
        return createSingleton(null);
    }

    public Element<T> createSingleton(@Nullable T payload)
    {
        elementCount++;
        return new Element<>(payload);
    }

    /**
     * @return the root of the tree containing {@code element}
     */
    public Element<T> findRepresentative(Element<T> element)
    {
        requireNonNull(element, "element is null");
        Element<T> current = element;
        while (!current.isRoot()) {
            // point at the grandparent, then continue from there
            current.setParent(current.getParent().getParent());
            current = current.getParent();
        }
        return current;
    }

    public boolean inSameSet(Element<T> first, Element<T> second)
    {
        return findRepresentative(first) == findRepresentative(second);
    }

    /**
     * Unites the sets containing {@code first} and {@code second}. Payloads are
     * left untouched; a caller aggregating them should store the combined value
     * on {@link #findRepresentative} of either argument afterwards.
     */
    public void merge(Element<T> first, Element<T> second)
    {
        requireNonNull(first, "first is null");
        requireNonNull(second, "second is null");
        Element<T> firstRoot = findRepresentative(first);
        Element<T> secondRoot = findRepresentative(second);
        if (firstRoot == secondRoot) {
            return;
        }
        int firstRank = firstRoot.getRank();
        int secondRank = secondRoot.getRank();
        if (firstRank < secondRank) {
            // the combined tree keeps the height of the deeper one
            firstRoot.setParent(secondRoot);
        }
        else {
            if (firstRank == secondRank) {
                // two trees of equal height make one a level taller
                firstRoot.incrementRank();
            }
            secondRoot.setParent(firstRoot);
        }
    }

    public long getElementCount()
    {
        return elementCount;
    }
}
