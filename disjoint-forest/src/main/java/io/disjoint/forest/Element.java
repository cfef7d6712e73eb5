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

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkState;

/**
 * A member of a {@link DisjointSetForest}. Only the forest that created an
 * element may relate it to other elements; the payload belongs to the caller.
 */
@NotThreadSafe
public final class Element<T>
{
    private Element<T> parent;
    private int rank; // Upper bound on the height of this subtree while it is a root. Stale once reparented.
    private T payload;

    Element(@Nullable T payload)
    {
        this.parent = this;
        this.payload = payload;
    }

    @Nullable
    public T getPayload()
    {
        return payload;
    }

    public void setPayload(@Nullable T payload)
    {
        this.payload = payload;
    }

    boolean isRoot()
    {
        return parent == this;
    }

    Element<T> getParent()
    {
        return parent;
    }

    void setParent(Element<T> parent)
    {
        this.parent = parent;
    }

    int getRank()
    {
        checkState(isRoot(), "rank is only defined for a root");
        return rank;
    }

    void incrementRank()
    {
        checkState(isRoot(), "rank is only defined for a root");
        rank++;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("root", isRoot())
                .add("rank", rank)
                .add("payload", payload)
                .toString();
    }
}
