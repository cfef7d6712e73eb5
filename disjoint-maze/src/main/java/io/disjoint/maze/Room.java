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
package io.disjoint.maze;

import static com.google.common.base.MoreObjects.toStringHelper;

public final class Room
{
    private boolean northWall = true;
    private boolean southWall = true;
    private boolean eastWall = true;
    private boolean westWall = true;

    public boolean hasNorthWall()
    {
        return northWall;
    }

    public boolean hasSouthWall()
    {
        return southWall;
    }

    public boolean hasEastWall()
    {
        return eastWall;
    }

    public boolean hasWestWall()
    {
        return westWall;
    }

    void removeNorthWall()
    {
        northWall = false;
    }

    void removeSouthWall()
    {
        southWall = false;
    }

    void removeEastWall()
    {
        eastWall = false;
    }

    void removeWestWall()
    {
        westWall = false;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("north", northWall)
                .add("south", southWall)
                .add("east", eastWall)
                .add("west", westWall)
                .toString();
    }
}
