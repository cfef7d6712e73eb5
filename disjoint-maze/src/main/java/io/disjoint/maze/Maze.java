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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * A grid of rooms addressed by {@code (x, y)}, with {@code (0, 0)} in the
 * top-left corner. Walls shared by neighbouring rooms are always removed
 * from both sides at once.
 */
public class Maze
{
    private final int width;
    private final int height;
    private final Room[][] rooms;

    public Maze(int width, int height)
    {
        checkArgument(width > 1, "width must be at least 2: %s", width);
        checkArgument(height > 1, "height must be at least 2: %s", height);
        this.width = width;
        this.height = height;
        this.rooms = new Room[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rooms[y][x] = new Room();
            }
        }
    }

    public int getWidth()
    {
        return width;
    }

    public int getHeight()
    {
        return height;
    }

    public Room getRoom(int x, int y)
    {
        checkElementIndex(x, width, "x");
        checkElementIndex(y, height, "y");
        return rooms[y][x];
    }

    void knockDownEastWall(int x, int y)
    {
        checkElementIndex(x, width - 1, "x");
        getRoom(x, y).removeEastWall();
        getRoom(x + 1, y).removeWestWall();
    }

    void knockDownSouthWall(int x, int y)
    {
        checkElementIndex(y, height - 1, "y");
        getRoom(x, y).removeSouthWall();
        getRoom(x, y + 1).removeNorthWall();
    }

    void openEntranceAndExit()
    {
        getRoom(0, 0).removeWestWall();
        getRoom(width - 1, height - 1).removeEastWall();
    }
}
