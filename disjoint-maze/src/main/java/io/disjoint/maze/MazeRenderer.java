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

import static java.util.Objects.requireNonNull;

/**
 * Draws a maze with Unicode box-drawing characters. The drawing has one
 * character per room corner, so a {@code width x height} maze renders as
 * {@code height + 1} lines of {@code width + 1} characters.
 */
public final class MazeRenderer
{
    // indexed by the directions a wall leaves a corner: north << 3 | south << 2 | east << 1 | west
    private static final String GLYPHS = " ╴╶─╷┐┌┬╵┘└┴│┤├┼";

    private static final int NORTH = 0b1000;
    private static final int SOUTH = 0b0100;
    private static final int EAST = 0b0010;
    private static final int WEST = 0b0001;

    private MazeRenderer() {}

    public static String render(Maze maze)
    {
        requireNonNull(maze, "maze is null");
        int width = maze.getWidth();
        int height = maze.getHeight();

        StringBuilder builder = new StringBuilder((width + 2) * (height + 1));
        for (int y = 0; y <= height; y++) {
            for (int x = 0; x <= width; x++) {
                int directions = 0;
                if (y > 0 && hasVerticalWall(maze, x, y - 1)) {
                    directions |= NORTH;
                }
                if (y < height && hasVerticalWall(maze, x, y)) {
                    directions |= SOUTH;
                }
                if (x < width && hasHorizontalWall(maze, x, y)) {
                    directions |= EAST;
                }
                if (x > 0 && hasHorizontalWall(maze, x - 1, y)) {
                    directions |= WEST;
                }
                builder.append(GLYPHS.charAt(directions));
            }
            builder.append('\n');
        }
        return builder.toString();
    }

    /**
     * Wall running east from corner {@code (x, y)}, i.e. along the top of room {@code (x, y)}.
     */
    private static boolean hasHorizontalWall(Maze maze, int x, int y)
    {
        if (y < maze.getHeight()) {
            return maze.getRoom(x, y).hasNorthWall();
        }
        return maze.getRoom(x, y - 1).hasSouthWall();
    }

    /**
     * Wall running south from corner {@code (x, y)}, i.e. along the left of room {@code (x, y)}.
     */
    private static boolean hasVerticalWall(Maze maze, int x, int y)
    {
        if (x < maze.getWidth()) {
            return maze.getRoom(x, y).hasWestWall();
        }
        return maze.getRoom(x - 1, y).hasEastWall();
    }
}
