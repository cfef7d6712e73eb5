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

import org.testng.annotations.Test;

import java.util.ArrayDeque;
import java.util.Deque;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertTrue;

public class TestMazeGenerator
{
    @Test
    public void testPerfectMaze()
    {
        for (long seed = 0; seed < 20; seed++) {
            Maze maze = new MazeGenerator(new MazeConfig().setWidth(17).setHeight(9).setSeed(seed)).generate();

            // a spanning tree over the rooms: connected, with one passage fewer than rooms
            assertEquals(countPassages(maze), 17 * 9 - 1);
            assertEquals(countReachable(maze), 17 * 9);
        }
    }

    @Test
    public void testDefaultConfig()
    {
        Maze maze = new MazeGenerator(new MazeConfig()).generate();

        assertEquals(maze.getWidth(), 50);
        assertEquals(maze.getHeight(), 10);
        assertEquals(countPassages(maze), 50 * 10 - 1);
        assertEquals(countReachable(maze), 50 * 10);
    }

    @Test
    public void testSmallestMaze()
    {
        Maze maze = new MazeGenerator(new MazeConfig().setWidth(2).setHeight(2)).generate();

        assertEquals(countPassages(maze), 3);
        assertEquals(countReachable(maze), 4);
    }

    @Test
    public void testWallsAreShared()
    {
        Maze maze = new MazeGenerator(new MazeConfig().setWidth(12).setHeight(8).setSeed(3)).generate();

        for (int y = 0; y < maze.getHeight(); y++) {
            for (int x = 0; x < maze.getWidth(); x++) {
                Room room = maze.getRoom(x, y);
                if (x + 1 < maze.getWidth()) {
                    assertEquals(room.hasEastWall(), maze.getRoom(x + 1, y).hasWestWall());
                }
                if (y + 1 < maze.getHeight()) {
                    assertEquals(room.hasSouthWall(), maze.getRoom(x, y + 1).hasNorthWall());
                }
            }
        }
    }

    @Test
    public void testOuterWalls()
    {
        Maze maze = new MazeGenerator(new MazeConfig().setWidth(12).setHeight(8).setSeed(3)).generate();

        for (int x = 0; x < maze.getWidth(); x++) {
            assertTrue(maze.getRoom(x, 0).hasNorthWall());
            assertTrue(maze.getRoom(x, maze.getHeight() - 1).hasSouthWall());
        }
        for (int y = 0; y < maze.getHeight(); y++) {
            assertEquals(maze.getRoom(0, y).hasWestWall(), y != 0);
            assertEquals(maze.getRoom(maze.getWidth() - 1, y).hasEastWall(), y != maze.getHeight() - 1);
        }
    }

    @Test
    public void testSeedDeterminesMaze()
    {
        MazeConfig config = new MazeConfig().setWidth(30).setHeight(15).setSeed(1234);
        String first = MazeRenderer.render(new MazeGenerator(config).generate());
        String second = MazeRenderer.render(new MazeGenerator(config).generate());
        String other = MazeRenderer.render(new MazeGenerator(config.setSeed(4321)).generate());

        assertEquals(second, first);
        assertNotEquals(other, first);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "width must be at least 2: 1")
    public void testRejectsNarrowMaze()
    {
        new MazeGenerator(new MazeConfig().setWidth(1)).generate();
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "height must be at least 2: 0")
    public void testRejectsFlatMaze()
    {
        new MazeGenerator(new MazeConfig().setHeight(0)).generate();
    }

    private static int countPassages(Maze maze)
    {
        int passages = 0;
        for (int y = 0; y < maze.getHeight(); y++) {
            for (int x = 0; x < maze.getWidth(); x++) {
                if (x + 1 < maze.getWidth() && !maze.getRoom(x, y).hasEastWall()) {
                    passages++;
                }
                if (y + 1 < maze.getHeight() && !maze.getRoom(x, y).hasSouthWall()) {
                    passages++;
                }
            }
        }
        return passages;
    }

    private static int countReachable(Maze maze)
    {
        boolean[][] visited = new boolean[maze.getHeight()][maze.getWidth()];
        Deque<int[]> queue = new ArrayDeque<>();
        queue.add(new int[] {0, 0});
        visited[0][0] = true;
        int reachable = 0;
        while (!queue.isEmpty()) {
            int[] position = queue.poll();
            int x = position[0];
            int y = position[1];
            reachable++;
            Room room = maze.getRoom(x, y);
            if (!room.hasEastWall() && x + 1 < maze.getWidth()) {
                visit(visited, queue, x + 1, y);
            }
            if (!room.hasWestWall() && x > 0) {
                visit(visited, queue, x - 1, y);
            }
            if (!room.hasSouthWall() && y + 1 < maze.getHeight()) {
                visit(visited, queue, x, y + 1);
            }
            if (!room.hasNorthWall() && y > 0) {
                visit(visited, queue, x, y - 1);
            }
        }
        return reachable;
    }

    private static void visit(boolean[][] visited, Deque<int[]> queue, int x, int y)
    {
        if (!visited[y][x]) {
            visited[y][x] = true;
            queue.add(new int[] {x, y});
        }
    }
}
