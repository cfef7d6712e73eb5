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

import io.airlift.log.Logger;
import io.disjoint.forest.DisjointSetForest;
import io.disjoint.forest.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static java.util.Objects.requireNonNull;

/**
 * Carves a perfect maze: walls between randomly chosen neighbouring rooms are
 * knocked down until every room reaches every other room, skipping any wall
 * whose two rooms are already connected.
 */
public class MazeGenerator
{
    private static final Logger log = Logger.get(MazeGenerator.class);

    private final int width;
    private final int height;
    private final long seed;

    public MazeGenerator(MazeConfig config)
    {
        requireNonNull(config, "config is null");
        this.width = config.getWidth();
        this.height = config.getHeight();
        this.seed = config.getSeed();
    }

    public Maze generate()
    {
        Maze maze = new Maze(width, height);
        Random random = new Random(seed);

        DisjointSetForest<Void> forest = new DisjointSetForest<>();
        List<Element<Void>> reaches = new ArrayList<>(width * height);
        for (int i = 0; i < width * height; i++) {
            reaches.add(forest.createSingleton());
        }

        int components = width * height;
        long probes = 0;
        while (components > 1) {
            probes++;
            // only right and down are needed, the other two directions are symmetric
            int x = random.nextInt(width);
            int y = random.nextInt(height);
            boolean right = random.nextBoolean();
            if ((right && x == width - 1) || (!right && y == height - 1)) {
                continue;
            }

            Element<Void> room = reaches.get(index(x, y));
            Element<Void> neighbour = right ? reaches.get(index(x + 1, y)) : reaches.get(index(x, y + 1));
            if (forest.inSameSet(room, neighbour)) {
                continue;
            }

            if (right) {
                maze.knockDownEastWall(x, y);
            }
            else {
                maze.knockDownSouthWall(x, y);
            }
            forest.merge(room, neighbour);
            components--;
        }
        maze.openEntranceAndExit();

        log.debug("Generated %sx%s maze from seed %s after %s probes", width, height, seed, probes);
        return maze;
    }

    private int index(int x, int y)
    {
        return y * width + x;
    }
}
