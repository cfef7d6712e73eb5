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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

import javax.validation.constraints.Min;

public class MazeConfig
{
    private int width = 50;
    private int height = 10;
    private long seed = 5552368;

    @Min(2)
    public int getWidth()
    {
        return width;
    }

    @Config("maze.width")
    @ConfigDescription("Width of the maze in rooms")
    public MazeConfig setWidth(int width)
    {
        this.width = width;
        return this;
    }

    @Min(2)
    public int getHeight()
    {
        return height;
    }

    @Config("maze.height")
    @ConfigDescription("Height of the maze in rooms")
    public MazeConfig setHeight(int height)
    {
        this.height = height;
        return this;
    }

    public long getSeed()
    {
        return seed;
    }

    @Config("maze.seed")
    @ConfigDescription("Seed for the random wall selection; equal seeds produce equal mazes")
    public MazeConfig setSeed(long seed)
    {
        this.seed = seed;
        return this;
    }
}
