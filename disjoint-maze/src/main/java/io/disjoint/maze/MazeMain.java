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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import io.airlift.configuration.ConfigurationFactory;
import io.airlift.log.Logger;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

public final class MazeMain
{
    private static final Logger log = Logger.get(MazeMain.class);

    private static final Splitter PROPERTY_SPLITTER = Splitter.on('=').limit(2).trimResults();

    private MazeMain() {}

    public static void main(String[] args)
    {
        MazeConfig config = loadConfig(parseProperties(args));
        log.info("Generating %sx%s maze with seed %s", config.getWidth(), config.getHeight(), config.getSeed());

        Maze maze = new MazeGenerator(config).generate();
        System.out.print(MazeRenderer.render(maze));
    }

    static MazeConfig loadConfig(Map<String, String> properties)
    {
        return new ConfigurationFactory(properties).build(MazeConfig.class);
    }

    static Map<String, String> parseProperties(String... args)
    {
        ImmutableMap.Builder<String, String> properties = ImmutableMap.builder();
        for (String arg : args) {
            List<String> parts = PROPERTY_SPLITTER.splitToList(arg);
            checkArgument(parts.size() == 2 && !parts.get(0).isEmpty(), "Expected key=value: %s", arg);
            properties.put(parts.get(0), parts.get(1));
        }
        return properties.build();
    }
}
