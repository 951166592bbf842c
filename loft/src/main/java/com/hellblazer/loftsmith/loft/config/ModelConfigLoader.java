/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.loftsmith.loft.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ModelConfig} JSON files.
 *
 * @author hal.hildebrand
 */
public class ModelConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ModelConfigLoader.class);

    private final ObjectMapper objectMapper;

    public ModelConfigLoader() {
        this(new ObjectMapper());
    }

    public ModelConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load and validate a configuration file. Relative vector file names resolve against the file's directory,
     * and the front and side files must exist.
     *
     * @throws IOException          if the file cannot be read
     * @throws ModelConfigException if the content is not a usable configuration
     */
    public ModelConfig load(Path file) throws IOException {
        var config = parse(Files.readString(file));
        config.baseDirectory = file.toAbsolutePath().getParent();
        requireFile(config, "svgFront", config.svgFront);
        requireFile(config, "svgSide", config.svgSide);
        if (config.svgTop != null) {
            requireFile(config, "svgTop", config.svgTop);
        }
        log.info("Loaded model configuration '{}' from {} with {} components", config.name, file,
                 config.components().size());
        return config;
    }

    /**
     * Bind and validate configuration JSON without touching the file system.
     */
    public ModelConfig parse(String json) {
        ModelConfig config;
        try {
            config = objectMapper.readValue(json, ModelConfig.class);
        } catch (JsonProcessingException e) {
            throw new ModelConfigException("Unreadable model configuration: " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new ModelConfigException("Empty model configuration");
        }
        config.validate();
        return config;
    }

    private void requireFile(ModelConfig config, String key, String name) {
        if (name == null || name.isBlank()) {
            throw new ModelConfigException("Missing required '" + key + "'");
        }
        var path = config.resolve(name);
        if (!Files.isRegularFile(path)) {
            throw new ModelConfigException("'" + key + "' file not found: " + path);
        }
    }
}
