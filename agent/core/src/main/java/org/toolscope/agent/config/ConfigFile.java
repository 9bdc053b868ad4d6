/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.toolscope.agent.config;

import java.io.File;
import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.Files;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.util.ObjectMappers;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads {@link ObservabilityConfig} from the {@code "observability"} node of a JSON file. Anything
 * that goes wrong (missing file, malformed json, invalid values) is logged and the defaults are
 * used, a bad config file never prevents a server from starting.
 */
public class ConfigFile {

    private static final Logger logger = LoggerFactory.getLogger(ConfigFile.class);

    private static final ObjectMapper mapper = ObjectMappers.create();

    static final String CONFIG_FILE_NAME = "toolscope.json";
    static final String DEFAULT_CONFIG_FILE_NAME = "toolscope-default.json";

    private static final String OBSERVABILITY_KEY = "observability";

    private ConfigFile() {}

    // toolscope.json in the first directory, otherwise the first toolscope-default.json found
    public static ObservabilityConfig loadFromDirectories(List<File> confDirs) {
        if (!confDirs.isEmpty()) {
            File file = new File(confDirs.get(0), CONFIG_FILE_NAME);
            if (file.exists()) {
                return load(file);
            }
        }
        File defaultFile = getDefaultConfigFile(confDirs);
        if (defaultFile == null) {
            return ObservabilityConfig.defaults();
        }
        return load(defaultFile);
    }

    public static ObservabilityConfig load(File file) {
        if (!file.exists()) {
            logger.debug("config file not found, using defaults: {}", file.getAbsolutePath());
            return ObservabilityConfig.defaults();
        }
        ObjectNode rootObjectNode = getRootObjectNode(file);
        JsonNode node = rootObjectNode.get(OBSERVABILITY_KEY);
        if (node == null) {
            return ObservabilityConfig.defaults();
        }
        try {
            return mapper.treeToValue(node, ObservabilityConfig.class);
        } catch (JsonProcessingException e) {
            logger.warn("error parsing config json node '{}' in {}, using defaults",
                    OBSERVABILITY_KEY, file.getAbsolutePath(), e);
            return ObservabilityConfig.defaults();
        }
    }

    private static ObjectNode getRootObjectNode(File file) {
        String content;
        try {
            content = Files.asCharSource(file, UTF_8).read();
        } catch (IOException e) {
            logger.warn("error reading config file: {}", file.getAbsolutePath(), e);
            return mapper.createObjectNode();
        }
        try {
            JsonNode rootNode = mapper.readTree(content);
            if (rootNode instanceof ObjectNode) {
                return (ObjectNode) rootNode;
            }
            logger.warn("config file does not contain a json object: {}", file.getAbsolutePath());
        } catch (IOException e) {
            logger.warn("error processing config file: {}", file.getAbsolutePath(), e);
        }
        return mapper.createObjectNode();
    }

    private static @Nullable File getDefaultConfigFile(List<File> confDirs) {
        for (File confDir : confDirs) {
            File defaultFile = new File(confDir, DEFAULT_CONFIG_FILE_NAME);
            if (defaultFile.exists()) {
                return defaultFile;
            }
        }
        return null;
    }
}
