/*
 * Copyright DataStax, Inc.
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
package io.velaux.impl.storage;

import io.velaux.api.storage.DefinitionDocumentStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

/** Keeps every document in its own file under a base directory. */
@Slf4j
public class LocalDefinitionDocumentStore implements DefinitionDocumentStore {

    public static final String LOCAL_BASEDIR = "local.basedir";
    protected static final String DEFINITIONS_DIR = "__definitions_";
    private Path baseDir;

    @Override
    public String storeType() {
        return "local";
    }

    @Override
    public void initialize(Map<String, Object> configuration) {
        final String dir = configuration.getOrDefault(LOCAL_BASEDIR, "velaux-data").toString();
        this.baseDir = Path.of(dir, DEFINITIONS_DIR);
        baseDir.toFile().mkdirs();
        log.info("Configured local definition storage at {}", baseDir);
    }

    private Path computePathForKey(String key) {
        if (key == null || key.isBlank() || key.contains("/") || key.contains("\\")) {
            throw new IllegalArgumentException("Invalid document key: " + key);
        }
        return baseDir.resolve(key);
    }

    @Override
    @SneakyThrows
    public void put(String key, String value) {
        Files.writeString(computePathForKey(key), value);
    }

    @Override
    @SneakyThrows
    public void delete(String key) {
        try {
            Files.delete(computePathForKey(key));
        } catch (NoSuchFileException e) {
            log.debug("Document {} does not exist, nothing to delete", key);
        }
    }

    @Override
    @SneakyThrows
    public String get(String key) {
        try {
            return Files.readString(computePathForKey(key));
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    @Override
    @SneakyThrows
    public LinkedHashMap<String, String> list() {
        try (Stream<Path> files = Files.list(baseDir)) {
            return files.sorted()
                    .collect(
                            Collectors.toMap(
                                    p -> p.toFile().getName(),
                                    p -> {
                                        try {
                                            return Files.readString(p);
                                        } catch (Exception e) {
                                            throw new RuntimeException(e);
                                        }
                                    },
                                    (a, b) -> b,
                                    LinkedHashMap::new));
        }
    }
}
