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
package io.velaux.impl.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Settings of the definition UI schema manager.
 *
 * <pre>
 * store:
 *   type: local
 *   configuration:
 *     local.basedir: /var/lib/velaux
 * cache:
 *   enabled: true
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class UISchemaConfiguration {

    public static final String DEFAULT_RESOURCE = "velaux-uischema.yaml";

    private static final ObjectMapper mapper =
            new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StoreProperties {
        private String type = "local";
        private Map<String, Object> configuration = new HashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheProperties {
        private boolean enabled = true;
    }

    private StoreProperties store = new StoreProperties();
    private CacheProperties cache = new CacheProperties();

    public static UISchemaConfiguration load(Path path) throws IOException {
        log.info("Loading UI schema configuration from {}", path);
        return normalize(mapper.readValue(path.toFile(), UISchemaConfiguration.class));
    }

    public static UISchemaConfiguration loadDefault() throws IOException {
        final ClassLoader classLoader = UISchemaConfiguration.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return new UISchemaConfiguration();
            }
            return normalize(mapper.readValue(in, UISchemaConfiguration.class));
        }
    }

    private static UISchemaConfiguration normalize(UISchemaConfiguration configuration) {
        if (configuration == null) {
            return new UISchemaConfiguration();
        }
        if (configuration.getStore() == null) {
            configuration.setStore(new StoreProperties());
        }
        if (configuration.getStore().getConfiguration() == null) {
            configuration.getStore().setConfiguration(new HashMap<>());
        }
        if (configuration.getCache() == null) {
            configuration.setCache(new CacheProperties());
        }
        return configuration;
    }
}
