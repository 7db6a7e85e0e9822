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
package io.velaux.impl.parser;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.velaux.api.uischema.DefinitionException;
import io.velaux.api.uischema.SchemaNode;
import io.velaux.api.uischema.UIParameter;
import io.velaux.api.uischema.UIParameterOverride;
import java.util.ArrayList;
import java.util.List;
import lombok.SneakyThrows;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads and writes the documents exchanged with the surrounding system: the OpenAPI schema of a
 * definition, the custom UI schema authored by operators and the rendered UI schema.
 */
public class UISchemaDocuments {

    static final ObjectMapper jsonParser =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final ObjectMapper yamlParser =
            new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final ObjectMapper yamlWriter =
            new ObjectMapper(
                            new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
                    .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    static final ObjectMapper jsonWriter =
            new ObjectMapper()
                    .configure(SerializationFeature.INDENT_OUTPUT, true)
                    .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private UISchemaDocuments() {}

    public static SchemaNode parseSchema(String document) throws DefinitionException {
        if (StringUtils.isBlank(document)) {
            throw new DefinitionException(
                    "The schema document is empty", DefinitionException.Type.InvalidDocument);
        }
        try {
            SchemaNode schema = parserFor(document).readValue(document, SchemaNode.class);
            if (schema == null) {
                throw new DefinitionException(
                        "The schema document is empty", DefinitionException.Type.InvalidDocument);
            }
            return schema;
        } catch (JsonProcessingException e) {
            throw new DefinitionException(
                    "The schema document could not be parsed: " + e.getOriginalMessage(),
                    DefinitionException.Type.InvalidDocument,
                    e);
        }
    }

    public static List<UIParameterOverride> parseOverrides(String document)
            throws DefinitionException {
        if (StringUtils.isBlank(document)) {
            return new ArrayList<>();
        }
        try {
            List<UIParameterOverride> overrides =
                    parserFor(document)
                            .readValue(
                                    document, new TypeReference<List<UIParameterOverride>>() {});
            return overrides == null ? new ArrayList<>() : overrides;
        } catch (JsonProcessingException e) {
            throw new DefinitionException(
                    "The UI schema document could not be parsed: " + e.getOriginalMessage(),
                    DefinitionException.Type.InvalidDocument,
                    e);
        }
    }

    private static ObjectMapper parserFor(String document) {
        // JSON documents may be indented with tabs, which YAML rejects
        final String stripped = document.strip();
        if (stripped.startsWith("{") || stripped.startsWith("[")) {
            return jsonParser;
        }
        return yamlParser;
    }

    @SneakyThrows
    public static String writeOverrides(List<UIParameterOverride> overrides) {
        return yamlWriter.writeValueAsString(overrides == null ? List.of() : overrides);
    }

    @SneakyThrows
    public static String writeUISchema(List<UIParameter> parameters) {
        return jsonWriter.writeValueAsString(parameters == null ? List.of() : parameters);
    }
}
