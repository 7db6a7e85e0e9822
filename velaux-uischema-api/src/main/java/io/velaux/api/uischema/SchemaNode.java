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
package io.velaux.api.uischema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One node of an OpenAPI v3 / JSON-Schema document describing the parameters of a definition.
 * Only the subset needed to derive UI parameters is mapped, everything else is ignored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaNode {
    private String type;
    private String format;
    private String title;
    private String description;

    @JsonProperty("enum")
    private List<Object> enumValues;

    @JsonProperty("default")
    private Object defaultValue;

    private LinkedHashMap<String, SchemaNode> properties;
    private SchemaNode items;
    private List<String> required;

    private Double minimum;
    private Double maximum;
    private Integer minLength;
    private Integer maxLength;
    private String pattern;

    /** Either a boolean or a nested schema, as allowed by the OpenAPI specification. */
    private Object additionalProperties;

    public boolean hasProperties() {
        return properties != null && !properties.isEmpty();
    }

    public boolean hasEnum() {
        return enumValues != null && !enumValues.isEmpty();
    }

    public boolean hasAdditionalProperties() {
        if (additionalProperties instanceof Boolean allowed) {
            return allowed;
        }
        return additionalProperties instanceof Map<?, ?>
                || additionalProperties instanceof SchemaNode;
    }

    public boolean isRequired(String propertyName) {
        return required != null && required.contains(propertyName);
    }
}
