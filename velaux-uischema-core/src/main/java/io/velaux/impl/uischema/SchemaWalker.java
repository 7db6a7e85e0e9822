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
package io.velaux.impl.uischema;

import io.velaux.api.uischema.SchemaKind;
import io.velaux.api.uischema.SchemaNode;
import io.velaux.api.uischema.UIParameter;
import io.velaux.api.uischema.Validate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Derives the default UI parameter tree of a schema document. The result is not sorted, see
 * {@link ParameterSorter}.
 */
@Slf4j
public class SchemaWalker {

    private SchemaWalker() {}

    public static List<UIParameter> derive(SchemaNode root) {
        if (root == null) {
            return new ArrayList<>();
        }
        return deriveProperties(null, root);
    }

    private static List<UIParameter> deriveProperties(String parentKey, SchemaNode parent) {
        List<UIParameter> parameters = new ArrayList<>();
        if (!parent.hasProperties()) {
            return parameters;
        }
        for (Map.Entry<String, SchemaNode> property : parent.getProperties().entrySet()) {
            final String name = property.getKey();
            final String jsonKey = parentKey == null ? name : parentKey + "." + name;
            parameters.add(
                    deriveParameter(jsonKey, name, property.getValue(), parent.isRequired(name)));
        }
        return parameters;
    }

    private static UIParameter deriveParameter(
            String jsonKey, String name, SchemaNode schema, boolean required) {
        final SchemaKind kind = SchemaKind.of(schema);
        if (kind == SchemaKind.FALLBACK) {
            log.debug(
                    "Property {} has unsupported type {}, rendering it as a generic input",
                    jsonKey,
                    schema == null ? null : schema.getType());
        }

        UIParameter.UIParameterBuilder parameter =
                UIParameter.builder()
                        .jsonKey(jsonKey)
                        .uiType(kind.defaultUIType())
                        .validate(deriveValidate(schema, required))
                        .sort(UIParameter.DEFAULT_SORT);
        if (schema == null) {
            return parameter.label(name).build();
        }
        parameter
                .label(StringUtils.isNotBlank(schema.getTitle()) ? schema.getTitle() : name)
                .description(schema.getDescription());

        switch (kind) {
            case OBJECT -> parameter.subParameters(deriveProperties(jsonKey, schema));
            case ARRAY_OF_OBJECT -> parameter.subParameters(
                    deriveProperties(jsonKey, schema.getItems()));
            default -> {}
        }
        return parameter.build();
    }

    private static Validate deriveValidate(SchemaNode schema, boolean required) {
        Validate.ValidateBuilder validate = Validate.builder().required(required);
        if (schema == null) {
            return validate.build();
        }
        if (schema.hasEnum()) {
            validate.enumValues(schema.getEnumValues());
        }
        // enum and default values are copied out of the schema node
        return validate.defaultValue(schema.getDefaultValue())
                .pattern(schema.getPattern())
                .min(schema.getMinimum())
                .max(schema.getMaximum())
                .minLength(schema.getMinLength())
                .maxLength(schema.getMaxLength())
                .build()
                .copy();
    }
}
