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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A renderable parameter derived from a definition schema.
 *
 * <p>{@code jsonKey} is the dot-delimited path of the parameter from the root of the schema and
 * identifies the parameter across derivation, sorting and patching. {@code sort} is only
 * meaningful between siblings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UIParameter {

    public static final int DEFAULT_SORT = 100;

    private String jsonKey;
    private String label;
    private String description;
    private String uiType;
    private Validate validate;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<Condition> conditions;

    private int sort;
    private Boolean disable;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> style;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<UIParameter> subParameters;

    @JsonIgnore
    public boolean isRequired() {
        return validate != null && validate.isRequired();
    }

    @JsonIgnore
    public int getSubParameterCount() {
        return subParameters == null ? 0 : subParameters.size();
    }

    public UIParameter copy() {
        return toBuilder()
                .validate(validate == null ? null : validate.copy())
                .conditions(
                        conditions == null
                                ? null
                                : conditions.stream()
                                        .map(Condition::copy)
                                        .collect(Collectors.toCollection(ArrayList::new)))
                .style(JsonValues.copyMap(style))
                .subParameters(copyAll(subParameters))
                .build();
    }

    public static List<UIParameter> copyAll(List<UIParameter> parameters) {
        if (parameters == null) {
            return null;
        }
        return parameters.stream()
                .map(UIParameter::copy)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
