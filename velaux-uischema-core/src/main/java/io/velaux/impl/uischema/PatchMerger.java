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

import io.velaux.api.uischema.Condition;
import io.velaux.api.uischema.UIParameter;
import io.velaux.api.uischema.UIParameterOverride;
import io.velaux.api.uischema.Validate;
import io.velaux.api.uischema.ValidateOverride;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Overlays custom UI parameters onto a derived tree. The result always has the shape and the
 * order of the base tree: overrides are matched by {@code jsonKey} level by level, and overrides
 * without a match are dropped.
 */
@Slf4j
public class PatchMerger {

    private PatchMerger() {}

    /**
     * @return a new tree, {@code base} is left untouched
     */
    public static List<UIParameter> patch(
            List<UIParameter> base, List<UIParameterOverride> overrides) {
        if (base == null) {
            return new ArrayList<>();
        }
        List<UIParameter> result = UIParameter.copyAll(base);
        if (overrides != null && !overrides.isEmpty()) {
            apply(result, overrides);
        }
        return result;
    }

    private static void apply(List<UIParameter> parameters, List<UIParameterOverride> overrides) {
        Map<String, UIParameterOverride> byKey = new LinkedHashMap<>();
        for (UIParameterOverride override : overrides) {
            if (override != null && override.getJsonKey() != null) {
                // last one wins
                byKey.put(override.getJsonKey(), override);
            }
        }
        for (UIParameter parameter : parameters) {
            UIParameterOverride override = byKey.remove(parameter.getJsonKey());
            if (override != null) {
                applyOverride(parameter, override);
            }
        }
        if (!byKey.isEmpty()) {
            log.debug(
                    "Ignoring custom parameters without a matching schema property: {}",
                    byKey.keySet());
        }
    }

    private static void applyOverride(UIParameter parameter, UIParameterOverride override) {
        if (override.getLabel() != null) {
            parameter.setLabel(override.getLabel());
        }
        if (override.getDescription() != null) {
            parameter.setDescription(override.getDescription());
        }
        if (override.getUiType() != null) {
            parameter.setUiType(override.getUiType());
        }
        if (override.getValidate() != null) {
            parameter.setValidate(
                    mergeValidate(parameter.getValidate(), override.getValidate()));
        }
        if (override.getConditions() != null) {
            parameter.setConditions(
                    override.getConditions().stream()
                            .map(Condition::copy)
                            .collect(Collectors.toCollection(ArrayList::new)));
        }
        if (override.getSort() != null) {
            parameter.setSort(override.getSort());
        }
        if (override.getDisable() != null) {
            parameter.setDisable(override.getDisable());
        }
        if (override.getStyle() != null) {
            parameter.setStyle(new LinkedHashMap<>(override.getStyle()));
        }
        if (override.getSubParameters() != null) {
            if (parameter.getSubParameters() == null || parameter.getSubParameters().isEmpty()) {
                log.debug(
                        "Ignoring custom sub-parameters of {}, the schema declares none",
                        parameter.getJsonKey());
            } else {
                apply(parameter.getSubParameters(), override.getSubParameters());
            }
        }
    }

    private static Validate mergeValidate(Validate base, ValidateOverride override) {
        Validate merged = base == null ? new Validate() : base.copy();
        if (override.getRequired() != null) {
            merged.setRequired(override.getRequired());
        }
        if (override.getEnumValues() != null) {
            merged.setEnumValues(new ArrayList<>(override.getEnumValues()));
        }
        if (override.getDefaultValue() != null) {
            merged.setDefaultValue(override.getDefaultValue());
        }
        if (override.getPattern() != null) {
            merged.setPattern(override.getPattern());
        }
        if (override.getMin() != null) {
            merged.setMin(override.getMin());
        }
        if (override.getMax() != null) {
            merged.setMax(override.getMax());
        }
        if (override.getMinLength() != null) {
            merged.setMinLength(override.getMinLength());
        }
        if (override.getMaxLength() != null) {
            merged.setMaxLength(override.getMaxLength());
        }
        if (override.getImmutable() != null) {
            merged.setImmutable(override.getImmutable());
        }
        return merged;
    }
}
