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
import io.velaux.api.uischema.DefinitionException;
import io.velaux.api.uischema.UIParameterOverride;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/** Checks a custom UI schema before it is stored. */
public class UISchemaValidator {

    private UISchemaValidator() {}

    public static void validate(List<UIParameterOverride> overrides) throws DefinitionException {
        validateLevel(null, overrides);
    }

    private static void validateLevel(String parentKey, List<UIParameterOverride> overrides)
            throws DefinitionException {
        if (overrides == null) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < overrides.size(); i++) {
            final UIParameterOverride override = overrides.get(i);
            final String position =
                    parentKey == null ? "[" + i + "]" : parentKey + ".subParameters[" + i + "]";
            if (override == null || StringUtils.isBlank(override.getJsonKey())) {
                throw invalid(position, "the jsonKey can not be empty");
            }
            final String jsonKey = override.getJsonKey();
            if (!seen.add(jsonKey)) {
                throw invalid(jsonKey, "is declared more than once");
            }
            if (override.getSort() != null && override.getSort() < 0) {
                throw invalid(jsonKey, "has a negative sort value " + override.getSort());
            }
            if (override.getConditions() != null) {
                for (Condition condition : override.getConditions()) {
                    validateCondition(jsonKey, condition);
                }
            }
            validateLevel(jsonKey, override.getSubParameters());
        }
    }

    private static void validateCondition(String jsonKey, Condition condition)
            throws DefinitionException {
        if (condition == null || StringUtils.isBlank(condition.getJsonKey())) {
            throw invalid(jsonKey, "has a condition without jsonKey");
        }
        final String operator = StringUtils.defaultString(condition.getOperator());
        if (!Condition.OPERATORS.contains(operator)) {
            throw invalid(
                    jsonKey,
                    "has a condition with an unsupported operator '%s', expected one of ==, != or in"
                            .formatted(operator));
        }
        final String action = StringUtils.defaultString(condition.getAction());
        if (!Condition.ACTIONS.contains(action)) {
            throw invalid(
                    jsonKey,
                    "has a condition with an unsupported action '%s', expected enable or disable"
                            .formatted(action));
        }
        if (Condition.OPERATOR_IN.equals(operator)
                && !(condition.getValue() instanceof Collection<?>)) {
            throw invalid(jsonKey, "has an 'in' condition whose value is not a list");
        }
    }

    private static DefinitionException invalid(String jsonKey, String message) {
        return new DefinitionException(
                "Invalid UI schema. Parameter '%s' %s".formatted(jsonKey, message),
                DefinitionException.Type.InvalidUISchema);
    }
}
