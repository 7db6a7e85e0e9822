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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DefinitionType {
    COMPONENT("component"),
    TRAIT("trait"),
    WORKFLOW_STEP("workflowstep"),
    POLICY("policy");

    private final String value;

    DefinitionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DefinitionType fromValue(String value) {
        if (value != null) {
            for (DefinitionType type : values()) {
                if (type.value.equalsIgnoreCase(value.strip())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown definition type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
