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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Visibility rule: the owning parameter is shown only when the referenced value matches. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Condition {

    public static final String OPERATOR_EQUALS = "==";
    public static final String OPERATOR_NOT_EQUALS = "!=";
    public static final String OPERATOR_IN = "in";
    public static final Set<String> OPERATORS =
            Set.of("", OPERATOR_EQUALS, OPERATOR_NOT_EQUALS, OPERATOR_IN);

    public static final String ACTION_ENABLE = "enable";
    public static final String ACTION_DISABLE = "disable";
    public static final Set<String> ACTIONS = Set.of("", ACTION_ENABLE, ACTION_DISABLE);

    private String jsonKey;

    @JsonAlias("op")
    private String operator;

    private Object value;
    private String action;

    public Condition copy() {
        return toBuilder().value(JsonValues.copy(value)).build();
    }
}
