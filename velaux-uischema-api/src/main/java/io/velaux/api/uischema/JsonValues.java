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

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.SneakyThrows;

/** Copies free-form JSON values (defaults, enum elements, condition values, styles). */
final class JsonValues {

    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonValues() {}

    static Object copy(Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean) {
            return value;
        }
        return deepCopy(value);
    }

    static List<Object> copyList(List<Object> values) {
        if (values == null) {
            return null;
        }
        final List<Object> result = new ArrayList<>(values.size());
        values.forEach(value -> result.add(copy(value)));
        return result;
    }

    static Map<String, Object> copyMap(Map<String, Object> values) {
        if (values == null) {
            return null;
        }
        final Map<String, Object> result = new LinkedHashMap<>();
        values.forEach((key, value) -> result.put(key, copy(value)));
        return result;
    }

    @SneakyThrows
    private static Object deepCopy(Object value) {
        return mapper.readValue(mapper.writeValueAsBytes(value), Object.class);
    }
}
