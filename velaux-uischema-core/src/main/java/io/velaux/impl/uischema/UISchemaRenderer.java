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

import io.velaux.api.uischema.SchemaNode;
import io.velaux.api.uischema.UIParameter;
import io.velaux.api.uischema.UIParameterOverride;
import java.util.List;

/**
 * Entry point of the UI schema engine. Both operations are pure functions of their arguments and
 * return a tree owned by the caller.
 */
public class UISchemaRenderer {

    private UISchemaRenderer() {}

    public static List<UIParameter> renderDefault(SchemaNode schema) {
        return ParameterSorter.sort(SchemaWalker.derive(schema));
    }

    public static List<UIParameter> renderFinal(
            SchemaNode schema, List<UIParameterOverride> overrides) {
        List<UIParameter> defaults = renderDefault(schema);
        if (overrides == null || overrides.isEmpty()) {
            return defaults;
        }
        return PatchMerger.patch(defaults, overrides);
    }
}
