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

import io.velaux.api.uischema.UIParameter;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Orders every sibling list of a UI parameter tree: required parameters first, then parameters
 * with fewer sub-parameters, then by label. Sort numbers are reassigned continuously across the
 * whole list so that comparing them reproduces the order.
 */
public class ParameterSorter {

    static final Comparator<UIParameter> ORDER =
            Comparator.comparing((UIParameter p) -> !p.isRequired())
                    .thenComparingInt(UIParameter::getSubParameterCount)
                    .thenComparing(
                            UIParameter::getLabel,
                            Comparator.nullsFirst(ParameterSorter::compareCodePoints));

    private ParameterSorter() {}

    static int compareCodePoints(String a, String b) {
        return Arrays.compare(a.codePoints().toArray(), b.codePoints().toArray());
    }

    /**
     * Sorts the list in place, recursively.
     *
     * @return the same list
     */
    public static List<UIParameter> sort(List<UIParameter> siblings) {
        if (siblings == null || siblings.isEmpty()) {
            return siblings;
        }
        final int base = baseSort(siblings);
        siblings.sort(ORDER);
        for (int i = 0; i < siblings.size(); i++) {
            UIParameter parameter = siblings.get(i);
            parameter.setSort(base + i);
            sort(parameter.getSubParameters());
        }
        return siblings;
    }

    private static int baseSort(List<UIParameter> siblings) {
        return siblings.stream()
                .mapToInt(UIParameter::getSort)
                .filter(sort -> sort > 0)
                .min()
                .orElse(UIParameter.DEFAULT_SORT);
    }
}
