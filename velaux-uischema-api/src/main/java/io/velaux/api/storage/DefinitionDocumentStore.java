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
package io.velaux.api.storage;

import java.util.LinkedHashMap;

/**
 * Key/value store holding the raw schema documents and the custom UI schema documents of the
 * definitions. Values are the documents' text.
 */
public interface DefinitionDocumentStore extends GenericStore {

    void put(String key, String value);

    void delete(String key);

    /**
     * @return the stored document, or {@code null} if there is none
     */
    String get(String key);

    LinkedHashMap<String, String> list();
}
