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

/**
 * Closed classification of a {@link SchemaNode}. Every node maps to exactly one kind, and every
 * kind carries the widget tag used when no override replaces it.
 */
public enum SchemaKind {
    OBJECT("Group"),
    MAP("KV"),
    ARRAY_OF_SCALAR("Strings"),
    ARRAY_OF_OBJECT("Structs"),
    ENUM("Select"),
    STRING("Input"),
    NUMBER("Number"),
    BOOLEAN("Switch"),
    FALLBACK("Input");

    private final String defaultUIType;

    SchemaKind(String defaultUIType) {
        this.defaultUIType = defaultUIType;
    }

    public String defaultUIType() {
        return defaultUIType;
    }

    public boolean isNested() {
        return this == OBJECT || this == ARRAY_OF_OBJECT;
    }

    public static SchemaKind of(SchemaNode node) {
        if (node == null) {
            return FALLBACK;
        }
        if (node.hasEnum()) {
            return ENUM;
        }
        String type = node.getType();
        if (type == null) {
            // type is optional in OpenAPI when properties are declared
            return node.hasProperties() ? OBJECT : FALLBACK;
        }
        return switch (type) {
            case "object" -> {
                if (node.hasProperties()) {
                    yield OBJECT;
                }
                yield node.hasAdditionalProperties() ? MAP : FALLBACK;
            }
            case "array" -> {
                SchemaNode items = node.getItems();
                if (items == null) {
                    yield FALLBACK;
                }
                yield items.hasProperties() ? ARRAY_OF_OBJECT : ARRAY_OF_SCALAR;
            }
            case "string" -> STRING;
            case "integer", "number" -> NUMBER;
            case "boolean" -> BOOLEAN;
            default -> FALLBACK;
        };
    }
}
