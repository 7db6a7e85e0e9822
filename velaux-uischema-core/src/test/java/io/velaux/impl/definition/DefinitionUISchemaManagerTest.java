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
package io.velaux.impl.definition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.velaux.api.storage.DefinitionDocumentStore;
import io.velaux.api.uischema.DefinitionException;
import io.velaux.api.uischema.DefinitionType;
import io.velaux.api.uischema.UIParameter;
import io.velaux.api.uischema.UIParameterOverride;
import io.velaux.impl.Fixtures;
import io.velaux.impl.config.UISchemaConfiguration;
import io.velaux.impl.parser.UISchemaDocuments;
import io.velaux.impl.storage.LocalDefinitionDocumentStore;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DefinitionUISchemaManagerTest {

    @TempDir Path tempDir;

    private LocalDefinitionDocumentStore store;

    @BeforeEach
    void setup() {
        store = new LocalDefinitionDocumentStore();
        store.initialize(Map.of(LocalDefinitionDocumentStore.LOCAL_BASEDIR, tempDir.toString()));
    }

    private DefinitionUISchemaManager newManager(boolean cacheEnabled) throws Exception {
        DefinitionUISchemaManager manager = new DefinitionUISchemaManager(store, cacheEnabled);
        manager.putSchemaDocument(
                "apply-object",
                DefinitionType.WORKFLOW_STEP,
                Fixtures.read("apply-object-schema.json"));
        return manager;
    }

    @Test
    void testDocumentKeys() {
        assertEquals(
                "workflowstep-schema-apply-object",
                DefinitionUISchemaManager.schemaKey("apply-object", DefinitionType.WORKFLOW_STEP));
        assertEquals(
                "trait-uischema-scaler",
                DefinitionUISchemaManager.uiSchemaKey("scaler", DefinitionType.TRAIT));
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void testUpdateUISchema(boolean cacheEnabled) throws Exception {
        DefinitionUISchemaManager manager = newManager(cacheEnabled);
        List<UIParameter> defaults =
                manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP);
        assertEquals(5, defaults.size());

        List<UIParameterOverride> custom =
                UISchemaDocuments.parseOverrides(Fixtures.read("workflowstep-apply-object.yaml"));
        List<UIParameter> uiSchema =
                manager.addUISchema("apply-object", DefinitionType.WORKFLOW_STEP, custom);

        assertEquals(5, uiSchema.size());
        boolean found = false;
        for (UIParameter param : uiSchema) {
            if (param.getJsonKey().equals("batchPartition")) {
                found = true;
                assertEquals(1, param.getConditions().size());
                assertTrue(param.getValidate().isRequired());
                assertEquals(77, param.getSort());
                assertEquals("Batch Partition", param.getLabel());
            }
        }
        assertTrue(found);

        assertEquals(
                uiSchema, manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP));
        assertEquals(
                custom, manager.getCustomUISchema("apply-object", DefinitionType.WORKFLOW_STEP));

        manager.deleteUISchema("apply-object", DefinitionType.WORKFLOW_STEP);
        assertEquals(
                defaults, manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP));
        assertTrue(
                manager.getCustomUISchema("apply-object", DefinitionType.WORKFLOW_STEP).isEmpty());
    }

    @Test
    void testCachedTreesAreNotShared() throws Exception {
        DefinitionUISchemaManager manager = newManager(true);
        List<UIParameter> first =
                manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP);
        List<UIParameter> second =
                manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP);
        assertEquals(first, second);
        assertNotSame(first.get(0), second.get(0));

        first.get(0).setLabel("changed by the caller");
        first.clear();
        assertEquals(
                second, manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP));
    }

    @Test
    void testCachedDefaultsAreNotShared() throws Exception {
        DefinitionUISchemaManager manager = new DefinitionUISchemaManager(store, true);
        manager.putSchemaDocument(
                "labels",
                DefinitionType.TRAIT,
                """
                {"type": "object", "properties": {
                  "labels": {"type": "object", "additionalProperties": {"type": "string"},
                             "default": {"a": "1"}}
                }}
                """);
        List<UIParameter> first = manager.renderUISchema("labels", DefinitionType.TRAIT);
        ((Map<String, Object>) first.get(0).getValidate().getDefaultValue()).put("b", "2");

        List<UIParameter> second = manager.renderUISchema("labels", DefinitionType.TRAIT);
        assertEquals(Map.of("a", "1"), second.get(0).getValidate().getDefaultValue());
    }

    @Test
    void testDeleteDropsTheCacheEntry() throws Exception {
        DefinitionUISchemaManager manager = newManager(true);
        manager.addUISchema(
                "apply-object",
                DefinitionType.WORKFLOW_STEP,
                UISchemaDocuments.parseOverrides(
                        Fixtures.read("workflowstep-apply-object.yaml")));
        assertTrue(manager.isCached("apply-object", DefinitionType.WORKFLOW_STEP));

        manager.deleteUISchema("apply-object", DefinitionType.WORKFLOW_STEP);
        assertFalse(manager.isCached("apply-object", DefinitionType.WORKFLOW_STEP));

        manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP);
        assertTrue(manager.isCached("apply-object", DefinitionType.WORKFLOW_STEP));
        manager.deleteSchemaDocument("apply-object", DefinitionType.WORKFLOW_STEP);
        assertFalse(manager.isCached("apply-object", DefinitionType.WORKFLOW_STEP));
    }

    @Test
    void testCacheFollowsTheDocuments() throws Exception {
        DefinitionUISchemaManager manager = newManager(true);
        List<UIParameter> before =
                manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP);

        // documents changed behind the manager's back are picked up
        store.put(
                DefinitionUISchemaManager.uiSchemaKey("apply-object", DefinitionType.WORKFLOW_STEP),
                "- jsonKey: targetSize\n  label: Target Size\n");
        List<UIParameter> after =
                manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP);
        assertNotEquals(before, after);
        assertTrue(after.stream().anyMatch(p -> "Target Size".equals(p.getLabel())));

        manager.putSchemaDocument(
                "apply-object",
                DefinitionType.WORKFLOW_STEP,
                "{\"type\": \"object\","
                        + " \"properties\": {\"targetSize\": {\"type\": \"integer\"}}}");
        List<UIParameter> reduced =
                manager.renderUISchema("apply-object", DefinitionType.WORKFLOW_STEP);
        assertEquals(1, reduced.size());
        assertEquals("Target Size", reduced.get(0).getLabel());
    }

    @Test
    void testRevisionChangesWithEitherDocument() {
        String revision = DefinitionUISchemaManager.revision("{}", null);
        assertEquals(revision, DefinitionUISchemaManager.revision("{}", ""));
        assertNotEquals(revision, DefinitionUISchemaManager.revision("{}", "- jsonKey: a"));
        assertNotEquals(revision, DefinitionUISchemaManager.revision("{ }", null));
    }

    @Test
    void testMissingSchema() throws Exception {
        DefinitionUISchemaManager manager = newManager(true);
        DefinitionException e =
                assertThrows(
                        DefinitionException.class,
                        () -> manager.renderUISchema("unknown", DefinitionType.COMPONENT));
        assertEquals(DefinitionException.Type.NotFound, e.getType());

        e =
                assertThrows(
                        DefinitionException.class,
                        () ->
                                manager.addUISchema(
                                        "unknown",
                                        DefinitionType.COMPONENT,
                                        List.of(
                                                UIParameterOverride.builder()
                                                        .jsonKey("image")
                                                        .build())));
        assertEquals(DefinitionException.Type.NotFound, e.getType());

        manager.deleteSchemaDocument("apply-object", DefinitionType.WORKFLOW_STEP);
        e =
                assertThrows(
                        DefinitionException.class,
                        () -> manager.getSchema("apply-object", DefinitionType.WORKFLOW_STEP));
        assertEquals(DefinitionException.Type.NotFound, e.getType());
    }

    @Test
    void testInvalidDocumentsAreNotStored() throws Exception {
        DefinitionDocumentStore mockStore = mock(DefinitionDocumentStore.class);
        when(mockStore.get(anyString())).thenReturn("{\"type\": \"object\"}");
        DefinitionUISchemaManager manager = new DefinitionUISchemaManager(mockStore, false);

        DefinitionException e =
                assertThrows(
                        DefinitionException.class,
                        () ->
                                manager.putSchemaDocument(
                                        "webservice", DefinitionType.COMPONENT, "{\"type\": "));
        assertEquals(DefinitionException.Type.InvalidDocument, e.getType());

        e =
                assertThrows(
                        DefinitionException.class,
                        () ->
                                manager.addUISchema(
                                        "webservice",
                                        DefinitionType.COMPONENT,
                                        List.of(UIParameterOverride.builder().label("x").build())));
        assertEquals(DefinitionException.Type.InvalidUISchema, e.getType());

        verify(mockStore, never()).put(anyString(), anyString());
    }

    @Test
    void testInvalidIdentity() throws Exception {
        DefinitionUISchemaManager manager = newManager(false);
        assertThrows(
                IllegalArgumentException.class,
                () -> manager.renderUISchema(" ", DefinitionType.TRAIT));
        assertThrows(
                NullPointerException.class, () -> manager.renderUISchema("scaler", null));
    }

    @Test
    void testFromConfiguration() throws Exception {
        UISchemaConfiguration configuration = new UISchemaConfiguration();
        configuration
                .getStore()
                .setConfiguration(
                        Map.of(LocalDefinitionDocumentStore.LOCAL_BASEDIR, tempDir.toString()));
        DefinitionUISchemaManager manager =
                DefinitionUISchemaManager.fromConfiguration(configuration);

        // shares the directory of the store created in setup
        store.put(
                DefinitionUISchemaManager.schemaKey("scaler", DefinitionType.TRAIT),
                "{\"type\": \"object\", \"required\": [\"replicas\"],"
                        + " \"properties\": {\"replicas\": {\"type\": \"integer\"}}}");
        List<UIParameter> uiSchema = manager.renderUISchema("scaler", DefinitionType.TRAIT);
        assertEquals(1, uiSchema.size());
        assertTrue(uiSchema.get(0).isRequired());
        assertEquals("Number", uiSchema.get(0).getUiType());
    }
}
