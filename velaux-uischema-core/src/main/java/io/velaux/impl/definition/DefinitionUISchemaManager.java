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

import io.velaux.api.storage.DefinitionDocumentStore;
import io.velaux.api.storage.DefinitionDocumentStoreRegistry;
import io.velaux.api.uischema.DefinitionException;
import io.velaux.api.uischema.DefinitionType;
import io.velaux.api.uischema.SchemaNode;
import io.velaux.api.uischema.UIParameter;
import io.velaux.api.uischema.UIParameterOverride;
import io.velaux.impl.config.UISchemaConfiguration;
import io.velaux.impl.parser.UISchemaDocuments;
import io.velaux.impl.uischema.UISchemaRenderer;
import io.velaux.impl.uischema.UISchemaValidator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Serves the UI schema of the definitions: the OpenAPI schema and the custom UI schema of a
 * definition are read from a {@link DefinitionDocumentStore} and rendered on every request.
 * Rendered trees can be cached, the cache entry is bound to the revision of both documents.
 */
@Slf4j
public class DefinitionUISchemaManager {

    private static final String SCHEMA_KEY_INFIX = "-schema-";
    private static final String UI_SCHEMA_KEY_INFIX = "-uischema-";

    private record CachedUISchema(String revision, List<UIParameter> parameters) {}

    private final DefinitionDocumentStore store;
    private final boolean cacheEnabled;
    private final Map<String, CachedUISchema> cache = new ConcurrentHashMap<>();

    public DefinitionUISchemaManager(DefinitionDocumentStore store, boolean cacheEnabled) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.cacheEnabled = cacheEnabled;
    }

    public static DefinitionUISchemaManager fromConfiguration(UISchemaConfiguration configuration) {
        final UISchemaConfiguration.StoreProperties storeProperties = configuration.getStore();
        final DefinitionDocumentStore store =
                DefinitionDocumentStoreRegistry.loadStore(
                        storeProperties.getType(), storeProperties.getConfiguration());
        return new DefinitionUISchemaManager(store, configuration.getCache().isEnabled());
    }

    static String schemaKey(String name, DefinitionType type) {
        return type.getValue() + SCHEMA_KEY_INFIX + name;
    }

    static String uiSchemaKey(String name, DefinitionType type) {
        return type.getValue() + UI_SCHEMA_KEY_INFIX + name;
    }

    public void putSchemaDocument(String name, DefinitionType type, String document)
            throws DefinitionException {
        checkIdentity(name, type);
        // fail before storing a document that could never be rendered
        UISchemaDocuments.parseSchema(document);
        log.info("Storing schema of {} definition {}", type, name);
        store.put(schemaKey(name, type), document);
    }

    public void deleteSchemaDocument(String name, DefinitionType type) {
        checkIdentity(name, type);
        log.info("Deleting schema of {} definition {}", type, name);
        store.delete(schemaKey(name, type));
        cache.remove(schemaKey(name, type));
    }

    public SchemaNode getSchema(String name, DefinitionType type) throws DefinitionException {
        checkIdentity(name, type);
        return UISchemaDocuments.parseSchema(getSchemaDocument(name, type));
    }

    public List<UIParameterOverride> getCustomUISchema(String name, DefinitionType type)
            throws DefinitionException {
        checkIdentity(name, type);
        return UISchemaDocuments.parseOverrides(store.get(uiSchemaKey(name, type)));
    }

    /**
     * Validates and stores the custom UI schema of a definition.
     *
     * @return the UI schema rendered with the new customization
     */
    public List<UIParameter> addUISchema(
            String name, DefinitionType type, List<UIParameterOverride> overrides)
            throws DefinitionException {
        checkIdentity(name, type);
        // the schema must exist before it can be customized
        getSchemaDocument(name, type);
        UISchemaValidator.validate(overrides);
        log.info(
                "Storing custom UI schema of {} definition {} ({} parameters)",
                type,
                name,
                overrides == null ? 0 : overrides.size());
        store.put(uiSchemaKey(name, type), UISchemaDocuments.writeOverrides(overrides));
        return renderUISchema(name, type);
    }

    public void deleteUISchema(String name, DefinitionType type) {
        checkIdentity(name, type);
        log.info("Deleting custom UI schema of {} definition {}", type, name);
        store.delete(uiSchemaKey(name, type));
        cache.remove(schemaKey(name, type));
    }

    boolean isCached(String name, DefinitionType type) {
        return cache.containsKey(schemaKey(name, type));
    }

    public List<UIParameter> renderUISchema(String name, DefinitionType type)
            throws DefinitionException {
        checkIdentity(name, type);
        final String schemaDocument = getSchemaDocument(name, type);
        final String uiSchemaDocument = store.get(uiSchemaKey(name, type));
        if (!cacheEnabled) {
            return render(schemaDocument, uiSchemaDocument);
        }

        final String revision = revision(schemaDocument, uiSchemaDocument);
        final String cacheKey = schemaKey(name, type);
        CachedUISchema cached = cache.get(cacheKey);
        if (cached == null || !cached.revision().equals(revision)) {
            log.debug(
                    "Rendering UI schema of {} definition {} at revision {}", type, name, revision);
            cached = new CachedUISchema(revision, render(schemaDocument, uiSchemaDocument));
            cache.put(cacheKey, cached);
        }
        // the cached tree is never handed out
        return UIParameter.copyAll(cached.parameters());
    }

    private static List<UIParameter> render(String schemaDocument, String uiSchemaDocument)
            throws DefinitionException {
        final SchemaNode schema = UISchemaDocuments.parseSchema(schemaDocument);
        final List<UIParameterOverride> overrides =
                UISchemaDocuments.parseOverrides(uiSchemaDocument);
        return UISchemaRenderer.renderFinal(schema, overrides);
    }

    private String getSchemaDocument(String name, DefinitionType type)
            throws DefinitionException {
        final String document = store.get(schemaKey(name, type));
        if (document == null) {
            throw new DefinitionException(
                    "The schema of %s definition %s was not found".formatted(type, name),
                    DefinitionException.Type.NotFound);
        }
        return document;
    }

    static String revision(String schemaDocument, String uiSchemaDocument) {
        return DigestUtils.sha256Hex(
                schemaDocument + "\u0000" + StringUtils.defaultString(uiSchemaDocument));
    }

    private static void checkIdentity(String name, DefinitionType type) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("The definition name can not be empty");
        }
        Objects.requireNonNull(type, "type cannot be null");
    }
}
