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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.velaux.api.uischema.DefinitionException;
import io.velaux.impl.Fixtures;
import io.velaux.impl.parser.UISchemaDocuments;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class UISchemaValidatorTest {

    @Test
    void testValidDocuments() throws Exception {
        assertDoesNotThrow(
                () ->
                        UISchemaValidator.validate(
                                UISchemaDocuments.parseOverrides(
                                        Fixtures.read("ui-custom-schema.yaml"))));
        assertDoesNotThrow(
                () ->
                        UISchemaValidator.validate(
                                UISchemaDocuments.parseOverrides(
                                        Fixtures.read("workflowstep-apply-object.yaml"))));
        assertDoesNotThrow(
                () ->
                        UISchemaValidator.validate(
                                UISchemaDocuments.parseOverrides(
                                        """
                                        - jsonKey: volumes
                                          conditions:
                                            - jsonKey: type
                                              op: in
                                              value: [pvc, secret]
                                              action: disable
                                        """)));
        assertDoesNotThrow(() -> UISchemaValidator.validate(null));
    }

    static Stream<Arguments> invalidDocuments() {
        return Stream.of(
                Arguments.of(
                        """
                        - label: no key
                        """,
                        "Parameter '[0]' the jsonKey can not be empty"),
                Arguments.of(
                        """
                        - jsonKey: image
                        - jsonKey: image
                        """,
                        "Parameter 'image' is declared more than once"),
                Arguments.of(
                        """
                        - jsonKey: image
                          sort: -1
                        """,
                        "Parameter 'image' has a negative sort value -1"),
                Arguments.of(
                        """
                        - jsonKey: image
                          conditions:
                            - value: x
                        """,
                        "Parameter 'image' has a condition without jsonKey"),
                Arguments.of(
                        """
                        - jsonKey: image
                          conditions:
                            - jsonKey: cpu
                              op: ">"
                              value: 1
                        """,
                        "unsupported operator '>'"),
                Arguments.of(
                        """
                        - jsonKey: image
                          conditions:
                            - jsonKey: cpu
                              action: hide
                        """,
                        "unsupported action 'hide'"),
                Arguments.of(
                        """
                        - jsonKey: image
                          conditions:
                            - jsonKey: cpu
                              op: in
                              value: single
                        """,
                        "has an 'in' condition whose value is not a list"),
                Arguments.of(
                        """
                        - jsonKey: probe
                          subParameters:
                            - jsonKey: probe.port
                            - label: missing
                        """,
                        "Parameter 'probe.subParameters[1]' the jsonKey can not be empty"));
    }

    @ParameterizedTest
    @MethodSource("invalidDocuments")
    void testInvalidDocuments(String document, String expectedMessage) {
        DefinitionException e =
                assertThrows(
                        DefinitionException.class,
                        () ->
                                UISchemaValidator.validate(
                                        UISchemaDocuments.parseOverrides(document)));
        assertEquals(DefinitionException.Type.InvalidUISchema, e.getType());
        assertTrue(e.getMessage().contains(expectedMessage), e.getMessage());
    }
}
