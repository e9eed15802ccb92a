/*
 *    Copyright 2009-2021 the original author or authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */
package org.mybatis.mapperast.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ParameterExpressionTest {

  @Test
  void simpleProperty() {
    Map<String, String> result = new ParameterExpression("id");
    assertEquals(1, result.size());
    assertEquals("id", result.get("property"));
  }

  @Test
  void propertyWithSpacesInside() {
    Map<String, String> result = new ParameterExpression(" with spaces ");
    assertEquals("with spaces", result.get("property"));
  }

  @Test
  void simplePropertyWithOldStyleJdbcType() {
    Map<String, String> result = new ParameterExpression("id:VARCHAR");
    assertEquals(2, result.size());
    assertEquals("id", result.get("property"));
    assertEquals("VARCHAR", result.get("jdbcType"));
  }

  @Test
  void expressionWithOldStyleJdbcType() {
    Map<String, String> result = new ParameterExpression("(id.toString()):VARCHAR");
    assertEquals(2, result.size());
    assertEquals("id.toString()", result.get("expression"));
    assertEquals("VARCHAR", result.get("jdbcType"));
    assertNull(result.get("property"));
  }

  @Test
  void shouldKeepOptionsInDeclarationOrder() {
    Map<String, String> result = new ParameterExpression("id, jdbcType = INTEGER, javaType=int, mode=IN");
    Map<String, String> expected = new LinkedHashMap<>();
    expected.put("property", "id");
    expected.put("jdbcType", "INTEGER");
    expected.put("javaType", "int");
    expected.put("mode", "IN");
    assertEquals(expected.toString(), result.toString());
  }

  @Test
  void blankExpressionHasNoEntries() {
    assertTrue(new ParameterExpression("  ").isEmpty());
  }

  @Test
  void invalidOldJdbcTypeFormat() {
    BuilderException e = assertThrows(BuilderException.class, () -> new ParameterExpression("id:"));
    assertSame(ErrorKind.MALFORMED_PARAMETER, e.getErrorKind());
    assertTrue(e.getMessage().contains("Parsing error in {id:} in position 3"));
  }

  @Test
  void invalidJdbcTypeOptUsingExpression() {
    BuilderException e = assertThrows(BuilderException.class, () -> new ParameterExpression("(expression)+"));
    assertTrue(e.getMessage().contains("Parsing error in {(expression)+} in position 12"));
  }

  @Test
  void unbalancedParentheses() {
    BuilderException e = assertThrows(BuilderException.class, () -> new ParameterExpression("(a.b("));
    assertSame(ErrorKind.MALFORMED_PARAMETER, e.getErrorKind());
  }

  @Test
  void optionWithoutValue() {
    BuilderException e = assertThrows(BuilderException.class, () -> new ParameterExpression("id, jdbcType"));
    assertSame(ErrorKind.MALFORMED_PARAMETER, e.getErrorKind());
  }

}
