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

import java.util.LinkedHashMap;

/**
 * Inline parameter expression parser. Supported grammar (simplified):
 *
 * <pre>
 * inline-parameter = (propertyName | expression) oldJdbcType attributes
 * propertyName = /expression language's property navigation path/
 * expression = '(' /expression language's expression/ ')'
 * oldJdbcType = ':' /any valid jdbc type/
 * attributes = (',' attribute)*
 * attribute = name '=' value
 * </pre>
 *
 * <p>Entries keep the order they were declared in.
 *
 * @author Frank D. Martinez [mnesarco]
 */
public class ParameterExpression extends LinkedHashMap<String, String> {

  private static final long serialVersionUID = -2417552199605158680L;

  public static final String PROPERTY = "property";
  public static final String EXPRESSION = "expression";
  public static final String JDBC_TYPE = "jdbcType";

  public ParameterExpression(String expression) {
    parse(expression);
  }

  private void parse(String expression) {
    int p = skipWS(expression, 0);
    if (p == expression.length()) {
      return;
    }
    if (expression.charAt(p) == '(') {
      expression(expression, p + 1);
    } else {
      property(expression, p);
    }
  }

  private void expression(String expression, int left) {
    int match = 1;
    int right = left;
    while (match > 0) {
      if (right >= expression.length()) {
        throw new BuilderException(ErrorKind.MALFORMED_PARAMETER,
            "Parsing error in {" + expression + "}: unbalanced parentheses");
      }
      if (expression.charAt(right) == ')') {
        match--;
      } else if (expression.charAt(right) == '(') {
        match++;
      }
      right++;
    }
    put(EXPRESSION, expression.substring(left, right - 1));
    jdbcTypeOpt(expression, right);
  }

  private void property(String expression, int left) {
    int right = skipUntil(expression, left, ",:");
    put(PROPERTY, trimmedStr(expression, left, right));
    jdbcTypeOpt(expression, right);
  }

  private int skipWS(String expression, int p) {
    for (int i = p; i < expression.length(); i++) {
      if (expression.charAt(i) > 0x20) {
        return i;
      }
    }
    return expression.length();
  }

  private int skipUntil(String expression, int p, final String endChars) {
    for (int i = p; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (endChars.indexOf(c) > -1) {
        return i;
      }
    }
    return expression.length();
  }

  private void jdbcTypeOpt(String expression, int p) {
    p = skipWS(expression, p);
    if (p < expression.length()) {
      if (expression.charAt(p) == ':') {
        jdbcType(expression, p + 1);
      } else if (expression.charAt(p) == ',') {
        options(expression, p + 1);
      } else {
        throw new BuilderException(ErrorKind.MALFORMED_PARAMETER,
            "Parsing error in {" + expression + "} in position " + p);
      }
    }
  }

  private void jdbcType(String expression, int p) {
    int left = skipWS(expression, p);
    int right = skipUntil(expression, left, ",");
    if (right > left) {
      put(JDBC_TYPE, trimmedStr(expression, left, right));
    } else {
      throw new BuilderException(ErrorKind.MALFORMED_PARAMETER,
          "Parsing error in {" + expression + "} in position " + p);
    }
    options(expression, right + 1);
  }

  private void options(String expression, int p) {
    int left = skipWS(expression, p);
    while (left < expression.length()) {
      int right = skipUntil(expression, left, "=");
      if (right == expression.length()) {
        throw new BuilderException(ErrorKind.MALFORMED_PARAMETER,
            "Parsing error in {" + expression + "}: option without value in position " + left);
      }
      String name = trimmedStr(expression, left, right);
      left = right + 1;
      right = skipUntil(expression, left, ",");
      put(name, trimmedStr(expression, left, right));
      left = skipWS(expression, right + 1);
    }
  }

  private String trimmedStr(String str, int start, int end) {
    while (start < end && str.charAt(start) <= 0x20) {
      start++;
    }
    while (end > start && str.charAt(end - 1) <= 0x20) {
      end--;
    }
    return start >= end ? "" : str.substring(start, end);
  }

}
