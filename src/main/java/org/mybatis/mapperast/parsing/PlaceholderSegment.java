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
package org.mybatis.mapperast.parsing;

import java.util.Collections;
import java.util.Map;

import org.mybatis.mapperast.builder.ParameterExpression;

/**
 * A {@code #{...}} or {@code ${...}} placeholder. The expression is the raw text between the
 * braces.
 */
public final class PlaceholderSegment implements Segment {

  private final String expression;
  private final PlaceholderStyle style;
  private volatile Map<String, String> parameterExpression;

  public PlaceholderSegment(String expression, PlaceholderStyle style) {
    this.expression = expression;
    this.style = style;
  }

  public String getExpression() {
    return expression;
  }

  public PlaceholderStyle getStyle() {
    return style;
  }

  /**
   * Parses the expression as an inline parameter ({@code id, jdbcType=INTEGER}). Parsed on first
   * call; the returned map is read-only.
   *
   * @throws org.mybatis.mapperast.builder.BuilderException if the expression is malformed
   */
  public Map<String, String> getParameterExpression() {
    Map<String, String> parsed = parameterExpression;
    if (parsed == null) {
      parsed = Collections.unmodifiableMap(new ParameterExpression(expression));
      parameterExpression = parsed;
    }
    return parsed;
  }

  /**
   * Returns the property the placeholder refers to, e.g. {@code author.name} for
   * {@code #{author.name, jdbcType=VARCHAR}}, or {@code null} for a parenthesised expression.
   */
  public String getProperty() {
    return getParameterExpression().get(ParameterExpression.PROPERTY);
  }

  @Override
  public boolean isPlaceholder() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PlaceholderSegment)) {
      return false;
    }
    PlaceholderSegment that = (PlaceholderSegment) o;
    return style == that.style && expression.equals(that.expression);
  }

  @Override
  public int hashCode() {
    return 31 * style.hashCode() + expression.hashCode();
  }

  @Override
  public String toString() {
    return style.getOpenToken() + expression + "}";
  }
}
