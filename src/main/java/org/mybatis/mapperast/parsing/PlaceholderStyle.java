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

/**
 * How a placeholder's value reaches the SQL text.
 */
public enum PlaceholderStyle {

  /**
   * {@code #{...}}: bound as a prepared statement parameter.
   */
  BIND("#{"),

  /**
   * {@code ${...}}: pasted into the SQL text as is, without escaping.
   */
  SUBSTITUTION("${");

  private final String openToken;

  PlaceholderStyle(String openToken) {
    this.openToken = openToken;
  }

  public String getOpenToken() {
    return openToken;
  }

  public static PlaceholderStyle forMarker(char marker) {
    switch (marker) {
      case '#':
        return BIND;
      case '$':
        return SUBSTITUTION;
      default:
        return null;
    }
  }
}
