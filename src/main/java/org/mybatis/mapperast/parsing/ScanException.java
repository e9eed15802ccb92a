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

import org.mybatis.mapperast.exceptions.MapperAstException;

/**
 * Thrown when a placeholder opener has no closing brace.
 */
public class ScanException extends MapperAstException {

  private static final long serialVersionUID = 6517367417380286104L;

  private final int offset;
  private final PlaceholderStyle style;

  public ScanException(String message, int offset, PlaceholderStyle style) {
    super(message);
    this.offset = offset;
    this.style = style;
  }

  /**
   * Offset of the unterminated opener within the scanned text.
   */
  public int getOffset() {
    return offset;
  }

  public PlaceholderStyle getStyle() {
    return style;
  }

}
