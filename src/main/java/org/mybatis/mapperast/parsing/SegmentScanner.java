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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits the text of a statement into literal SQL and {@code #{...}} / {@code ${...}}
 * placeholders in a single left-to-right pass.
 *
 * <p>Placeholders do not nest: the first closing brace after an opener closes it. Literal runs are
 * not checked in any way.
 *
 * @author Clinton Begin
 */
public final class SegmentScanner {

  private static final char CLOSE_TOKEN = '}';

  private SegmentScanner() {
    // Prevent Instantiation of Static Class
  }

  /**
   * Scans the text.
   *
   * @param text the text to split
   * @return the segments in text order; empty for empty text
   * @throws ScanException if a placeholder is not closed
   */
  public static List<Segment> scan(String text) {
    if (text == null || text.isEmpty()) {
      return Collections.emptyList();
    }
    final List<Segment> segments = new ArrayList<>();
    final int length = text.length();
    int literalStart = 0;
    int offset = 0;
    while (offset < length - 1) {
      PlaceholderStyle style = PlaceholderStyle.forMarker(text.charAt(offset));
      if (style == null || text.charAt(offset + 1) != '{') {
        offset++;
        continue;
      }
      if (offset > literalStart) {
        segments.add(new LiteralSegment(text.substring(literalStart, offset)));
      }
      int end = text.indexOf(CLOSE_TOKEN, offset + 2);
      if (end == -1) {
        throw new ScanException("Unterminated placeholder '" + style.getOpenToken() + "' at offset " + offset
            + " in: " + text, offset, style);
      }
      segments.add(new PlaceholderSegment(text.substring(offset + 2, end), style));
      offset = end + 1;
      literalStart = offset;
    }
    if (literalStart < length) {
      segments.add(new LiteralSegment(text.substring(literalStart)));
    }
    return segments;
  }

}
