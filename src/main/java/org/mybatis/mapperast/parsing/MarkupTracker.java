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
 * Follows the raw characters of an XML document and knows whether the last one read left a
 * markup construct (tag, comment, CDATA section, processing instruction or declaration) open.
 *
 * <p>Only ASCII markup characters drive the state, so the tracker can be fed the bytes of any
 * ASCII-compatible encoding as well as decoded characters.
 */
class MarkupTracker {

  private static final String COMMENT_START = "!--";
  private static final String CDATA_START = "![CDATA[";

  private enum State {
    TEXT, OPEN, TAG, COMMENT, CDATA, PROCESSING_INSTRUCTION, DECLARATION
  }

  private State state = State.TEXT;
  private final StringBuilder lead = new StringBuilder();
  private char quote;
  private int run;
  private int subsetDepth;

  void update(int c) {
    switch (state) {
      case TEXT:
        if (c == '<') {
          state = State.OPEN;
          lead.setLength(0);
        }
        break;
      case OPEN:
        open((char) c);
        break;
      case TAG:
        tag(c);
        break;
      case COMMENT:
        closeAfterRun(c, '-');
        break;
      case CDATA:
        closeAfterRun(c, ']');
        break;
      case PROCESSING_INSTRUCTION:
        if (c == '>' && run > 0) {
          state = State.TEXT;
        }
        run = c == '?' ? 1 : 0;
        break;
      case DECLARATION:
        declaration(c);
        break;
      default:
        throw new IllegalStateException("Unknown markup state " + state);
    }
  }

  boolean isInMarkup() {
    return state != State.TEXT;
  }

  private void open(char c) {
    lead.append(c);
    String prefix = lead.toString();
    if ("?".equals(prefix)) {
      enter(State.PROCESSING_INSTRUCTION);
    } else if (COMMENT_START.equals(prefix)) {
      enter(State.COMMENT);
    } else if (CDATA_START.equals(prefix)) {
      enter(State.CDATA);
    } else if (prefix.charAt(0) == '!') {
      if (!COMMENT_START.startsWith(prefix) && !CDATA_START.startsWith(prefix)) {
        enter(State.DECLARATION);
        declaration(c);
      }
    } else {
      enter(State.TAG);
      tag(c);
    }
  }

  private void enter(State next) {
    state = next;
    quote = 0;
    run = 0;
    subsetDepth = 0;
  }

  private void tag(int c) {
    if (quote != 0) {
      if (c == quote) {
        quote = 0;
      }
    } else if (c == '"' || c == '\'') {
      quote = (char) c;
    } else if (c == '>') {
      state = State.TEXT;
    }
  }

  private void declaration(int c) {
    if (quote != 0) {
      if (c == quote) {
        quote = 0;
      }
    } else if (c == '"' || c == '\'') {
      quote = (char) c;
    } else if (c == '[') {
      subsetDepth++;
    } else if (c == ']') {
      subsetDepth--;
    } else if (c == '>' && subsetDepth <= 0) {
      state = State.TEXT;
    }
  }

  private void closeAfterRun(int c, char closer) {
    if (c == closer) {
      run++;
    } else {
      if (c == '>' && run >= 2) {
        state = State.TEXT;
      }
      run = 0;
    }
  }

}
