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
package org.mybatis.mapperast.scripting.xmltags;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.mybatis.mapperast.parsing.Segment;
import org.mybatis.mapperast.parsing.SegmentScanner;

/**
 * Text between tags, trimmed. A leaf: the content is described by its segments instead of
 * children.
 *
 * @author Clinton Begin
 */
public class DataNode implements Node {

  private final String text;
  private final int line;
  private List<Segment> segments = Collections.emptyList();

  public DataNode(String text, int line) {
    this.text = text;
    this.line = line;
  }

  /**
   * Splits the text into literal and placeholder segments.
   *
   * @return the segments, also available from {@link #getSegments()} afterwards
   * @throws org.mybatis.mapperast.parsing.ScanException if a placeholder is not closed
   */
  public List<Segment> scan() {
    segments = Collections.unmodifiableList(SegmentScanner.scan(text));
    return segments;
  }

  public String getText() {
    return text;
  }

  /**
   * Returns the segments found by {@link #scan()}; empty before that.
   */
  public List<Segment> getSegments() {
    return segments;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DATA;
  }

  @Override
  public List<Node> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public Map<String, String> getAttributes() {
    return Collections.emptyMap();
  }

  @Override
  public String getAttribute(String name) {
    return null;
  }

  @Override
  public int getLine() {
    return line;
  }

  @Override
  public void addChild(Node child) {
    throw new UnsupportedOperationException("A data node cannot have children.");
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitData(this);
  }

  @Override
  public String toString() {
    return "DATA" + segments;
  }
}
