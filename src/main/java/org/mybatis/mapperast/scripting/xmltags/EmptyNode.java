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

import org.mybatis.mapperast.parsing.XmlEvent;

/**
 * Stands in for an element that is not part of the dynamic SQL vocabulary ({@code <resultMap>},
 * {@code <sql>}, {@code <foreach>}, ...). It keeps the builder's stacks balanced while the element
 * is open, drops whatever is appended to it, and is itself dropped when the element closes.
 */
public class EmptyNode extends ElementNode {

  private final String elementName;

  public EmptyNode(XmlEvent startElement, int line) {
    super(Collections.<String, String>emptyMap(), line);
    this.elementName = startElement.getName();
  }

  public String getElementName() {
    return elementName;
  }

  @Override
  public void addChild(Node child) {
    // pruned
  }

  @Override
  public List<Node> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.EMPTY;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitEmpty(this);
  }

  @Override
  public String toString() {
    return "EMPTY<" + elementName + ">";
  }
}
