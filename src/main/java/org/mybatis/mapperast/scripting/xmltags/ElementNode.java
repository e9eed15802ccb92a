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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mybatis.mapperast.parsing.XmlAttribute;
import org.mybatis.mapperast.parsing.XmlEvent;

/**
 * Base class of the nodes built from an element: keeps the element attributes and the children.
 */
public abstract class ElementNode implements Node {

  private final Map<String, String> attributes;
  private final List<Node> children = new ArrayList<>();
  private final int line;

  protected ElementNode(XmlEvent startElement, int line) {
    this(toAttributeMap(startElement), line);
  }

  protected ElementNode(Map<String, String> attributes, int line) {
    this.attributes = Collections.unmodifiableMap(attributes);
    this.line = line;
  }

  private static Map<String, String> toAttributeMap(XmlEvent startElement) {
    Map<String, String> attributes = new LinkedHashMap<>();
    for (XmlAttribute attribute : startElement.getAttributes()) {
      attributes.put(attribute.getName(), attribute.getValue());
    }
    return attributes;
  }

  @Override
  public List<Node> getChildren() {
    return Collections.unmodifiableList(children);
  }

  @Override
  public Map<String, String> getAttributes() {
    return attributes;
  }

  @Override
  public String getAttribute(String name) {
    return attributes.get(name);
  }

  @Override
  public int getLine() {
    return line;
  }

  @Override
  public void addChild(Node child) {
    children.add(child);
  }

  @Override
  public String toString() {
    return getKind() + (attributes.isEmpty() ? "" : attributes.toString());
  }
}
