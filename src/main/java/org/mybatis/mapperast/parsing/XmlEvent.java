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
import java.util.List;

/**
 * One structural event of a streaming XML reader.
 *
 * <ul>
 *   <li>{@link XmlEventType#START_ELEMENT}: local name and attributes in document order</li>
 *   <li>{@link XmlEventType#END_ELEMENT}: local name</li>
 *   <li>{@link XmlEventType#CHARACTERS} and {@link XmlEventType#COMMENT}: raw text, untrimmed</li>
 * </ul>
 */
public final class XmlEvent {

  private final XmlEventType type;
  private final String name;
  private final List<XmlAttribute> attributes;
  private final String text;

  private XmlEvent(XmlEventType type, String name, List<XmlAttribute> attributes, String text) {
    this.type = type;
    this.name = name;
    this.attributes = attributes;
    this.text = text;
  }

  public static XmlEvent startElement(String name, List<XmlAttribute> attributes) {
    return new XmlEvent(XmlEventType.START_ELEMENT, name, Collections.unmodifiableList(attributes), null);
  }

  public static XmlEvent startElement(String name) {
    return startElement(name, Collections.<XmlAttribute>emptyList());
  }

  public static XmlEvent endElement(String name) {
    return new XmlEvent(XmlEventType.END_ELEMENT, name, Collections.<XmlAttribute>emptyList(), null);
  }

  public static XmlEvent characters(String text) {
    return new XmlEvent(XmlEventType.CHARACTERS, null, Collections.<XmlAttribute>emptyList(), text);
  }

  public static XmlEvent comment(String text) {
    return new XmlEvent(XmlEventType.COMMENT, null, Collections.<XmlAttribute>emptyList(), text);
  }

  public XmlEventType getType() {
    return type;
  }

  /**
   * Local name of the element, {@code null} for text and comment events.
   */
  public String getName() {
    return name;
  }

  public List<XmlAttribute> getAttributes() {
    return attributes;
  }

  /**
   * Raw text of a character-data or comment event, {@code null} for element events.
   */
  public String getText() {
    return text;
  }

  @Override
  public String toString() {
    switch (type) {
      case START_ELEMENT:
        StringBuilder sb = new StringBuilder("<").append(name);
        for (XmlAttribute attribute : attributes) {
          sb.append(' ').append(attribute);
        }
        return sb.append('>').toString();
      case END_ELEMENT:
        return "</" + name + ">";
      case COMMENT:
        return "<!--" + text + "-->";
      default:
        return text;
    }
  }
}
