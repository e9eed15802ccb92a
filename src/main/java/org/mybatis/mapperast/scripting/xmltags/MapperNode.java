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

import org.mybatis.mapperast.parsing.XmlEvent;

/**
 * {@code <mapper namespace="...">}.
 */
public class MapperNode extends ElementNode {

  public MapperNode(XmlEvent startElement, int line) {
    super(startElement, line);
  }

  public String getNamespace() {
    return getAttribute("namespace");
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.MAPPER;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitMapper(this);
  }
}
