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

import java.util.List;
import java.util.Map;

/**
 * A node of a parsed mapper document (in the composite pattern: the component role).
 *
 * <p>Children are kept in document order and are never reordered or removed once appended; SQL
 * fragments are concatenated in that order.
 *
 * @see RootNode      the synthetic top of every tree
 * @see MapperNode    {@code <mapper>}
 * @see QueryNode     {@code <select>}, {@code <insert>}, {@code <update>}, {@code <delete>}
 * @see IfNode        {@code <if>}
 * @see ChooseNode    {@code <choose>}
 * @see WhenNode      {@code <when>}
 * @see OtherwiseNode {@code <otherwise>}
 * @see EmptyNode     any other element, never part of a finished tree
 * @see DataNode      text between tags
 * @author Clinton Begin
 */
public interface Node {

  NodeKind getKind();

  /**
   * Returns the children in document order. The list cannot be modified.
   */
  List<Node> getChildren();

  /**
   * Returns the element attributes in document order. The map cannot be modified.
   */
  Map<String, String> getAttributes();

  String getAttribute(String name);

  /**
   * Returns the 1-based line the node starts on.
   */
  int getLine();

  /**
   * Appends a child after the existing ones.
   */
  void addChild(Node child);

  <R> R accept(NodeVisitor<R> visitor);

}
