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
package org.mybatis.mapperast.scripting;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mybatis.mapperast.logging.Log;
import org.mybatis.mapperast.logging.LogFactory;
import org.mybatis.mapperast.parsing.LiteralSegment;
import org.mybatis.mapperast.parsing.PlaceholderSegment;
import org.mybatis.mapperast.parsing.PlaceholderStyle;
import org.mybatis.mapperast.parsing.Segment;
import org.mybatis.mapperast.scripting.xmltags.ChooseNode;
import org.mybatis.mapperast.scripting.xmltags.DataNode;
import org.mybatis.mapperast.scripting.xmltags.EmptyNode;
import org.mybatis.mapperast.scripting.xmltags.IfNode;
import org.mybatis.mapperast.scripting.xmltags.MapperNode;
import org.mybatis.mapperast.scripting.xmltags.Node;
import org.mybatis.mapperast.scripting.xmltags.NodeKind;
import org.mybatis.mapperast.scripting.xmltags.NodeVisitor;
import org.mybatis.mapperast.scripting.xmltags.OtherwiseNode;
import org.mybatis.mapperast.scripting.xmltags.QueryNode;
import org.mybatis.mapperast.scripting.xmltags.RootNode;
import org.mybatis.mapperast.scripting.xmltags.WhenNode;

/**
 * Restores plain SQL text from a parsed tree, for tools that lint or analyse the statements.
 *
 * <ul>
 *   <li>literal text is kept as is;</li>
 *   <li>{@code #{...}} becomes a {@code ?} parameter marker;</li>
 *   <li>{@code ${...}} is replaced by its expression, the way the text would be substituted;</li>
 *   <li>{@code <if>}, {@code <when>} and {@code <otherwise>} contribute their content as if their
 *       condition held;</li>
 *   <li>{@code <choose>} contributes its first branch only.</li>
 * </ul>
 *
 * Fragments are joined with a single space. Like the builder, the restorer walks the tree with an
 * explicit stack.
 */
public class SqlRestorer {

  private static final Log log = LogFactory.getLog(SqlRestorer.class);

  /**
   * Restores the SQL text of a node and its descendants.
   */
  public String restore(Node node) {
    List<String> fragments = new ArrayList<>();
    Deque<Node> pending = new ArrayDeque<>();
    pending.push(node);
    FragmentVisitor visitor = new FragmentVisitor(fragments);
    while (!pending.isEmpty()) {
      List<Node> children = pending.pop().accept(visitor);
      // pushed in reverse so that the first child is visited first
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
      }
    }
    return String.join(" ", fragments);
  }

  /**
   * Restores every statement of a document, keyed by {@code namespace.id} (or {@code id} outside a
   * namespaced mapper), in document order. When two statements share a key the first one wins.
   */
  public Map<String, String> restoreStatements(RootNode root) {
    Map<String, String> statements = new LinkedHashMap<>();
    for (Node child : root.getChildren()) {
      if (child.getKind() == NodeKind.MAPPER) {
        String namespace = ((MapperNode) child).getNamespace();
        for (Node statement : child.getChildren()) {
          if (statement.getKind() == NodeKind.QUERY) {
            addStatement(statements, namespace, (QueryNode) statement);
          }
        }
      } else if (child.getKind() == NodeKind.QUERY) {
        addStatement(statements, null, (QueryNode) child);
      }
    }
    return statements;
  }

  private void addStatement(Map<String, String> statements, String namespace, QueryNode query) {
    String id = query.getId();
    String key = namespace == null || namespace.isEmpty() ? id : namespace + "." + id;
    if (statements.containsKey(key)) {
      log.warn("Statement '" + key + "' at line " + query.getLine() + " is declared twice; keeping the first one.");
      return;
    }
    statements.put(key, restore(query));
  }

  /**
   * Emits the text of a node and returns the children to continue with.
   */
  private static class FragmentVisitor implements NodeVisitor<List<Node>> {

    private final List<String> fragments;

    FragmentVisitor(List<String> fragments) {
      this.fragments = fragments;
    }

    @Override
    public List<Node> visitRoot(RootNode node) {
      return node.getChildren();
    }

    @Override
    public List<Node> visitMapper(MapperNode node) {
      return node.getChildren();
    }

    @Override
    public List<Node> visitQuery(QueryNode node) {
      return node.getChildren();
    }

    @Override
    public List<Node> visitIf(IfNode node) {
      return node.getChildren();
    }

    @Override
    public List<Node> visitChoose(ChooseNode node) {
      List<Node> branches = node.getChildren();
      return branches.isEmpty() ? branches : branches.subList(0, 1);
    }

    @Override
    public List<Node> visitWhen(WhenNode node) {
      return node.getChildren();
    }

    @Override
    public List<Node> visitOtherwise(OtherwiseNode node) {
      return node.getChildren();
    }

    @Override
    public List<Node> visitEmpty(EmptyNode node) {
      return node.getChildren();
    }

    @Override
    public List<Node> visitData(DataNode node) {
      StringBuilder sql = new StringBuilder();
      for (Segment segment : node.getSegments()) {
        if (segment.isPlaceholder()) {
          PlaceholderSegment placeholder = (PlaceholderSegment) segment;
          sql.append(placeholder.getStyle() == PlaceholderStyle.BIND ? "?" : placeholder.getExpression().trim());
        } else {
          sql.append(((LiteralSegment) segment).getText());
        }
      }
      if (sql.length() > 0) {
        fragments.add(sql.toString());
      }
      return node.getChildren();
    }
  }

}
