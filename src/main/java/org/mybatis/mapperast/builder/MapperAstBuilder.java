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
package org.mybatis.mapperast.builder;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import org.mybatis.mapperast.logging.Log;
import org.mybatis.mapperast.logging.LogFactory;
import org.mybatis.mapperast.parsing.ParsingException;
import org.mybatis.mapperast.parsing.ScanException;
import org.mybatis.mapperast.parsing.XmlEvent;
import org.mybatis.mapperast.parsing.XmlEventSource;
import org.mybatis.mapperast.scripting.xmltags.ChooseNode;
import org.mybatis.mapperast.scripting.xmltags.DataNode;
import org.mybatis.mapperast.scripting.xmltags.EmptyNode;
import org.mybatis.mapperast.scripting.xmltags.IfNode;
import org.mybatis.mapperast.scripting.xmltags.MapperNode;
import org.mybatis.mapperast.scripting.xmltags.Node;
import org.mybatis.mapperast.scripting.xmltags.NodeKind;
import org.mybatis.mapperast.scripting.xmltags.OtherwiseNode;
import org.mybatis.mapperast.scripting.xmltags.QueryNode;
import org.mybatis.mapperast.scripting.xmltags.RootNode;
import org.mybatis.mapperast.scripting.xmltags.WhenNode;
import org.mybatis.mapperast.session.Configuration;

/**
 * Builds the tree of a mapper document from its XML events without recursion.
 *
 * <p>Two stacks stand in for the call stack of a recursive descent parser: the start-element
 * events of the open elements, and the nodes being built for them on top of the root node. The
 * node stack is always exactly one longer than the element stack. Each call to {@link #step()}
 * consumes one event:
 *
 * <ul>
 *   <li>start element: a node is created for it and both stacks grow;</li>
 *   <li>end element: both stacks shrink and the finished node is appended to its parent, unless
 *       it is an {@link EmptyNode};</li>
 *   <li>character data: newlines are counted, then the trimmed text (if any is left) becomes a
 *       {@link DataNode} of the node on top of the stack;</li>
 *   <li>comment: newlines are counted.</li>
 * </ul>
 *
 * <p>A builder reads its event source once and is not thread-safe.
 */
public class MapperAstBuilder {

  private static final Log log = LogFactory.getLog(MapperAstBuilder.class);

  private final XmlEventSource source;
  private final Configuration configuration;
  private final String resource;
  private final Map<String, NodeHandler> nodeHandlerMap = new HashMap<>();

  private final Deque<XmlEvent> elementStack = new ArrayDeque<>();
  private final Deque<Node> nodeStack = new ArrayDeque<>();
  private final RootNode root = new RootNode();

  // newline characters seen so far in character data and comments
  private int newlines;
  private int statementCount;
  private boolean finished;

  public MapperAstBuilder(XmlEventSource source, Configuration configuration) {
    this(source, configuration, null);
  }

  public MapperAstBuilder(XmlEventSource source, Configuration configuration, String resource) {
    this.source = source;
    this.configuration = configuration;
    this.resource = resource;
    this.nodeStack.push(root);
    initNodeHandlerMap();
  }

  private void initNodeHandlerMap() {
    nodeHandlerMap.put("mapper", MapperNode::new);
    nodeHandlerMap.put("select", QueryNode::new);
    nodeHandlerMap.put("insert", QueryNode::new);
    nodeHandlerMap.put("update", QueryNode::new);
    nodeHandlerMap.put("delete", QueryNode::new);
    nodeHandlerMap.put("if", IfNode::new);
    nodeHandlerMap.put("choose", ChooseNode::new);
    nodeHandlerMap.put("when", WhenNode::new);
    nodeHandlerMap.put("otherwise", OtherwiseNode::new);
  }

  /**
   * Consumes the whole event stream.
   *
   * @return the root of the tree
   * @throws BuilderException if the document is not well-formed or a placeholder is not closed
   */
  public RootNode build() {
    while (step()) {
      // one event per step
    }
    return root;
  }

  /**
   * Consumes a single event.
   *
   * @return {@code false} once the input is exhausted and the tree is complete
   * @throws BuilderException if the event cannot be applied; the builder is finished afterwards
   */
  public boolean step() {
    if (finished) {
      return false;
    }
    try {
      XmlEvent event = nextEvent();
      if (event == null) {
        endOfInput();
        finished = true;
        return false;
      }
      if (log.isTraceEnabled()) {
        log.trace("line " + currentLine() + ", depth " + elementStack.size() + ": " + event);
      }
      switch (event.getType()) {
        case START_ELEMENT:
          startElement(event);
          break;
        case END_ELEMENT:
          endElement(event);
          break;
        case CHARACTERS:
          characters(event.getText());
          break;
        case COMMENT:
          countNewlines(event.getText());
          break;
        default:
          break;
      }
      return true;
    } catch (BuilderException e) {
      finished = true;
      throw e;
    }
  }

  public RootNode getRoot() {
    return root;
  }

  /**
   * Returns the 1-based line the builder has reached.
   */
  public int currentLine() {
    return newlines + 1;
  }

  int elementDepth() {
    return elementStack.size();
  }

  int nodeDepth() {
    return nodeStack.size();
  }

  private XmlEvent nextEvent() {
    try {
      return source.next();
    } catch (ParsingException e) {
      throw error(ErrorKind.MALFORMED_XML, "Malformed XML: " + e.getMessage(), e);
    }
  }

  private void startElement(XmlEvent event) {
    int maxNestingDepth = configuration.getMaxNestingDepth();
    if (maxNestingDepth > 0 && elementStack.size() >= maxNestingDepth) {
      throw error(ErrorKind.NESTING_TOO_DEEP, "Element <" + event.getName() + "> exceeds the maximum nesting depth of "
          + maxNestingDepth, null);
    }
    NodeHandler handler = nodeHandlerMap.get(event.getName());
    Node node;
    if (handler == null) {
      node = new EmptyNode(event, currentLine());
    } else {
      node = handler.handleNode(event, currentLine());
    }
    elementStack.push(event);
    nodeStack.push(node);
  }

  private void endElement(XmlEvent event) {
    if (elementStack.isEmpty()) {
      throw error(ErrorKind.UNEXPECTED_END_ELEMENT, "Unexpected end element </" + event.getName() + ">", null);
    }
    String expected = elementStack.peek().getName();
    if (!expected.equals(event.getName())) {
      throw error(ErrorKind.TAG_MISMATCH, "Expected to read the end element of <" + expected + ">, but got </"
          + event.getName() + ">", null);
    }
    elementStack.pop();
    Node node = nodeStack.pop();
    if (node.getKind() == NodeKind.EMPTY) {
      if (log.isTraceEnabled()) {
        log.trace("Pruned element <" + event.getName() + "> opened at line " + node.getLine());
      }
      return;
    }
    nodeStack.peek().addChild(node);
    if (node.getKind() == NodeKind.QUERY) {
      statementCount++;
    }
  }

  private void characters(String text) {
    int line = currentLine();
    int leading = 0;
    while (leading < text.length() && isSpace(text.charAt(leading))) {
      if (text.charAt(leading) == '\n') {
        line++;
      }
      leading++;
    }
    countNewlines(text);
    if (leading == text.length()) {
      return;
    }
    int trailing = text.length();
    while (isSpace(text.charAt(trailing - 1))) {
      trailing--;
    }
    String trimmed = text.substring(leading, trailing);
    DataNode dataNode = new DataNode(trimmed, line);
    try {
      dataNode.scan();
    } catch (ScanException e) {
      throw error(ErrorKind.DATA_SCAN_ERROR, "Cannot parse data node starting at line " + line + ": "
          + e.getMessage(), e);
    }
    nodeStack.peek().addChild(dataNode);
  }

  /**
   * Unicode white space, no-break spaces included.
   */
  private static boolean isSpace(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
  }

  private void countNewlines(String text) {
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        newlines++;
      }
    }
  }

  private void endOfInput() {
    if (!elementStack.isEmpty()) {
      throw error(ErrorKind.UNTERMINATED_ELEMENT, "Expected to read the end element of <"
          + elementStack.peek().getName() + ">, but reached the end of the input", null);
    }
    if (log.isDebugEnabled()) {
      log.debug("Parsed " + statementCount + " statement(s) over " + currentLine() + " line(s)"
          + (resource == null ? "" : " from '" + resource + "'"));
    }
  }

  private BuilderException error(ErrorKind kind, String message, Throwable cause) {
    int line = currentLine();
    StringBuilder sb = new StringBuilder(message).append(" (line ").append(line);
    if (resource != null) {
      sb.append(", resource '").append(resource).append('\'');
    }
    sb.append(')');
    return new BuilderException(kind, sb.toString(), line, cause);
  }

  /**
   * Creates the node of a start element.
   */
  @FunctionalInterface
  private interface NodeHandler {
    Node handleNode(XmlEvent startElement, int line);
  }

}
