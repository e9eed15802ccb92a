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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mybatis.mapperast.builder.ScriptedEventSource.comment;
import static org.mybatis.mapperast.builder.ScriptedEventSource.end;
import static org.mybatis.mapperast.builder.ScriptedEventSource.start;
import static org.mybatis.mapperast.builder.ScriptedEventSource.text;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.mybatis.mapperast.parsing.ParsingException;
import org.mybatis.mapperast.parsing.ScanException;
import org.mybatis.mapperast.parsing.XmlEvent;
import org.mybatis.mapperast.parsing.XmlEventSource;
import org.mybatis.mapperast.scripting.xmltags.DataNode;
import org.mybatis.mapperast.scripting.xmltags.IfNode;
import org.mybatis.mapperast.scripting.xmltags.Node;
import org.mybatis.mapperast.scripting.xmltags.NodeKind;
import org.mybatis.mapperast.scripting.xmltags.RootNode;
import org.mybatis.mapperast.session.Configuration;

class MapperAstBuilderTest {

  private final Configuration configuration = new Configuration();

  @Test
  void nodeStackShouldStayOneLongerThanElementStack() {
    MapperAstBuilder builder = new MapperAstBuilder(ScriptedEventSource.of(
        start("mapper", "namespace", "m"),
        text("\n  "),
        start("select", "id", "s"),
        text("SELECT 1"),
        start("foo"),
        start("if", "test", "x"),
        text("ignored"),
        end("if"),
        end("foo"),
        comment(" c "),
        start("if", "test", "y"),
        text("AND y = #{y}"),
        end("if"),
        end("select"),
        end("mapper")), configuration);

    assertEquals(1, builder.nodeDepth());
    int steps = 0;
    while (builder.step()) {
      steps++;
      assertEquals(builder.elementDepth() + 1, builder.nodeDepth());
    }
    assertEquals(15, steps);
    assertEquals(0, builder.elementDepth());
    assertFalse(builder.step());

    Node select = builder.getRoot().getChildren().get(0).getChildren().get(0);
    assertEquals(2, select.getChildren().size());
    assertSame(NodeKind.DATA, select.getChildren().get(0).getKind());
    assertSame(NodeKind.IF, select.getChildren().get(1).getKind());
    assertEquals("y", select.getChildren().get(1).getAttribute("test"));
  }

  @Test
  void shouldFailOnTagMismatch() {
    MapperAstBuilder builder = new MapperAstBuilder(ScriptedEventSource.of(
        start("select"), text("SELECT 1"), end("update")), configuration);
    BuilderException e = assertThrows(BuilderException.class, builder::build);
    assertSame(ErrorKind.TAG_MISMATCH, e.getErrorKind());
    assertTrue(e.getMessage().contains("<select>"));
    assertTrue(e.getMessage().contains("</update>"));
  }

  @Test
  void shouldFailOnEndElementWithoutStartElement() {
    MapperAstBuilder builder = new MapperAstBuilder(ScriptedEventSource.of(
        start("mapper"), end("mapper"), end("mapper")), configuration);
    BuilderException e = assertThrows(BuilderException.class, builder::build);
    assertSame(ErrorKind.UNEXPECTED_END_ELEMENT, e.getErrorKind());
    assertTrue(e.getMessage().contains("</mapper>"));
    assertFalse(builder.step());
  }

  @Test
  void shouldNameInnermostUnterminatedElement() {
    MapperAstBuilder builder = new MapperAstBuilder(ScriptedEventSource.of(
        start("mapper"), start("select")), configuration);
    BuilderException e = assertThrows(BuilderException.class, builder::build);
    assertSame(ErrorKind.UNTERMINATED_ELEMENT, e.getErrorKind());
    assertTrue(e.getMessage().contains("<select>"));
  }

  @Test
  void shouldWrapEventSourceFailures() {
    ParsingException cause = new ParsingException("bad quoting");
    XmlEventSource failing = new XmlEventSource() {
      @Override
      public XmlEvent next() {
        throw cause;
      }

      @Override
      public void close() {
      }
    };
    BuilderException e = assertThrows(BuilderException.class, () -> new MapperAstBuilder(failing, configuration).build());
    assertSame(ErrorKind.MALFORMED_XML, e.getErrorKind());
    assertSame(cause, e.getCause());
  }

  @Test
  void shouldWrapScanFailuresWithTheirLine() {
    MapperAstBuilder builder = new MapperAstBuilder(ScriptedEventSource.of(
        start("select"), text("\nSELECT *\nFROM t\nWHERE id = #{id"), end("select")), configuration);
    BuilderException e = assertThrows(BuilderException.class, builder::build);
    assertSame(ErrorKind.DATA_SCAN_ERROR, e.getErrorKind());
    assertInstanceOf(ScanException.class, e.getCause());
    assertEquals(4, e.getLine());
    assertTrue(e.getMessage().contains("starting at line 2"));
  }

  @Test
  void shouldCountNewlinesInTextAndComments() {
    MapperAstBuilder builder = new MapperAstBuilder(ScriptedEventSource.of(
        start("mapper"),
        comment(" first\n second\n"),
        text("\n\n"),
        start("select", "id", "s"),
        text("\n  SELECT 1\n"),
        end("select"),
        end("mapper")), configuration);
    RootNode root = builder.build();

    Node select = root.getChildren().get(0).getChildren().get(0);
    assertEquals(5, select.getLine());
    assertEquals(6, select.getChildren().get(0).getLine());
    assertEquals(7, builder.currentLine());
  }

  @Test
  void shouldAppendDataToElementOnTopOfStack() {
    RootNode root = new MapperAstBuilder(ScriptedEventSource.of(
        start("if", "test", "a != null"),
        text("  a = #{a}  "),
        end("if")), configuration).build();

    IfNode ifNode = (IfNode) root.getChildren().get(0);
    assertEquals("a != null", ifNode.getTest());
    DataNode data = (DataNode) ifNode.getChildren().get(0);
    assertEquals("a = #{a}", data.getText());
    assertEquals(2, data.getSegments().size());
  }

  @Test
  void shouldPruneUnknownElementsAtAnyDepth() {
    RootNode root = new MapperAstBuilder(ScriptedEventSource.of(
        start("mapper"),
        start("resultMap", "id", "r"),
        start("select", "id", "hidden"),
        start("choose"),
        start("when", "test", "x"),
        text("SELECT 1"),
        end("when"),
        end("choose"),
        end("select"),
        end("resultMap"),
        start("delete", "id", "d"),
        text("DELETE FROM t"),
        end("delete"),
        end("mapper")), configuration).build();

    Node mapper = root.getChildren().get(0);
    assertEquals(1, mapper.getChildren().size());
    assertEquals(NodeKind.QUERY, mapper.getChildren().get(0).getKind());
    assertEquals("d", mapper.getChildren().get(0).getAttribute("id"));
  }

  @Test
  void shouldNotRecurseOnDeeplyNestedElements() {
    RootNode root = new MapperAstBuilder(ScriptedEventSource.nested("if", 200_000), configuration).build();

    int depth = 0;
    Node node = root;
    while (!node.getChildren().isEmpty()) {
      node = node.getChildren().get(0);
      depth++;
    }
    assertEquals(200_000, depth);
  }

  @Test
  void shouldEnforceMaximumNestingDepth() {
    configuration.setMaxNestingDepth(3);
    assertEquals(NodeKind.IF, new MapperAstBuilder(ScriptedEventSource.nested("if", 3), configuration).build()
        .getChildren().get(0).getKind());

    BuilderException e = assertThrows(BuilderException.class,
        () -> new MapperAstBuilder(ScriptedEventSource.nested("if", 4), configuration).build());
    assertSame(ErrorKind.NESTING_TOO_DEEP, e.getErrorKind());
  }

  @Test
  void shouldMentionResourceInErrors() {
    MapperAstBuilder builder = new MapperAstBuilder(ScriptedEventSource.of(end("mapper")), configuration,
        "mappers/AuthorMapper.xml");
    BuilderException e = assertThrows(BuilderException.class, builder::build);
    assertTrue(e.getMessage().contains("mappers/AuthorMapper.xml"));
    assertEquals(1, e.getLine());
  }

  @Test
  void shouldReturnEmptyRootForEmptyStream() {
    RootNode root = new MapperAstBuilder(ScriptedEventSource.of(), configuration).build();
    List<Node> children = root.getChildren();
    assertTrue(children.isEmpty());
    assertTrue(root.getAttributes().isEmpty());
  }

  @Test
  void shouldTreatUnicodeSpacesAsBlank() {
    RootNode root = new MapperAstBuilder(ScriptedEventSource.of(
        start("select", "id", "s"),
        text("\u00a0\u3000\n"),
        start("if", "test", "x"),
        text("\n\u3000 a = #{a}\u00a0\u2003"),
        end("if"),
        end("select")), configuration).build();

    Node select = root.getChildren().get(0);
    assertEquals(1, select.getChildren().size());
    DataNode data = (DataNode) select.getChildren().get(0).getChildren().get(0);
    assertEquals("a = #{a}", data.getText());
    assertEquals(3, data.getLine());
  }

}
