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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class StaxXmlEventSourceTest {

  private static List<XmlEvent> readAll(XmlEventSource source) throws IOException {
    List<XmlEvent> events = new ArrayList<>();
    try (XmlEventSource s = source) {
      XmlEvent event;
      while ((event = s.next()) != null) {
        events.add(event);
      }
    }
    return events;
  }

  private static List<XmlEvent> elementEvents(List<XmlEvent> events) {
    List<XmlEvent> elements = new ArrayList<>();
    for (XmlEvent event : events) {
      if (event.getType() == XmlEventType.START_ELEMENT || event.getType() == XmlEventType.END_ELEMENT) {
        elements.add(event);
      }
    }
    return elements;
  }

  @Test
  void shouldReportElementsTextAndComments() throws IOException {
    List<XmlEvent> events = readAll(new StaxXmlEventSource(new StringReader(
        "<mapper namespace=\"m\"><!-- a\nb --><select id=\"s\" resultType=\"int\">SELECT 1</select></mapper>")));

    assertEquals(6, events.size());
    assertEquals(XmlEventType.START_ELEMENT, events.get(0).getType());
    assertEquals("mapper", events.get(0).getName());
    assertEquals("namespace", events.get(0).getAttributes().get(0).getName());
    assertEquals("m", events.get(0).getAttributes().get(0).getValue());
    assertEquals(XmlEventType.COMMENT, events.get(1).getType());
    assertEquals(" a\nb ", events.get(1).getText());
    assertEquals("<select id=\"s\" resultType=\"int\">", events.get(2).toString());
    assertEquals(XmlEventType.CHARACTERS, events.get(3).getType());
    assertEquals("SELECT 1", events.get(3).getText());
    assertEquals("</select>", events.get(4).toString());
    assertEquals("</mapper>", events.get(5).toString());
  }

  @Test
  void shouldCoalesceCdataWithSurroundingText() throws IOException {
    List<XmlEvent> events = readAll(new StaxXmlEventSource(new StringReader(
        "<select>SELECT * FROM t WHERE a <![CDATA[ < ]]> #{a} AND b &gt; 1</select>")));

    assertEquals(3, events.size());
    assertEquals("SELECT * FROM t WHERE a  <  #{a} AND b > 1", events.get(1).getText());
  }

  @Test
  void shouldSkipDoctypeWithoutLoadingTheDtd() throws IOException {
    String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\" ?>\n"
        + "<!DOCTYPE mapper PUBLIC \"-//mybatis.org//DTD Mapper 3.0//EN\" "
        + "\"http://localhost:1/unreachable/mybatis-3-mapper.dtd\">\n"
        + "<mapper namespace=\"m\"/>";
    List<XmlEvent> events = elementEvents(readAll(new StaxXmlEventSource(
        new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)))));

    assertEquals(2, events.size());
    assertEquals("<mapper namespace=\"m\">", events.get(0).toString());
    assertEquals("</mapper>", events.get(1).toString());
  }

  @Test
  void shouldEndStreamWhenInputStopsWithElementsOpen() throws IOException {
    XmlEventSource source = new StaxXmlEventSource(new StringReader("<mapper><select>"));
    assertEquals("mapper", source.next().getName());
    assertEquals("select", source.next().getName());
    assertNull(source.next());
    assertNull(source.next());
    source.close();
  }

  @Test
  void shouldFailWhenInputStopsInsideStartTag() {
    XmlEventSource source = new StaxXmlEventSource(new StringReader("<mapper><select id=\"s"));
    assertEquals("mapper", source.next().getName());
    assertThrows(ParsingException.class, source::next);
  }

  @Test
  void shouldFailWhenInputStopsAfterRootElement() {
    XmlEventSource source = new StaxXmlEventSource(new ByteArrayInputStream(
        "<mapper/><!-- trailing".getBytes(StandardCharsets.UTF_8)));
    assertEquals("<mapper>", source.next().toString());
    assertEquals("</mapper>", source.next().toString());
    assertThrows(ParsingException.class, source::next);
  }

  @Test
  void shouldFailOnMismatchedCloseTag() {
    XmlEventSource source = new StaxXmlEventSource(new StringReader("<select>SELECT 1</update>"));
    assertEquals("select", source.next().getName());
    ParsingException e = assertThrows(ParsingException.class, () -> {
      XmlEvent event;
      do {
        event = source.next();
      } while (event != null);
    });
    assertTrue(e.getMessage().contains("update"));
  }

  @Test
  void shouldFailOnUnquotedAttribute() {
    XmlEventSource source = new StaxXmlEventSource(new StringReader("<mapper namespace=m></mapper>"));
    assertThrows(ParsingException.class, source::next);
  }

}
