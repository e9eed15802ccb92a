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

import java.io.FilterInputStream;
import java.io.FilterReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;

import com.ctc.wstx.api.WstxInputProperties;
import com.ctc.wstx.exc.WstxEOFException;
import com.ctc.wstx.stax.WstxInputFactory;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.mybatis.mapperast.logging.Log;
import org.mybatis.mapperast.logging.LogFactory;

/**
 * {@link XmlEventSource} backed by a Woodstox stream reader.
 *
 * <p>The reader never loads DTDs or external entities, so the usual mapper
 * {@code <!DOCTYPE mapper PUBLIC ... "http://mybatis.org/dtd/mybatis-3-mapper.dtd">} is skipped
 * without touching the network. Adjacent text and CDATA sections are coalesced into one
 * character-data event, and whitespace outside the root element is reported too, so that line
 * counting sees every newline between tags. DTDs and processing instructions produce no event.
 *
 * <p>Input that ends between tokens while elements are still open is reported as the end of the
 * stream, so whoever consumes the events can name the unterminated element. Input that ends
 * inside markup, or after the root element was closed, raises {@link ParsingException}.
 */
public class StaxXmlEventSource implements XmlEventSource {

  private static final Log log = LogFactory.getLog(StaxXmlEventSource.class);

  private final MarkupTracker tracker = new MarkupTracker();
  private final XMLStreamReader2 reader;
  private boolean exhausted;
  private boolean rootSeen;
  private int depth;

  public StaxXmlEventSource(Reader reader) {
    try {
      this.reader = (XMLStreamReader2) createInputFactory()
          .createXMLStreamReader(new TrackingReader(reader, tracker));
    } catch (XMLStreamException e) {
      throw new ParsingException("Error creating XML reader. Cause: " + e, e);
    }
  }

  public StaxXmlEventSource(InputStream inputStream) {
    try {
      this.reader = (XMLStreamReader2) createInputFactory()
          .createXMLStreamReader(new TrackingInputStream(inputStream, tracker));
    } catch (XMLStreamException e) {
      throw new ParsingException("Error creating XML reader. Cause: " + e, e);
    }
  }

  private static XMLInputFactory2 createInputFactory() {
    XMLInputFactory2 factory = new WstxInputFactory();
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
    factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    factory.setProperty(XMLInputFactory2.P_REPORT_PROLOG_WHITESPACE, Boolean.TRUE);
    factory.setProperty(XMLInputFactory2.P_LAZY_PARSING, Boolean.FALSE);
    // nesting depth is policed by the tree builder
    factory.setProperty(WstxInputProperties.P_MAX_ELEMENT_DEPTH, Integer.MAX_VALUE);
    return factory;
  }

  @Override
  public XmlEvent next() {
    if (exhausted) {
      return null;
    }
    try {
      while (reader.hasNext()) {
        switch (reader.next()) {
          case XMLStreamConstants.START_ELEMENT:
            rootSeen = true;
            depth++;
            return XmlEvent.startElement(reader.getLocalName(), readAttributes());
          case XMLStreamConstants.END_ELEMENT:
            depth--;
            return XmlEvent.endElement(reader.getLocalName());
          case XMLStreamConstants.CHARACTERS:
          case XMLStreamConstants.CDATA:
          case XMLStreamConstants.SPACE:
            return XmlEvent.characters(reader.getText());
          case XMLStreamConstants.COMMENT:
            return XmlEvent.comment(reader.getText());
          case XMLStreamConstants.ENTITY_REFERENCE:
            throw new ParsingException("Undeclared entity '&" + reader.getLocalName() + ";' at "
                + reader.getLocation().getLineNumber() + ":" + reader.getLocation().getColumnNumber());
          default:
            // document boundaries, DTD, processing instructions
            break;
        }
      }
    } catch (WstxEOFException e) {
      if (tracker.isInMarkup() || (depth == 0 && rootSeen)) {
        throw new ParsingException("Unexpected end of XML input. Cause: " + e, e);
      }
      if (log.isDebugEnabled()) {
        log.debug("XML input ended with " + depth + " open element(s): " + e.getMessage());
      }
    } catch (XMLStreamException e) {
      throw new ParsingException("Error reading XML. Cause: " + e, e);
    }
    exhausted = true;
    return null;
  }

  private List<XmlAttribute> readAttributes() {
    int count = reader.getAttributeCount();
    List<XmlAttribute> attributes = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      attributes.add(new XmlAttribute(reader.getAttributeLocalName(i), reader.getAttributeValue(i)));
    }
    return attributes;
  }

  @Override
  public void close() throws IOException {
    try {
      reader.closeCompletely();
    } catch (XMLStreamException e) {
      throw new IOException("Error closing XML reader. Cause: " + e, e);
    }
  }

  private static class TrackingReader extends FilterReader {

    private final MarkupTracker tracker;

    TrackingReader(Reader in, MarkupTracker tracker) {
      super(in);
      this.tracker = tracker;
    }

    @Override
    public int read() throws IOException {
      int c = super.read();
      if (c >= 0) {
        tracker.update(c);
      }
      return c;
    }

    @Override
    public int read(char[] cbuf, int off, int len) throws IOException {
      int n = super.read(cbuf, off, len);
      for (int i = 0; i < n; i++) {
        tracker.update(cbuf[off + i]);
      }
      return n;
    }

  }

  /**
   * Feeds raw bytes to the tracker. NUL bytes are ignored so that the ASCII markup of UTF-16
   * input still reaches it.
   */
  private static class TrackingInputStream extends FilterInputStream {

    private final MarkupTracker tracker;

    TrackingInputStream(InputStream in, MarkupTracker tracker) {
      super(in);
      this.tracker = tracker;
    }

    @Override
    public int read() throws IOException {
      int b = super.read();
      if (b > 0) {
        tracker.update(b);
      }
      return b;
    }

    @Override
    public int read(byte[] buffer, int off, int len) throws IOException {
      int n = super.read(buffer, off, len);
      for (int i = 0; i < n; i++) {
        int b = buffer[off + i] & 0xFF;
        if (b != 0) {
          tracker.update(b);
        }
      }
      return n;
    }

    @Override
    public boolean markSupported() {
      return false;
    }

  }

}
