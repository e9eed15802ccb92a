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
package org.mybatis.mapperast.builder.xml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;

import org.mybatis.mapperast.builder.BuilderException;
import org.mybatis.mapperast.builder.ErrorKind;
import org.mybatis.mapperast.builder.MapperAstBuilder;
import org.mybatis.mapperast.logging.Log;
import org.mybatis.mapperast.logging.LogFactory;
import org.mybatis.mapperast.parsing.ParsingException;
import org.mybatis.mapperast.parsing.StaxXmlEventSource;
import org.mybatis.mapperast.parsing.XmlEventSource;
import org.mybatis.mapperast.scripting.xmltags.RootNode;
import org.mybatis.mapperast.session.Configuration;

/**
 * Parses one mapper XML document into a tree.
 *
 * <pre>
 * &lt;mapper namespace="org.apache.ibatis.domain.blog.mappers.AuthorMapper"&gt;
 *   &lt;select id="selectAuthor" parameterType="int" resultType="Author"&gt;
 *     select * from author where id = #{id}
 *   &lt;/select&gt;
 * &lt;/mapper&gt;
 * </pre>
 *
 * becomes {@code ROOT -> MAPPER{namespace=...} -> SELECT{id=selectAuthor, ...} -> DATA[...]}.
 *
 * <p>An instance parses its document once.
 *
 * @author Clinton Begin
 * @author Kazuki Shimizu
 */
public class XMLMapperBuilder {

  private static final Log log = LogFactory.getLog(XMLMapperBuilder.class);

  private final XmlEventSource source;
  private final Configuration configuration;
  private final String resource;
  private boolean parsed;

  public XMLMapperBuilder(String xml, Configuration configuration, String resource) {
    this(new StringReader(xml), configuration, resource);
  }

  public XMLMapperBuilder(Reader reader, Configuration configuration, String resource) {
    this(openSource(reader, resource), configuration, resource);
  }

  public XMLMapperBuilder(InputStream inputStream, Configuration configuration, String resource) {
    this(openSource(inputStream, resource), configuration, resource);
  }

  public XMLMapperBuilder(XmlEventSource source, Configuration configuration, String resource) {
    this.source = source;
    this.configuration = configuration;
    this.resource = resource;
  }

  /**
   * Parses a document held in memory with the default settings.
   *
   * @param xml the mapper document
   * @return the root of the tree
   * @throws BuilderException if the document cannot be parsed
   */
  public static RootNode parse(String xml) {
    return new XMLMapperBuilder(xml, new Configuration(), null).parse();
  }

  /**
   * Parses the document and closes the underlying input.
   *
   * @return the root of the tree
   * @throws BuilderException if the document cannot be parsed
   */
  public RootNode parse() {
    if (parsed) {
      throw new IllegalStateException("Each XMLMapperBuilder can only be used once.");
    }
    parsed = true;
    try {
      return new MapperAstBuilder(source, configuration, resource).build();
    } finally {
      closeSource();
    }
  }

  private void closeSource() {
    try {
      source.close();
    } catch (IOException e) {
      log.warn("Error closing mapper XML" + (resource == null ? "" : " '" + resource + "'") + ". Cause: " + e);
    }
  }

  private static XmlEventSource openSource(Reader reader, String resource) {
    try {
      return new StaxXmlEventSource(reader);
    } catch (ParsingException e) {
      throw malformed(e, resource);
    }
  }

  private static XmlEventSource openSource(InputStream inputStream, String resource) {
    try {
      return new StaxXmlEventSource(inputStream);
    } catch (ParsingException e) {
      throw malformed(e, resource);
    }
  }

  private static BuilderException malformed(ParsingException e, String resource) {
    return new BuilderException(ErrorKind.MALFORMED_XML, "Error opening mapper XML"
        + (resource == null ? "" : " '" + resource + "'") + ". Cause: " + e.getMessage(), 1, e);
  }

}
