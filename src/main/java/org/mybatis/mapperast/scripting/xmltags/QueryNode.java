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

import org.mybatis.mapperast.mapping.SqlCommandType;
import org.mybatis.mapperast.parsing.XmlEvent;

/**
 * A mapped statement: {@code <select>}, {@code <insert>}, {@code <update>} or {@code <delete>}.
 *
 * <pre>
 * &lt;select id="selectAuthor" parameterType="int" resultType="Author"&gt;
 *   select * from author where id = #{id}
 * &lt;/select&gt;
 * </pre>
 */
public class QueryNode extends ElementNode {

  private final SqlCommandType sqlCommandType;

  public QueryNode(XmlEvent startElement, int line) {
    super(startElement, line);
    this.sqlCommandType = SqlCommandType.forElementName(startElement.getName());
  }

  public SqlCommandType getSqlCommandType() {
    return sqlCommandType;
  }

  public String getId() {
    return getAttribute("id");
  }

  public String getParameterType() {
    return getAttribute("parameterType");
  }

  public String getResultType() {
    return getAttribute("resultType");
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.QUERY;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitQuery(this);
  }

  @Override
  public String toString() {
    return sqlCommandType + getAttributes().toString();
  }
}
