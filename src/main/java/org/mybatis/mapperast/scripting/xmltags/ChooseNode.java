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
 * {@code <choose>}.
 *
 * <pre>
 * &lt;select id="findActiveBlogLike" resultType="Blog"&gt;
 *   SELECT * FROM BLOG WHERE state = 'ACTIVE'
 *   &lt;choose&gt;
 *     &lt;when test="title != null"&gt;
 *       AND title like #{title}
 *     &lt;/when&gt;
 *     &lt;otherwise&gt;
 *       AND featured = 1
 *     &lt;/otherwise&gt;
 *   &lt;/choose&gt;
 * &lt;/select&gt;
 * </pre>
 *
 * <p>Children are expected to be {@link WhenNode}s followed by at most one {@link OtherwiseNode},
 * but any kind is accepted. Consumers must cope with other children.
 *
 * @author Clinton Begin
 */
public class ChooseNode extends ElementNode {

  public ChooseNode(XmlEvent startElement, int line) {
    super(startElement, line);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.CHOOSE;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitChoose(this);
  }
}
