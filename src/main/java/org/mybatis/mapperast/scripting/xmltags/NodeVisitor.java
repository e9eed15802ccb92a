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

/**
 * Double dispatch over {@link NodeKind}. Adding a node kind adds a method here, so every visitor
 * has to decide what to do with it.
 *
 * @param <R> the result type
 */
public interface NodeVisitor<R> {

  R visitRoot(RootNode node);

  R visitMapper(MapperNode node);

  R visitQuery(QueryNode node);

  R visitIf(IfNode node);

  R visitChoose(ChooseNode node);

  R visitWhen(WhenNode node);

  R visitOtherwise(OtherwiseNode node);

  R visitEmpty(EmptyNode node);

  R visitData(DataNode node);

}
