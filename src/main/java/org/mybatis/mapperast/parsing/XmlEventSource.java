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

import java.io.Closeable;

/**
 * A forward-only stream of XML events. Each event is read exactly once; there is no way back.
 */
public interface XmlEventSource extends Closeable {

  /**
   * Reads the next structural event.
   *
   * @return the next event, or {@code null} once the input is exhausted
   * @throws ParsingException if the input is not well-formed XML
   */
  XmlEvent next();

}
