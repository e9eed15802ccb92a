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

/**
 * Why a mapper document could not be turned into a tree.
 */
public enum ErrorKind {
  /** The XML reader could not produce a well-formed event stream. */
  MALFORMED_XML,
  /** An end tag appeared while no element was open. */
  UNEXPECTED_END_ELEMENT,
  /** An end tag does not close the innermost open element. */
  TAG_MISMATCH,
  /** The input ended while elements were still open. */
  UNTERMINATED_ELEMENT,
  /** A text segment could not be split into literals and placeholders. */
  DATA_SCAN_ERROR,
  /** Elements are nested deeper than the configured limit. */
  NESTING_TOO_DEEP,
  /** A placeholder's inline parameter expression is malformed. */
  MALFORMED_PARAMETER,
  /** A configuration setting is unknown or carries a bad value. */
  INVALID_SETTING
}
