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

import org.mybatis.mapperast.exceptions.MapperAstException;

/**
 * Thrown when a mapper document, a placeholder expression or a setting cannot be processed.
 *
 * @author Clinton Begin
 */
public class BuilderException extends MapperAstException {

  private static final long serialVersionUID = -3885164021020443281L;

  private final ErrorKind errorKind;
  private final int line;

  public BuilderException(ErrorKind errorKind, String message) {
    this(errorKind, message, 0, null);
  }

  public BuilderException(ErrorKind errorKind, String message, Throwable cause) {
    this(errorKind, message, 0, cause);
  }

  public BuilderException(ErrorKind errorKind, String message, int line, Throwable cause) {
    super(message, cause);
    this.errorKind = errorKind;
    this.line = line;
  }

  public ErrorKind getErrorKind() {
    return errorKind;
  }

  /**
   * Returns the 1-based line the failure was detected on, or {@code 0} when the failure is not
   * tied to a document position.
   */
  public int getLine() {
    return line;
  }

}
