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
package org.mybatis.mapperast.mapping;

/**
 * The statement kinds a mapper can declare.
 *
 * @author Clinton Begin
 */
public enum SqlCommandType {
  SELECT, INSERT, UPDATE, DELETE;

  /**
   * Resolves the command type declared by a statement element name.
   *
   * @param elementName local name of the statement element
   * @return the command type, or {@code null} when the name declares no statement
   */
  public static SqlCommandType forElementName(String elementName) {
    for (SqlCommandType type : values()) {
      if (type.name().equalsIgnoreCase(elementName)) {
        return type;
      }
    }
    return null;
  }
}
