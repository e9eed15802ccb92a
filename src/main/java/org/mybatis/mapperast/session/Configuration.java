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
package org.mybatis.mapperast.session;

import org.mybatis.mapperast.builder.BuilderException;
import org.mybatis.mapperast.builder.ErrorKind;
import org.mybatis.mapperast.logging.Log;
import org.mybatis.mapperast.logging.LogFactory;

/**
 * Settings shared by the parsers created from it. Not modified while a document is parsed, so one
 * instance can serve parsers on several threads.
 *
 * @author Clinton Begin
 */
public class Configuration {

  protected Class<? extends Log> logImpl;
  protected int maxNestingDepth;

  public Class<? extends Log> getLogImpl() {
    return logImpl;
  }

  /**
   * Switches {@link LogFactory} to the given adapter. A {@code null} value keeps the current one.
   */
  public void setLogImpl(Class<? extends Log> logImpl) {
    if (logImpl != null) {
      this.logImpl = logImpl;
      LogFactory.useCustomLogging(this.logImpl);
    }
  }

  /**
   * Returns how many elements may be open at the same time, {@code 0} meaning no limit.
   */
  public int getMaxNestingDepth() {
    return maxNestingDepth;
  }

  public void setMaxNestingDepth(int maxNestingDepth) {
    if (maxNestingDepth < 0) {
      throw new BuilderException(ErrorKind.INVALID_SETTING,
          "maxNestingDepth must not be negative but was " + maxNestingDepth);
    }
    this.maxNestingDepth = maxNestingDepth;
  }

}
