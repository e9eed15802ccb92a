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
package org.mybatis.mapperast.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mybatis.mapperast.logging.jdk14.Jdk14LoggingImpl;
import org.mybatis.mapperast.logging.nologging.NoLoggingImpl;
import org.mybatis.mapperast.logging.slf4j.Slf4jImpl;
import org.mybatis.mapperast.logging.stdout.StdOutImpl;

class LogFactoryTest {

  @AfterEach
  void restoreDefault() {
    LogFactory.useSlf4jLogging();
  }

  @Test
  void shouldPreferSlf4jWhenOnTheClasspath() {
    LogFactory.useSlf4jLogging();
    assertEquals(Slf4jImpl.class, LogFactory.getImplementation());
    logSomething(LogFactory.getLog(Object.class));
  }

  @Test
  void shouldUseJdkLogging() {
    LogFactory.useJdkLogging();
    Log log = LogFactory.getLog(Object.class);
    assertEquals(Jdk14LoggingImpl.class, log.getClass());
    logSomething(log);
  }

  @Test
  void shouldUseStdOutLogging() {
    LogFactory.useStdOutLogging();
    Log log = LogFactory.getLog(Object.class);
    assertTrue(log instanceof StdOutImpl);
    assertTrue(log.isDebugEnabled());
    logSomething(log);
  }

  @Test
  void shouldUseNoLogging() {
    LogFactory.useNoLogging();
    Log log = LogFactory.getLog(Object.class);
    assertTrue(log instanceof NoLoggingImpl);
    assertFalse(log.isTraceEnabled());
    logSomething(log);
  }

  @Test
  void shouldRejectAdapterWithoutNameConstructor() {
    assertThrows(LogException.class, () -> LogFactory.useCustomLogging(BrokenLog.class));
  }

  private void logSomething(Log log) {
    log.warn("Warning message.");
    log.debug("Debug message.");
    log.error("Error message.");
    log.error("Error with Exception.", new Exception("Test exception."));
  }

  public static class BrokenLog extends NoLoggingImpl {
    public BrokenLog() {
      super("broken");
    }
  }

}
