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

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.mybatis.mapperast.io.Resources;
import org.mybatis.mapperast.logging.Log;
import org.mybatis.mapperast.logging.commons.JakartaCommonsLoggingImpl;
import org.mybatis.mapperast.logging.jdk14.Jdk14LoggingImpl;
import org.mybatis.mapperast.logging.log4j2.Log4j2Impl;
import org.mybatis.mapperast.logging.nologging.NoLoggingImpl;
import org.mybatis.mapperast.logging.slf4j.Slf4jImpl;
import org.mybatis.mapperast.logging.stdout.StdOutImpl;
import org.mybatis.mapperast.session.Configuration;

/**
 * Builds a {@link Configuration} from settings given as properties.
 *
 * <pre>
 * logImpl=SLF4J
 * maxNestingDepth=256
 * </pre>
 *
 * @author Clinton Begin
 * @author Kazuki Shimizu
 */
public class PropertiesConfigBuilder {

  public static final String LOG_IMPL = "logImpl";
  public static final String MAX_NESTING_DEPTH = "maxNestingDepth";

  private static final Set<String> KNOWN_SETTINGS =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList(LOG_IMPL, MAX_NESTING_DEPTH)));

  private static final Map<String, Class<? extends Log>> LOG_ALIASES = new HashMap<>();

  static {
    LOG_ALIASES.put("SLF4J", Slf4jImpl.class);
    LOG_ALIASES.put("COMMONS_LOGGING", JakartaCommonsLoggingImpl.class);
    LOG_ALIASES.put("LOG4J2", Log4j2Impl.class);
    LOG_ALIASES.put("JDK_LOGGING", Jdk14LoggingImpl.class);
    LOG_ALIASES.put("STDOUT_LOGGING", StdOutImpl.class);
    LOG_ALIASES.put("NO_LOGGING", NoLoggingImpl.class);
  }

  private final Properties props;

  public PropertiesConfigBuilder(Properties props) {
    this.props = props;
  }

  /**
   * Reads the settings from a properties file on the classpath.
   */
  public PropertiesConfigBuilder(String resource) throws IOException {
    this(Resources.getResourceAsProperties(resource));
  }

  public Configuration parse() {
    Configuration configuration = new Configuration();
    Properties settings = settingsAsProperties(props);
    loadCustomLogImpl(configuration, settings);
    settingsElement(configuration, settings);
    return configuration;
  }

  private Properties settingsAsProperties(Properties props) {
    if (props == null) {
      return new Properties();
    }
    for (Object key : props.keySet()) {
      if (!KNOWN_SETTINGS.contains(String.valueOf(key))) {
        throw new BuilderException(ErrorKind.INVALID_SETTING,
            "The setting " + key + " is not known.  Make sure you spelled it correctly (case sensitive).");
      }
    }
    return props;
  }

  private void loadCustomLogImpl(Configuration configuration, Properties props) {
    configuration.setLogImpl(resolveLogImpl(props.getProperty(LOG_IMPL)));
  }

  private void settingsElement(Configuration configuration, Properties props) {
    configuration.setMaxNestingDepth(integerValueOf(props.getProperty(MAX_NESTING_DEPTH), 0));
  }

  private Class<? extends Log> resolveLogImpl(String alias) {
    if (alias == null) {
      return null;
    }
    String key = alias.trim();
    Class<? extends Log> logImpl = LOG_ALIASES.get(key.toUpperCase());
    if (logImpl != null) {
      return logImpl;
    }
    Class<?> type;
    try {
      type = Resources.classForName(key);
    } catch (ClassNotFoundException e) {
      throw new BuilderException(ErrorKind.INVALID_SETTING, "Error resolving class. Cause: " + e, e);
    }
    if (!Log.class.isAssignableFrom(type)) {
      throw new BuilderException(ErrorKind.INVALID_SETTING,
          "Type " + type.getName() + " is not a valid Log because it does not implement Log interface");
    }
    @SuppressWarnings("unchecked") // already verified it is a Log
    Class<? extends Log> logType = (Class<? extends Log>) type;
    return logType;
  }

  private Integer integerValueOf(String value, Integer defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new BuilderException(ErrorKind.INVALID_SETTING, "Invalid integer value '" + value + "'. Cause: " + e, e);
    }
  }

}
