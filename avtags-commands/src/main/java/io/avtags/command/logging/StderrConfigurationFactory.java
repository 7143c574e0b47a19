/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.avtags.command.logging;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.ConfigurationFactory;
import org.apache.logging.log4j.core.config.ConfigurationSource;
import org.apache.logging.log4j.core.config.builder.api.AppenderComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilder;
import org.apache.logging.log4j.core.config.builder.impl.BuiltConfiguration;

import java.net.URI;

/// Log4j configuration for the command line: every logger writes to standard error, leaving
/// standard output to the per-sample lines.
///
/// Installed by setting {@link ConfigurationFactory#CONFIGURATION_FACTORY_PROPERTY} to this
/// class before the first logger is created.
public class StderrConfigurationFactory extends ConfigurationFactory {

  static final String APPENDER = "stderr";
  static final String PATTERN = "[%-5level] %c{1}: %msg%n%throwable";

  static Configuration createConfiguration(String name, ConfigurationBuilder<BuiltConfiguration> builder) {
    builder.setConfigurationName(name);
    builder.setStatusLevel(Level.ERROR);
    AppenderComponentBuilder appender = builder.newAppender(APPENDER, "Console")
        .addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    appender.add(builder.newLayout("PatternLayout").addAttribute("pattern", PATTERN));
    builder.add(appender);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef(APPENDER)));
    return builder.build();
  }

  @Override
  public Configuration getConfiguration(LoggerContext loggerContext, ConfigurationSource source) {
    return getConfiguration(loggerContext, source.toString(), null);
  }

  @Override
  public Configuration getConfiguration(LoggerContext loggerContext, String name, URI configLocation) {
    return createConfiguration(name, newConfigurationBuilder());
  }

  @Override
  protected String[] getSupportedTypes() {
    return new String[]{"*"};
  }
}
