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
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilderFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StderrConfigurationFactoryTest {

    @Test
    void testLogsToStandardErrorAtInfo() {
        Configuration config = StderrConfigurationFactory.createConfiguration(
            "avtags", ConfigurationBuilderFactory.newConfigurationBuilder());

        assertThat(config.getRootLogger().getLevel()).isEqualTo(Level.INFO);
        assertThat(config.getAppenders()).containsKey(StderrConfigurationFactory.APPENDER);
        ConsoleAppender appender = (ConsoleAppender) config.getAppenders().get(StderrConfigurationFactory.APPENDER);
        assertThat(appender.getTarget()).isEqualTo(ConsoleAppender.Target.SYSTEM_ERR);
    }
}
