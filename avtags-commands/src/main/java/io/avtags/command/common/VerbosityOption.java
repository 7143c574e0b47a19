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

package io.avtags.command.common;

import io.avtags.api.AvtagsConfigException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared {@code -v/--verbose} and {@code -q/--quiet} flags.
 * <p>
 * They select the root log level and whether the progress line is shown. Neither ever affects
 * the per-sample lines on standard output.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log debug detail to standard error"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Log only errors and hide the progress line"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * @return the root log level the flags select
     */
    public Level logLevel() {
        if (quiet) {
            return Level.ERROR;
        }
        return verbose ? Level.DEBUG : Level.INFO;
    }

    /**
     * Applies {@link #logLevel()} to the running logger configuration, but only when a flag was
     * given, so a configuration supplied from outside is otherwise left alone.
     */
    public void applyLogLevel() {
        if (verbose || quiet) {
            Configurator.setRootLevel(logLevel());
        }
    }

    /**
     * @throws AvtagsConfigException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new AvtagsConfigException("Cannot specify both --verbose and --quiet options");
        }
    }
}
