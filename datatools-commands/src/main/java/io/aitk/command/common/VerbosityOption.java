package io.aitk.command.common;


/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags. Since every command
 * reserves stdout for its result, these flags only move the log threshold on stderr.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log fetch attempts and per-row progress"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all log output except errors"
    )
    private boolean quiet = false;

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot use both --verbose and --quiet options together");
        }
    }

    /**
     * The log level these flags select.
     *
     * @return DEBUG for verbose, ERROR for quiet, INFO otherwise
     */
    public Level logLevel() {
        if (quiet) {
            return Level.ERROR;
        }
        return verbose ? Level.DEBUG : Level.INFO;
    }

    /**
     * Validates the flags and applies {@link #logLevel()} to the root logger.
     */
    public void apply() {
        validate();
        Configurator.setRootLevel(logLevel());
    }
}
