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
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class VerbosityOptionTest {

    @CommandLine.Command(name = "probe")
    static class Probe {
        @CommandLine.Mixin
        VerbosityOption verbosity;
    }

    private static VerbosityOption parse(String... args) {
        Probe probe = new Probe();
        new CommandLine(probe).parseArgs(args);
        return probe.verbosity;
    }

    @Test
    public void testLevels() {
        assertEquals(Level.INFO, parse().logLevel());
        assertEquals(Level.DEBUG, parse("-v").logLevel());
        assertEquals(Level.ERROR, parse("--quiet").logLevel());
    }

    @Test
    public void testVerboseAndQuietConflict() {
        VerbosityOption option = parse("-v", "-q");
        assertThrows(IllegalStateException.class, option::validate);
    }
}
