package io.aitk.hubingest.fetch;


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

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class HubTokensTest {

  @Test
  public void testSanitizeStripsDecorations() {
    assertEquals(Optional.of("hf_abc"), HubTokens.sanitize("hf_abc"));
    assertEquals(Optional.of("hf_abc"), HubTokens.sanitize("  hf_abc\n"));
    assertEquals(Optional.of("hf_abc"), HubTokens.sanitize("Bearer hf_abc"));
    assertEquals(Optional.of("hf_abc"), HubTokens.sanitize("bearer   hf_abc"));
    assertEquals(Optional.of("hf_abc"), HubTokens.sanitize("\"hf_abc\""));
    assertEquals(Optional.of("hf_abc"), HubTokens.sanitize("'hf_abc'"));
    assertEquals(Optional.of("hf_abc"), HubTokens.sanitize("hf_abc trailing words"));
  }

  @Test
  public void testSanitizeEmptyValues() {
    assertFalse(HubTokens.sanitize(null).isPresent());
    assertFalse(HubTokens.sanitize("").isPresent());
    assertFalse(HubTokens.sanitize("   ").isPresent());
    assertFalse(HubTokens.sanitize("\"\"").isPresent());
    assertFalse(HubTokens.sanitize("Bearer ").isPresent());
  }

  @Test
  public void testRedactKeepsOnlyAPrefix() {
    assertEquals("hf_a***", HubTokens.redact("hf_abcdefghijklmnop"));
    assertEquals("<none>", HubTokens.redact(null));
  }
}
