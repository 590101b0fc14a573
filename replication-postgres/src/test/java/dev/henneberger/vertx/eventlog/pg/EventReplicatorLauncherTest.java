/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.eventlog.pg;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EventReplicatorLauncherTest {

  @TempDir
  Path tempDir;

  @Test
  void dryRunStopsAfterValidation() throws Exception {
    Path config = write("config.json", EventReplicatorConfigTest.validConfig().encodePrettily());

    int exitCode = new EventReplicatorLauncher(Map.of()).run(new String[] {config.toString(), "--dry-run"});

    assertEquals(EventReplicatorLauncher.EXIT_INVALID, exitCode);
  }

  @Test
  void readsConfigPathFromEnvironment() throws Exception {
    Path config = write("config.json", EventReplicatorConfigTest.validConfig().encode());

    int exitCode = new EventReplicatorLauncher(Map.of(EventReplicatorLauncher.CONFIG_ENV, config.toString()))
      .run(new String[] {"--dry-run"});

    assertEquals(EventReplicatorLauncher.EXIT_INVALID, exitCode);
  }

  @Test
  void acceptsConfigFilenameOption() throws Exception {
    Path config = write("config.json", EventReplicatorConfigTest.validConfig().encode());

    int exitCode = new EventReplicatorLauncher(Map.of())
      .run(new String[] {"--config-filename", config.toString(), "--dry-run"});

    assertEquals(EventReplicatorLauncher.EXIT_INVALID, exitCode);
  }

  @Test
  void missingConfigIsInvalid() {
    assertEquals(EventReplicatorLauncher.EXIT_INVALID, new EventReplicatorLauncher(Map.of()).run(new String[0]));
  }

  @Test
  void unknownOptionIsInvalid() {
    assertEquals(EventReplicatorLauncher.EXIT_INVALID,
      new EventReplicatorLauncher(Map.of()).run(new String[] {"--verbose"}));
  }

  @Test
  void invalidConfigIsInvalid() throws Exception {
    Path config = write("config.json", "{\"eventSource\": {\"host\": \"localhost\"}}");

    assertEquals(EventReplicatorLauncher.EXIT_INVALID,
      new EventReplicatorLauncher(Map.of()).run(new String[] {config.toString()}));
  }

  @Test
  void malformedJsonIsInvalid() throws Exception {
    Path config = write("config.json", "{ not json");

    assertEquals(EventReplicatorLauncher.EXIT_INVALID,
      new EventReplicatorLauncher(Map.of()).run(new String[] {config.toString()}));
  }

  @Test
  void unreadableConfigFails() {
    Path missing = tempDir.resolve("missing.json");

    assertEquals(EventReplicatorLauncher.EXIT_FAILURE,
      new EventReplicatorLauncher(Map.of()).run(new String[] {missing.toString()}));
  }

  private Path write(String name, String content) throws Exception {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
