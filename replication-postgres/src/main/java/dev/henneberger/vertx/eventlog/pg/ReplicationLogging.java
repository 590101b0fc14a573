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

import dev.henneberger.vertx.eventlog.core.EventReplicator;
import dev.henneberger.vertx.eventlog.core.ReplicationSubscription;
import java.util.Objects;
import org.slf4j.Logger;

public final class ReplicationLogging {

  private ReplicationLogging() {
  }

  public static ReplicationSubscription attachDefaultLogging(EventReplicator replicator, Logger logger) {
    Objects.requireNonNull(replicator, "replicator");
    Objects.requireNonNull(logger, "logger");

    return replicator.onCoordinatorStateChange(change -> {
      Throwable cause = change.cause();
      if (cause != null) {
        logger.warn("destination={} state={} prev={} cycles={} cause={}",
          change.destination(),
          change.state(),
          change.previousState(),
          change.cyclesCompleted(),
          cause.toString());
      } else {
        logger.info("destination={} state={} prev={} cycles={}",
          change.destination(),
          change.state(),
          change.previousState(),
          change.cyclesCompleted());
      }
    });
  }
}
