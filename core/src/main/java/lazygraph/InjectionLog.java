/*
 * Copyright (C) 2026 The Lazygraph Authors.
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

package lazygraph;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives one line per injector event. The statements have the form {@code "<member> - get"},
 * {@code "<member> - already constructed"}, {@code "<member> - constructing"} and
 * {@code "<member> - constructed"}.
 */
@FunctionalInterface
public interface InjectionLog {
  void log(String statement);

  /** Returns a log that forwards every statement to {@code logger} at {@code level}. */
  static InjectionLog forLogger(Logger logger, Level level) {
    if (logger == null) throw new NullPointerException("logger");
    if (level == null) throw new NullPointerException("level");
    return statement -> {
      if (logger.isLoggable(level)) {
        logger.log(level, statement);
      }
    };
  }
}
