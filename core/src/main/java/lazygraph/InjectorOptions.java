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

import com.google.auto.value.AutoValue;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Options applied when an {@link Injector} is created. */
@AutoValue
public abstract class InjectorOptions {
  /**
   * Property selecting the {@link CycleCheck}: {@code skip}, {@code simple} or {@code detailed}.
   */
  public static final String CHECK_FOR_CYCLES = "lazygraph.checkForCycles";

  /**
   * Property naming a {@link Level}. When set, injector events are written to the
   * {@code lazygraph.Injector} logger at that level.
   */
  public static final String LOG = "lazygraph.log";

  InjectorOptions() {}

  /** How the dependency graph is checked for cycles. Defaults to {@link CycleCheck#SIMPLE}. */
  public abstract CycleCheck checkForCycles();

  /** Where injector events are sent, if anywhere. */
  public abstract Optional<InjectionLog> log();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_InjectorOptions.Builder().checkForCycles(CycleCheck.SIMPLE);
  }

  /** Returns the options configured by the system properties. */
  public static InjectorOptions defaults() {
    return fromProperties(System.getProperties());
  }

  /**
   * Reads {@link #CHECK_FOR_CYCLES} and {@link #LOG} from {@code properties}. Absent properties
   * keep their defaults.
   *
   * @throws IllegalArgumentException if a property has a value that can't be parsed
   */
  public static InjectorOptions fromProperties(Properties properties) {
    Builder builder = builder();
    String checkForCycles = properties.getProperty(CHECK_FOR_CYCLES);
    if (checkForCycles != null) {
      builder.checkForCycles(CycleCheck.fromOptionValue(CHECK_FOR_CYCLES, checkForCycles));
    }
    String level = properties.getProperty(LOG);
    if (level != null) {
      Level parsed;
      try {
        parsed = Level.parse(level.trim());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            String.format("Option %s must name a java.util.logging.Level, found: %s", LOG, level),
            e);
      }
      builder.log(InjectionLog.forLogger(Logger.getLogger(Injector.class.getName()), parsed));
    }
    return builder.build();
  }

  /** A builder for {@link InjectorOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder checkForCycles(CycleCheck checkForCycles);

    public abstract Builder log(InjectionLog log);

    public abstract Builder log(Optional<InjectionLog> log);

    public abstract InjectorOptions build();
  }
}
