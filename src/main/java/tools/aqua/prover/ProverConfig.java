/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * Copyright 2025-2026 The TurnKey Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tools.aqua.prover;

import static java.lang.System.getProperty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for a proof run. Defaults can be overridden with the system properties {@value
 * #TIMEOUT_PROPERTY} and {@value #UNROLL_LIMIT_PROPERTY}.
 */
public final class ProverConfig {

  private static final Logger logger = LoggerFactory.getLogger(ProverConfig.class);

  /** System property for the solver timeout in milliseconds. */
  public static final String TIMEOUT_PROPERTY = "prover.timeout";

  /** System property for the maximum number of elements a comprehension may unroll. */
  public static final String UNROLL_LIMIT_PROPERTY = "prover.unrollLimit";

  /** The default solver timeout in milliseconds. */
  public static final int DEFAULT_TIMEOUT = 10_000;

  /** The default comprehension unroll limit. */
  public static final int DEFAULT_UNROLL_LIMIT = 64;

  /** The configuration with all defaults. */
  public static final ProverConfig DEFAULT = builder().build();

  /** Solver timeout in milliseconds. */
  private final int timeout;

  /** Maximum concrete length a comprehension may iterate over. */
  private final int unrollLimit;

  private ProverConfig(final Builder builder) {
    this.timeout = builder.timeout;
    this.unrollLimit = builder.unrollLimit;
  }

  /**
   * Read the configuration from the system properties, using the defaults for absent or malformed
   * values.
   *
   * @return the configuration.
   */
  public static ProverConfig fromSystemProperties() {
    return builder()
        .timeout(readPositive(TIMEOUT_PROPERTY, DEFAULT_TIMEOUT))
        .unrollLimit(readPositive(UNROLL_LIMIT_PROPERTY, DEFAULT_UNROLL_LIMIT))
        .build();
  }

  private static int readPositive(final String property, final int fallback) {
    final String text = getProperty(property);
    if (text == null) {
      return fallback;
    }
    try {
      final int value = Integer.parseInt(text.trim());
      if (value > 0) {
        return value;
      }
    } catch (NumberFormatException e) {
      logger.warn("Ignoring malformed {}={}: {}", property, text, e.getMessage());
      return fallback;
    }
    logger.warn("Ignoring non-positive {}={}", property, text);
    return fallback;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getTimeout() {
    return timeout;
  }

  public int getUnrollLimit() {
    return unrollLimit;
  }

  @Override
  public String toString() {
    return "ProverConfig(timeout=" + timeout + ", unrollLimit=" + unrollLimit + ")";
  }

  /** Builder for {@link ProverConfig}. */
  public static final class Builder {
    private int timeout = DEFAULT_TIMEOUT;
    private int unrollLimit = DEFAULT_UNROLL_LIMIT;

    private Builder() {}

    /**
     * Set the solver timeout.
     *
     * @param timeout the timeout in milliseconds, must be positive.
     * @return this builder.
     */
    public Builder timeout(final int timeout) {
      if (timeout <= 0) {
        throw new IllegalArgumentException("timeout must be positive: " + timeout);
      }
      this.timeout = timeout;
      return this;
    }

    /**
     * Set the comprehension unroll limit.
     *
     * @param unrollLimit the maximum number of iterations, must be positive.
     * @return this builder.
     */
    public Builder unrollLimit(final int unrollLimit) {
      if (unrollLimit <= 0) {
        throw new IllegalArgumentException("unroll limit must be positive: " + unrollLimit);
      }
      this.unrollLimit = unrollLimit;
      return this;
    }

    public ProverConfig build() {
      return new ProverConfig(this);
    }
  }
}
