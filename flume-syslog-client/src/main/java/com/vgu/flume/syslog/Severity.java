/*
   Copyright 2013 Vincent.Gu

   Licensed under the Apache License, Version 2.0 (the "License");
   you may not use this file except in compliance with the License.
   You may obtain a copy of the License at

       http://www.apache.org/licenses/LICENSE-2.0

   Unless required by applicable law or agreed to in writing, software
   distributed under the License is distributed on an "AS IS" BASIS,
   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
   See the License for the specific language governing permissions and
   limitations under the License.
 */
package com.vgu.flume.syslog;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * SYSLOG severity, heavily referencing IETF rfc3164.
 *
 * <pre>{@code
 *
 * Numerical         Severity
 * Code
 *
 * 0       Emergency: system is unusable
 * 1       Alert: action must be taken immediately
 * 2       Critical: critical conditions
 * 3       Error: error conditions
 * 4       Warning: warning conditions
 * 5       Notice: normal but significant condition
 * 6       Informational: informational messages
 * 7       Debug: debug-level messages
 *
 * }</pre>
 */
public enum Severity {
  EMERG(0, "emerg", "emergency"),
  ALERT(1, "alert"),
  CRIT(2, "crit", "critical"),
  ERR(3, "err", "error"),
  WARNING(4, "warning", "warn"),
  NOTICE(5, "notice"),
  INFO(6, "info"),
  DEBUG(7, "debug");

  /** Returned alongside a parse failure; carries no meaning. */
  public static final Severity FALLBACK = DEBUG;

  private static final Map<String, Severity> BY_NAME =
      new HashMap<String, Severity>();

  static {
    for (Severity s : values()) {
      for (String alias : s.aliases) {
        BY_NAME.put(alias, s);
      }
    }
  }

  private final int code;
  private final String[] aliases;

  Severity(int code, String... aliases) {
    this.code = code;
    this.aliases = aliases;
  }

  public int getCode() {
    return code;
  }

  /** Canonical short name, e.g. {@code "warning"}. */
  public String getName() {
    return aliases[0];
  }

  /**
   * Case-insensitively parses a severity name.
   *
   * @throws SeverityParseException carrying {@link #FALLBACK} if the name is
   *                              unknown
   */
  public static Severity parse(String name)
      throws SeverityParseException {
    Severity s = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (s == null) {
      throw new SeverityParseException(name);
    }
    return s;
  }

  public static Severity valueOf(int code) {
    for (Severity s : values()) {
      if (s.code == code) {
        return s;
      }
    }
    throw new IllegalArgumentException("severity out of range: " + code);
  }
}
