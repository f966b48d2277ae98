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
 * SYSLOG facility, heavily referencing IETF rfc3164.
 *
 * <pre>{@code
 *
 * Numerical      Facility
 * Code
 *
 * 0              kernel messages
 * 1              user-level messages
 * 2              mail system
 * 3              system daemons
 * 4              security/authorization messages
 * 5              messages generated internally by syslogd
 * 6              line printer subsystem
 * 7              network news subsystem
 * 8              UUCP subsystem
 * 9              clock daemon
 * 10             security/authorization messages
 * 11             FTP daemon
 * 12             NTP subsystem
 * 13             log audit
 * 14             log alert
 * 15             clock daemon
 * 16-23          local use 0-7 (local0-local7)
 *
 * }</pre>
 *
 * Codes 12 to 15 are not universally supported by receivers.
 */
public enum Facility {
  KERN(0, "kern", "kernel"),
  USER(1, "user"),
  MAIL(2, "mail"),
  DAEMON(3, "daemon"),
  AUTH(4, "auth"),
  SYSLOG(5, "syslog"),
  LPR(6, "lpr"),
  NEWS(7, "news"),
  UUCP(8, "uucp"),
  CRON(9, "cron"),
  AUTHPRIV(10, "authpriv"),
  FTP(11, "ftp"),
  NTP(12, "ntp"),
  LOGAUDIT(13, "logaudit"),
  LOGALERT(14, "logalert"),
  CLOCK(15, "clock"),
  LOCAL0(16, "local0"),
  LOCAL1(17, "local1"),
  LOCAL2(18, "local2"),
  LOCAL3(19, "local3"),
  LOCAL4(20, "local4"),
  LOCAL5(21, "local5"),
  LOCAL6(22, "local6"),
  LOCAL7(23, "local7");

  /** Returned alongside a parse failure; carries no meaning. */
  public static final Facility FALLBACK = LOCAL7;

  private static final Map<String, Facility> BY_NAME =
      new HashMap<String, Facility>();

  static {
    for (Facility f : values()) {
      for (String alias : f.aliases) {
        BY_NAME.put(alias, f);
      }
    }
  }

  private final int code;
  private final String[] aliases;

  Facility(int code, String... aliases) {
    this.code = code;
    this.aliases = aliases;
  }

  public int getCode() {
    return code;
  }

  public String getName() {
    return aliases[0];
  }

  /**
   * Case-insensitively parses a facility name.
   *
   * @throws FacilityParseException carrying {@link #FALLBACK} if the name is
   *                              unknown
   */
  public static Facility parse(String name)
      throws FacilityParseException {
    Facility f = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (f == null) {
      throw new FacilityParseException(name);
    }
    return f;
  }

  public static Facility valueOf(int code) {
    for (Facility f : values()) {
      if (f.code == code) {
        return f;
      }
    }
    throw new IllegalArgumentException("facility out of range: " + code);
  }
}
