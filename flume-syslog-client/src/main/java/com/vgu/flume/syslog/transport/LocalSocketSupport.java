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
package com.vgu.flume.syslog.transport;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;

/** Whether the platform has UNIX domain sockets, and where syslogd listens. */
public abstract class LocalSocketSupport {
  /** Datagram kind first; that is what most daemons bind. */
  public static final List<String> LOCAL_NETWORKS =
      ImmutableList.of("unixgram", "unix");

  public static final List<String> STANDARD_PATHS =
      ImmutableList.of("/dev/log", "/var/run/syslog", "/var/run/log");

  public static final LocalSocketSupport UNIX = new LocalSocketSupport() {
    @Override
    public boolean isSupported() {
      return true;
    }

    @Override
    public List<String> standardPaths() {
      return STANDARD_PATHS;
    }
  };

  public static final LocalSocketSupport NONE = new LocalSocketSupport() {
    @Override
    public boolean isSupported() {
      return false;
    }

    @Override
    public List<String> standardPaths() {
      return ImmutableList.of();
    }
  };

  public abstract boolean isSupported();

  public abstract List<String> standardPaths();

  public static LocalSocketSupport forCurrentPlatform() {
    String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    return os.startsWith("windows") ? NONE : UNIX;
  }
}
