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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.vgu.flume.syslog.SyslogConfigurationException;

import java.util.List;

/**
 * Turns a (network, address) spec into the ordered list of targets to try,
 * most preferred first.
 */
public class TargetResolver {
  /** The standard UDP port for SYSLOG. */
  public static final int DEFAULT_PORT = 514;
  public static final String DEFAULT_NETWORK = "udp";

  private final LocalSocketSupport localSockets;

  public TargetResolver() {
    this(LocalSocketSupport.forCurrentPlatform());
  }

  public TargetResolver(LocalSocketSupport localSockets) {
    this.localSockets = localSockets;
  }

  /**
   * @param network "udp", "tcp", "unix", "unixgram", anything a custom dialer
   *                accepts, or empty to autodetect
   * @param address socket path or "host[:port]", may be empty for local
   *                sockets
   * @throws SyslogConfigurationException when no target can be derived
   */
  public List<Target> resolve(String network, String address)
      throws SyslogConfigurationException {
    network = Strings.nullToEmpty(network);
    address = Strings.nullToEmpty(address);

    List<Target> local = resolveLocal(network, address);
    if (!local.isEmpty()) {
      return local;
    }

    if (address.isEmpty()) {
      throw new SyslogConfigurationException("no syslog address specified");
    }
    if (network.isEmpty()) {
      network = DEFAULT_NETWORK;
    }
    if (!hasPort(address)) {
      address = address + ":" + DEFAULT_PORT;
    }
    return ImmutableList.of(new Target(network, address));
  }

  private List<Target> resolveLocal(String network, String address) {
    if (!localSockets.isSupported()) {
      return ImmutableList.of();
    }
    boolean localNetwork = network.isEmpty() ||
        LocalSocketSupport.LOCAL_NETWORKS.contains(network);
    if (!localNetwork || !(address.isEmpty() || address.startsWith("/"))) {
      return ImmutableList.of();
    }

    List<Target> targets = Lists.newArrayList();
    for (String n : LocalSocketSupport.LOCAL_NETWORKS) {
      if (!network.isEmpty() && !n.equals(network)) {
        continue;
      }
      if (!address.isEmpty()) {
        targets.add(new Target(n, address));
      } else {
        for (String path : localSockets.standardPaths()) {
          targets.add(new Target(n, path));
        }
      }
    }
    return ImmutableList.copyOf(targets);
  }

  /**
   * "host", "1.2.3.4" and "[::1]" have no port; "host:514" and "[::1]:514"
   * do. An unbracketed IPv6 literal is rejected, as its port would be
   * ambiguous.
   */
  static boolean hasPort(String address)
      throws SyslogConfigurationException {
    if (address.startsWith("[")) {
      int end = address.indexOf(']');
      if (end < 0) {
        throw new SyslogConfigurationException("missing ']' in address: " +
            address);
      }
      if (end == address.length() - 1) {
        return false;
      }
      if (address.charAt(end + 1) != ':') {
        throw new SyslogConfigurationException("unexpected text after ']' " +
            "in address: " + address);
      }
      return true;
    }
    int first = address.indexOf(':');
    if (first < 0) {
      return false;
    }
    if (first != address.lastIndexOf(':')) {
      throw new SyslogConfigurationException("too many colons in address: " +
          address);
    }
    return true;
  }
}
