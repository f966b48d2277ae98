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

import com.vgu.flume.syslog.SyslogConfigurationException;

/**
 * Parses target strings of the form {@code network:address}, optionally with
 * {@code //} after the colon: "udp:192.0.2.1", "tcp://logs:6514",
 * "unixgram:/dev/log". An empty string requests autodetection.
 */
public final class SyslogTargetSpec {
  private final String network;
  private final String address;

  private SyslogTargetSpec(String network, String address) {
    this.network = network;
    this.address = address;
  }

  public static SyslogTargetSpec parse(String spec)
      throws SyslogConfigurationException {
    if (spec == null || spec.isEmpty()) {
      return new SyslogTargetSpec("", "");
    }
    int index = spec.indexOf(':');
    if (index < 0) {
      throw new SyslogConfigurationException("target must be of form " +
          "'network:address': " + spec);
    }
    String address = spec.substring(index + 1);
    if (address.startsWith("//")) {
      address = address.substring(2);
    }
    return new SyslogTargetSpec(spec.substring(0, index), address);
  }

  public String getNetwork() {
    return network;
  }

  public String getAddress() {
    return address;
  }
}
