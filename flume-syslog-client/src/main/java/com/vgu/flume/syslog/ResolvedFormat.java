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

import com.google.common.base.Preconditions;

/**
 * Concrete formatting settings, computed from the configuration and the
 * network of a connection once that connection is established.
 */
public final class ResolvedFormat {
  private final Protocol protocol;
  private final Framing framing;
  private final BomMode bomMode;
  private final String hostName;
  private final String processName;

  public ResolvedFormat(Protocol protocol, Framing framing, BomMode bomMode,
                        String hostName, String processName) {
    Preconditions.checkArgument(protocol != Protocol.AUTO,
        "protocol must be resolved");
    Preconditions.checkArgument(framing != Framing.AUTO,
        "framing must be resolved");
    Preconditions.checkArgument(bomMode != BomMode.AUTO,
        "BOM mode must be resolved");
    this.protocol = protocol;
    this.framing = framing;
    this.bomMode = bomMode;
    this.hostName = hostName;
    this.processName = processName;
  }

  /**
   * @param network the network of the connected transport, e.g. "udp" or
   *                "unixgram"
   */
  public static ResolvedFormat resolve(SyslogConfig config, String network,
                                       String hostName) {
    Protocol protocol = config.getProtocol().resolve(isLocalSocket(network));
    return new ResolvedFormat(protocol,
        config.getFraming().resolve(needsFraming(network)),
        config.getBomMode().resolve(protocol),
        hostName, config.getProcessName());
  }

  static boolean isLocalSocket(String network) {
    return network.startsWith("unix");
  }

  static boolean needsFraming(String network) {
    return !("unix".equals(network) || "unixgram".equals(network) ||
        "udp".equals(network));
  }

  public Protocol getProtocol() {
    return protocol;
  }

  public Framing getFraming() {
    return framing;
  }

  public BomMode getBomMode() {
    return bomMode;
  }

  public String getHostName() {
    return hostName;
  }

  public String getProcessName() {
    return processName;
  }

  @Override
  public String toString() {
    return "ResolvedFormat{protocol=" + protocol + ", framing=" + framing +
        ", bomMode=" + bomMode + ", hostName=" + hostName +
        ", processName=" + processName + "}";
  }
}
