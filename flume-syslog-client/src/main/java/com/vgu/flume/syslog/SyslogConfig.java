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
import com.google.common.base.Supplier;
import com.vgu.flume.syslog.transport.Dialer;

/**
 * Immutable client configuration. The {@code AUTO} protocol, framing and BOM
 * values are resolved per connection, see {@link ResolvedFormat}.
 */
public final class SyslogConfig {
  public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 10000;

  private final Protocol protocol;
  private final Framing framing;
  private final BomMode bomMode;
  private final Supplier<? extends Backoff> backoff;
  private final Dialer dialer;
  private final String network;
  private final String address;
  private final String hostName;
  private final String processName;
  private final int connectTimeoutMillis;

  private SyslogConfig(Builder builder) {
    this.protocol = builder.protocol;
    this.framing = builder.framing;
    this.bomMode = builder.bomMode;
    this.backoff = builder.backoff != null ? builder.backoff
        : ExponentialBackoff.builder().buildSupplier();
    this.dialer = builder.dialer;
    this.network = builder.network;
    this.address = builder.address;
    this.hostName = builder.hostName;
    this.processName = builder.processName;
    this.connectTimeoutMillis = builder.connectTimeoutMillis;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Protocol getProtocol() {
    return protocol;
  }

  /** Only relevant for byte-stream transports such as TCP. */
  public Framing getFraming() {
    return framing;
  }

  public BomMode getBomMode() {
    return bomMode;
  }

  /** Every client gets its own policy, since backoff state is per client. */
  public Backoff newBackoff() {
    return Preconditions.checkNotNull(backoff.get(),
        "backoff supplier returned null");
  }

  /** @return the custom dialer, or null for the default one */
  public Dialer getDialer() {
    return dialer;
  }

  /**
   * "udp", "tcp", "unix", "unixgram" or anything a custom dialer accepts.
   * Empty means autodetect.
   */
  public String getNetwork() {
    return network;
  }

  /**
   * A socket path for "unix"/"unixgram", "host[:port]" otherwise. Empty means
   * the standard local daemon socket paths.
   */
  public String getAddress() {
    return address;
  }

  /** Empty means the local machine's host name; "-" omits it. */
  public String getHostName() {
    return hostName;
  }

  /** Empty is written as "-". */
  public String getProcessName() {
    return processName;
  }

  public int getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  public static class Builder {
    private Protocol protocol = Protocol.AUTO;
    private Framing framing = Framing.AUTO;
    private BomMode bomMode = BomMode.AUTO;
    private Supplier<? extends Backoff> backoff;
    private Dialer dialer;
    private String network = "";
    private String address = "";
    private String hostName = "";
    private String processName = "";
    private int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;

    public Builder protocol(Protocol protocol) {
      this.protocol = Preconditions.checkNotNull(protocol, "protocol");
      return this;
    }

    public Builder framing(Framing framing) {
      this.framing = Preconditions.checkNotNull(framing, "framing");
      return this;
    }

    public Builder bomMode(BomMode bomMode) {
      this.bomMode = Preconditions.checkNotNull(bomMode, "bomMode");
      return this;
    }

    /**
     * @param backoff called once per client and must return a fresh policy;
     *                null restores the default exponential backoff
     */
    public Builder backoff(Supplier<? extends Backoff> backoff) {
      this.backoff = backoff;
      return this;
    }

    public Builder dialer(Dialer dialer) {
      this.dialer = dialer;
      return this;
    }

    public Builder network(String network) {
      this.network = network == null ? "" : network;
      return this;
    }

    public Builder address(String address) {
      this.address = address == null ? "" : address;
      return this;
    }

    public Builder hostName(String hostName) {
      this.hostName = hostName == null ? "" : hostName;
      return this;
    }

    public Builder processName(String processName) {
      this.processName = processName == null ? "" : processName;
      return this;
    }

    public Builder connectTimeoutMillis(int connectTimeoutMillis) {
      Preconditions.checkArgument(connectTimeoutMillis >= 0,
          "connect timeout must not be negative");
      this.connectTimeoutMillis = connectTimeoutMillis;
      return this;
    }

    public SyslogConfig build() {
      Preconditions.checkArgument(!containsWhitespace(hostName),
          "host name must not contain whitespace: %s", hostName);
      Preconditions.checkArgument(!containsWhitespace(processName),
          "process name must not contain whitespace: %s", processName);
      return new SyslogConfig(this);
    }

    private static boolean containsWhitespace(String s) {
      for (int i = 0; i < s.length(); i++) {
        if (Character.isWhitespace(s.charAt(i))) {
          return true;
        }
      }
      return false;
    }
  }
}
