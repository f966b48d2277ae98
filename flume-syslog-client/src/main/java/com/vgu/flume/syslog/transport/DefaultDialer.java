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

import jnr.unixsocket.UnixDatagramChannel;
import jnr.unixsocket.UnixSocketAddress;
import jnr.unixsocket.UnixSocketChannel;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Dials "tcp", "udp" (with their "4"/"6" variants) through java.net and
 * "unix"/"unixgram" through jnr-unixsocket.
 * <p/>
 * Host names are looked up before dialing and the lookup is not bounded by
 * the connect timeout. The "4" and "6" variants only accept addresses of
 * that family.
 */
public class DefaultDialer implements Dialer {
  @Override
  public SyslogConnection dial(String network, String address,
                               int timeoutMillis)
      throws IOException {
    if (network.startsWith("tcp")) {
      return SocketConnection.open(parseInetAddress(network, address),
          timeoutMillis);
    }
    if (network.startsWith("udp")) {
      return DatagramConnection.open(parseInetAddress(network, address));
    }
    if ("unix".equals(network)) {
      UnixSocketChannel channel = UnixSocketChannel.open(socketPath(address));
      return new ChannelConnection("unix", channel);
    }
    if ("unixgram".equals(network)) {
      UnixSocketAddress path = socketPath(address);
      return new UnixDatagramConnection(UnixDatagramChannel.open(), path);
    }
    throw new IOException("unknown network " + network);
  }

  /** Fails unless {@code path} names an existing socket file. */
  private static UnixSocketAddress socketPath(String path)
      throws IOException {
    BasicFileAttributes attrs = Files.readAttributes(Paths.get(path),
        BasicFileAttributes.class);
    if (!attrs.isOther()) {
      throw new IOException("not a socket: " + path);
    }
    return new UnixSocketAddress(path);
  }

  /**
   * Splits "host:port" or "[v6]:port" and resolves the host to an address of
   * the family the network suffix asks for.
   */
  static InetSocketAddress parseInetAddress(String network, String address)
      throws IOException {
    String suffix = network.substring(3);
    if (!(suffix.isEmpty() || suffix.equals("4") || suffix.equals("6"))) {
      throw new IOException("unknown network " + network);
    }
    int index = address.lastIndexOf(':');
    if (index < 0) {
      throw new IOException("missing port in address " + address);
    }
    String host = address.substring(0, index);
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
    }
    int port;
    try {
      port = Integer.parseInt(address.substring(index + 1));
    } catch (NumberFormatException e) {
      throw new IOException("invalid port in address " + address, e);
    }
    if (port < 0 || port > 65535) {
      throw new IOException("invalid port in address " + address);
    }
    for (InetAddress candidate : InetAddress.getAllByName(host)) {
      if (suffix.isEmpty()
          || (suffix.equals("4") && candidate instanceof Inet4Address)
          || (suffix.equals("6") && candidate instanceof Inet6Address)) {
        return new InetSocketAddress(candidate, port);
      }
    }
    throw new UnknownHostException("no " + network + " address for " + host);
  }
}
