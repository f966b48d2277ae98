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

import java.io.Closeable;
import java.io.IOException;

/** A live transport to a SYSLOG receiver, owned by exactly one client. */
public interface SyslogConnection extends Closeable {
  /**
   * Writes one formatted message. Datagram transports send it as a single
   * datagram.
   */
  void write(byte[] message) throws IOException;

  /**
   * @return the network kind actually in use ("tcp", "udp", "unix",
   * "unixgram"), or null if unknown, in which case the network of the dialed
   * target is assumed
   */
  String getNetwork();
}
