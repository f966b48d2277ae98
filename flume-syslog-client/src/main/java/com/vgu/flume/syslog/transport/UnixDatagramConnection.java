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

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * UNIX datagram socket. jnr's {@code connect} only records the peer, so every
 * message is sent to the stored address.
 */
class UnixDatagramConnection implements SyslogConnection {
  private final UnixDatagramChannel channel;
  private final UnixSocketAddress address;

  UnixDatagramConnection(UnixDatagramChannel channel,
                         UnixSocketAddress address) {
    this.channel = channel;
    this.address = address;
  }

  @Override
  public void write(byte[] message) throws IOException {
    int sent = channel.send(ByteBuffer.wrap(message), address);
    if (sent != message.length) {
      throw new IOException("short datagram write to " + address.path() +
          ": " + sent + " of " + message.length + " bytes");
    }
  }

  @Override
  public String getNetwork() {
    return "unixgram";
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
