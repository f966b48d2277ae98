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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

/** UNIX domain stream socket. */
class ChannelConnection implements SyslogConnection {
  private final String network;
  private final WritableByteChannel channel;

  ChannelConnection(String network, WritableByteChannel channel) {
    this.network = network;
    this.channel = channel;
  }

  @Override
  public void write(byte[] message) throws IOException {
    ByteBuffer buf = ByteBuffer.wrap(message);
    while (buf.hasRemaining()) {
      channel.write(buf);
    }
  }

  @Override
  public String getNetwork() {
    return network;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
