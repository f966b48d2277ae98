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
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;

/** Byte-stream TCP transport. */
class SocketConnection implements SyslogConnection {
  private final Socket socket;
  private final OutputStream out;

  private SocketConnection(Socket socket) throws IOException {
    this.socket = socket;
    this.out = socket.getOutputStream();
  }

  static SocketConnection open(InetSocketAddress address, int timeoutMillis)
      throws IOException {
    if (address.isUnresolved()) {
      throw new UnknownHostException(address.getHostString());
    }
    Socket socket = new Socket();
    try {
      socket.connect(address, timeoutMillis);
      return new SocketConnection(socket);
    } catch (IOException e) {
      socket.close();
      throw e;
    }
  }

  @Override
  public void write(byte[] message) throws IOException {
    out.write(message);
    out.flush();
  }

  @Override
  public String getNetwork() {
    return "tcp";
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }
}
