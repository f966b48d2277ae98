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
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

/** Connected UDP socket, one datagram per message. */
class DatagramConnection implements SyslogConnection {
  private final DatagramSocket ds;

  private DatagramConnection(DatagramSocket ds) {
    this.ds = ds;
  }

  static DatagramConnection open(InetSocketAddress address)
      throws IOException {
    if (address.isUnresolved()) {
      throw new UnknownHostException(address.getHostString());
    }
    DatagramSocket ds = new DatagramSocket();
    try {
      ds.connect(address);
      return new DatagramConnection(ds);
    } catch (IOException e) {
      ds.close();
      throw e;
    }
  }

  @Override
  public void write(byte[] message) throws IOException {
    ds.send(new DatagramPacket(message, message.length));
  }

  @Override
  public String getNetwork() {
    return "udp";
  }

  @Override
  public void close() {
    ds.close();
  }
}
