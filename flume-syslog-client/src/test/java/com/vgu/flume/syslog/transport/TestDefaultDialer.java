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
import jnr.unixsocket.UnixServerSocketChannel;
import jnr.unixsocket.UnixSocketAddress;
import jnr.unixsocket.UnixSocketChannel;
import org.junit.After;
import org.junit.Assert;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

public class TestDefaultDialer {
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final DefaultDialer dialer = new DefaultDialer();
  private ServerSocket server;
  private DatagramSocket receiver;

  @Before
  public void setUp() throws IOException {
    server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    receiver = new DatagramSocket(0, InetAddress.getLoopbackAddress());
    receiver.setSoTimeout(5000);
  }

  @After
  public void tearDown() throws IOException {
    server.close();
    receiver.close();
  }

  @Test
  public void testTcp() throws IOException {
    SyslogConnection conn = dialer.dial("tcp",
        "127.0.0.1:" + server.getLocalPort(), 5000);
    Socket accepted = server.accept();
    try {
      Assert.assertEquals("tcp", conn.getNetwork());
      conn.write("hello\u0000".getBytes(StandardCharsets.UTF_8));
      conn.close();
      InputStream in = accepted.getInputStream();
      byte[] buf = new byte[16];
      int n = 0;
      int r;
      while ((r = in.read(buf, n, buf.length - n)) > 0) {
        n += r;
      }
      Assert.assertEquals("hello\u0000", new String(buf, 0, n,
          StandardCharsets.UTF_8));
    } finally {
      accepted.close();
    }
  }

  @Test
  public void testUdp() throws IOException {
    SyslogConnection conn = dialer.dial("udp4",
        "127.0.0.1:" + receiver.getLocalPort(), 5000);
    try {
      Assert.assertEquals("udp", conn.getNetwork());
      conn.write("<13>hi".getBytes(StandardCharsets.UTF_8));
      DatagramPacket packet = new DatagramPacket(new byte[64], 64);
      receiver.receive(packet);
      Assert.assertEquals("<13>hi", new String(packet.getData(), 0,
          packet.getLength(), StandardCharsets.UTF_8));
    } finally {
      conn.close();
    }
  }

  @Test(expected = IOException.class)
  public void testTcpRefused() throws IOException {
    int port = server.getLocalPort();
    server.close();
    dialer.dial("tcp", "127.0.0.1:" + port, 1000);
  }

  @Test(expected = IOException.class)
  public void testUnknownNetwork() throws IOException {
    dialer.dial("tls", "127.0.0.1:6514", 1000);
  }

  @Test(expected = IOException.class)
  public void testMissingUnixSocket() throws IOException {
    dialer.dial("unix", "/nonexistent/flume-syslog-test.sock", 1000);
  }

  @Test(expected = IOException.class)
  public void testMissingUnixgramSocket() throws IOException {
    dialer.dial("unixgram", "/nonexistent/flume-syslog-test.sock", 1000);
  }

  @Test(expected = IOException.class)
  public void testUnixgramRegularFile() throws IOException {
    File file = tmp.newFile("not-a-socket");
    dialer.dial("unixgram", file.getAbsolutePath(), 1000);
  }

  @Test
  public void testUnixgram() throws IOException {
    assumeUnixSockets();
    File path = new File(tmp.getRoot(), "dgram.sock");
    UnixDatagramChannel daemon = UnixDatagramChannel.open();
    try {
      daemon.bind(new UnixSocketAddress(path));
      SyslogConnection conn = dialer.dial("unixgram", path.getAbsolutePath(),
          1000);
      try {
        Assert.assertEquals("unixgram", conn.getNetwork());
        conn.write("<13>hello".getBytes(StandardCharsets.UTF_8));
        conn.write("<13>again".getBytes(StandardCharsets.UTF_8));
      } finally {
        conn.close();
      }
      Assert.assertEquals("<13>hello", receive(daemon));
      Assert.assertEquals("<13>again", receive(daemon));
    } finally {
      daemon.close();
    }
  }

  @Test
  public void testUnixStream() throws IOException {
    assumeUnixSockets();
    File path = new File(tmp.getRoot(), "stream.sock");
    UnixServerSocketChannel daemon = UnixServerSocketChannel.open();
    try {
      daemon.socket().bind(new UnixSocketAddress(path));
      SyslogConnection conn = dialer.dial("unix", path.getAbsolutePath(),
          1000);
      UnixSocketChannel accepted = daemon.accept();
      try {
        Assert.assertEquals("unix", conn.getNetwork());
        conn.write("<13>hello\u0000".getBytes(StandardCharsets.UTF_8));
        conn.close();
        ByteBuffer buf = ByteBuffer.allocate(64);
        while (accepted.read(buf) > 0) {
          // until the client closes
        }
        Assert.assertEquals("<13>hello\u0000", new String(buf.array(), 0,
            buf.position(), StandardCharsets.UTF_8));
      } finally {
        accepted.close();
      }
    } finally {
      daemon.close();
    }
  }

  @Test
  public void testParseInetAddress() throws IOException {
    InetSocketAddress addr = DefaultDialer.parseInetAddress("udp",
        "[::1]:514");
    Assert.assertEquals(514, addr.getPort());
    Assert.assertEquals("0:0:0:0:0:0:0:1", addr.getAddress().getHostAddress());
    addr = DefaultDialer.parseInetAddress("tcp4", "127.0.0.1:1514");
    Assert.assertEquals(1514, addr.getPort());
  }

  @Test(expected = IOException.class)
  public void testParseInvalidPort() throws IOException {
    DefaultDialer.parseInetAddress("udp", "127.0.0.1:syslog");
  }

  @Test(expected = IOException.class)
  public void testAddressFamilyEnforced() throws IOException {
    DefaultDialer.parseInetAddress("udp4", "[::1]:514");
  }

  @Test(expected = IOException.class)
  public void testIpv6OnlyRejectsIpv4() throws IOException {
    dialer.dial("tcp6", "127.0.0.1:" + server.getLocalPort(), 1000);
  }

  private static void assumeUnixSockets() {
    Assume.assumeFalse(System.getProperty("os.name").startsWith("Windows"));
  }

  private static String receive(UnixDatagramChannel daemon)
      throws IOException {
    ByteBuffer buf = ByteBuffer.allocate(64);
    daemon.receive(buf);
    buf.flip();
    return StandardCharsets.UTF_8.decode(buf).toString();
  }
}
