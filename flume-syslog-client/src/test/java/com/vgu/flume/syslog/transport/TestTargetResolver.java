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

import com.google.common.collect.ImmutableList;
import com.vgu.flume.syslog.SyslogConfigurationException;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class TestTargetResolver {
  private final TargetResolver unix = new TargetResolver(LocalSocketSupport.UNIX);
  private final TargetResolver noLocal = new TargetResolver(LocalSocketSupport.NONE);

  @Test
  public void testAutodetectStandardPaths() throws SyslogConfigurationException {
    List<Target> targets = unix.resolve("", "");
    Assert.assertEquals(ImmutableList.of(
        new Target("unixgram", "/dev/log"),
        new Target("unixgram", "/var/run/syslog"),
        new Target("unixgram", "/var/run/log"),
        new Target("unix", "/dev/log"),
        new Target("unix", "/var/run/syslog"),
        new Target("unix", "/var/run/log")), targets);
    Assert.assertEquals(targets, unix.resolve(null, null));
  }

  @Test
  public void testExplicitLocalKindAndPath() throws SyslogConfigurationException {
    Assert.assertEquals(ImmutableList.of(
        new Target("unixgram", "/tmp/log"),
        new Target("unix", "/tmp/log")), unix.resolve("", "/tmp/log"));
    Assert.assertEquals(ImmutableList.of(new Target("unix", "/tmp/log")),
        unix.resolve("unix", "/tmp/log"));
    Assert.assertEquals(3, unix.resolve("unixgram", "").size());
    for (Target t : unix.resolve("unix", "")) {
      Assert.assertEquals("unix", t.getNetwork());
    }
  }

  @Test
  public void testNetworkDefaults() throws SyslogConfigurationException {
    Assert.assertEquals(ImmutableList.of(new Target("udp", "foobar:514")),
        unix.resolve("", "foobar"));
    Assert.assertEquals(ImmutableList.of(new Target("udp", "127.0.0.1:514")),
        unix.resolve("", "127.0.0.1"));
    Assert.assertEquals(ImmutableList.of(new Target("udp", "127.0.0.1:1514")),
        unix.resolve("", "127.0.0.1:1514"));
    Assert.assertEquals(ImmutableList.of(new Target("udp", "[::1]:514")),
        unix.resolve("", "[::1]"));
    Assert.assertEquals(ImmutableList.of(new Target("udp", "[::1]:515")),
        unix.resolve("", "[::1]:515"));
    Assert.assertEquals(ImmutableList.of(new Target("tcp", "logs.example.com:514")),
        unix.resolve("tcp", "logs.example.com"));
    Assert.assertEquals(ImmutableList.of(new Target("tcp", "logs.example.com:6514")),
        unix.resolve("tcp", "logs.example.com:6514"));
  }

  @Test
  public void testWithoutLocalSocketsPathIsTreatedAsHost()
      throws SyslogConfigurationException {
    Assert.assertEquals(ImmutableList.of(new Target("udp", "/dev/log:514")),
        noLocal.resolve("", "/dev/log"));
  }

  @Test(expected = SyslogConfigurationException.class)
  public void testNoAddressWithoutLocalSockets() throws SyslogConfigurationException {
    noLocal.resolve("", "");
  }

  @Test(expected = SyslogConfigurationException.class)
  public void testNoAddressForNetworkTransport() throws SyslogConfigurationException {
    unix.resolve("tcp", "");
  }

  @Test(expected = SyslogConfigurationException.class)
  public void testUnbracketedIpv6Rejected() throws SyslogConfigurationException {
    unix.resolve("udp", "::1");
  }

  @Test(expected = SyslogConfigurationException.class)
  public void testUnclosedBracketRejected() throws SyslogConfigurationException {
    unix.resolve("udp", "[::1");
  }

  @Test
  public void testTargetSpec() throws SyslogConfigurationException {
    SyslogTargetSpec spec = SyslogTargetSpec.parse("tcp://logs:6514");
    Assert.assertEquals("tcp", spec.getNetwork());
    Assert.assertEquals("logs:6514", spec.getAddress());

    spec = SyslogTargetSpec.parse("unixgram:/dev/log");
    Assert.assertEquals("unixgram", spec.getNetwork());
    Assert.assertEquals("/dev/log", spec.getAddress());

    spec = SyslogTargetSpec.parse("udp:[::1]:514");
    Assert.assertEquals("udp", spec.getNetwork());
    Assert.assertEquals("[::1]:514", spec.getAddress());

    spec = SyslogTargetSpec.parse("");
    Assert.assertEquals("", spec.getNetwork());
    Assert.assertEquals("", spec.getAddress());
  }

  @Test(expected = SyslogConfigurationException.class)
  public void testTargetSpecWithoutNetwork() throws SyslogConfigurationException {
    SyslogTargetSpec.parse("localhost");
  }
}
