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
import com.vgu.flume.syslog.transport.DefaultDialer;
import com.vgu.flume.syslog.transport.Dialer;
import com.vgu.flume.syslog.transport.SyslogConnection;
import com.vgu.flume.syslog.transport.Target;
import com.vgu.flume.syslog.transport.TargetResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SYSLOG protocol writer which connects, and reconnects after failures, on
 * demand.
 * <p/>
 * Each {@link #write} makes at most one reconnect attempt. Reconnects are rate
 * limited by the configured {@link Backoff}: while the backoff window is open
 * writes fail with {@link SyslogBackoffException} without touching the
 * network. Nothing is buffered; a failed write is a lost message unless the
 * caller keeps it.
 * <p/>
 * Calls are serialized by one lock. The connect timeout only bounds dialing;
 * a write to a live connection is never cut short, since half a framed message
 * on a stream transport would corrupt everything after it.
 */
public class SyslogClient implements Closeable {
  private static final Logger logger = LoggerFactory
      .getLogger(SyslogClient.class);

  private final SyslogConfig config;
  private final List<Target> targets;
  private final Dialer dialer;
  private final Backoff backoff;
  private final Clock clock;
  private final int processId;
  private final String hostName;
  private final SyslogFormatter formatter = new SyslogFormatter();
  private final ReentrantLock lock = new ReentrantLock();

  /* guarded by lock */
  private SyslogConnection connection;
  private ResolvedFormat format;
  private boolean closed;
  private long notBeforeMillis;

  /**
   * Resolves the connection targets, and the local host name unless one is
   * configured, without connecting.
   *
   * @throws SyslogConfigurationException if the transport spec is unusable
   */
  public SyslogClient(SyslogConfig config)
      throws SyslogConfigurationException {
    this(config, new TargetResolver(), Clock.systemDefaultZone());
  }

  SyslogClient(SyslogConfig config, TargetResolver resolver, Clock clock)
      throws SyslogConfigurationException {
    this.config = Preconditions.checkNotNull(config, "config");
    this.targets = resolver.resolve(config.getNetwork(), config.getAddress());
    this.dialer = config.getDialer() != null ? config.getDialer()
        : new DefaultDialer();
    this.backoff = config.newBackoff();
    this.clock = clock;
    this.processId = (int) ProcessHandle.current().pid();
    this.hostName = config.getHostName().isEmpty()
        ? localHostName(System.getenv("HOSTNAME")) : config.getHostName();
    logger.debug("syslog client targets: {}", targets);
  }

  /** Writes with the configured connect timeout. */
  public void write(SyslogMessage message)
      throws SyslogException {
    write(message, config.getConnectTimeoutMillis());
  }

  /**
   * Writes one message, connecting first if needed.
   *
   * @param connectTimeoutMillis bounds each dial attempt, not the write
   * @throws SyslogClosedException     after {@link #close()}
   * @throws SyslogBackoffException    while reconnects are rate limited
   * @throws SyslogConnectException    if no target could be dialed
   * @throws SyslogWriteException      if the write failed, also after one
   *                                   reconnect
   */
  public void write(SyslogMessage message, int connectTimeoutMillis)
      throws SyslogException {
    Preconditions.checkNotNull(message, "message");
    lock.lock();
    try {
      ensureConnection(connectTimeoutMillis);

      ZonedDateTime timestamp = message.getTime() != null ? message.getTime()
          : ZonedDateTime.now(clock);
      int pri = message.getPriority();

      try {
        writeFormatted(pri, timestamp, message);
      } catch (SyslogWriteException e) {
        logger.warn("syslog write failed, reconnecting: {}", e.getMessage());
        destroyConnection();
        try {
          ensureConnection(connectTimeoutMillis);
        } catch (SyslogException reconnectError) {
          logger.debug("reconnect after write failure failed", reconnectError);
          throw e;
        }
        try {
          writeFormatted(pri, timestamp, message);
        } catch (SyslogWriteException retryError) {
          destroyConnection();
          throw retryError;
        }
      }
    } finally {
      lock.unlock();
    }
  }

  private void writeFormatted(int pri, ZonedDateTime timestamp,
                              SyslogMessage message)
      throws SyslogWriteException {
    byte[] bytes = formatter.format(format, pri, timestamp, processId,
        message.getId(), message.getBody(), message.getStructuredData());
    try {
      connection.write(bytes);
    } catch (IOException e) {
      throw new SyslogWriteException("error writing syslog message", e);
    }
    backoff.reset();
  }

  private void ensureConnection(int connectTimeoutMillis)
      throws SyslogException {
    if (connection != null) {
      return;
    }
    if (closed) {
      throw new SyslogClosedException();
    }
    long now = clock.millis();
    if (now < notBeforeMillis) {
      logger.debug("reconnect refused, backing off until {}", notBeforeMillis);
      throw new SyslogBackoffException(notBeforeMillis);
    }
    // consumed before dialing, so a hanging attempt cannot be retried early
    notBeforeMillis = now + backoff.nextDelayMillis();

    IOException firstError = null;
    for (Target target : targets) {
      SyslogConnection conn;
      try {
        conn = dialer.dial(target.getNetwork(), target.getAddress(),
            connectTimeoutMillis);
      } catch (IOException e) {
        logger.debug("cannot connect to syslog target {}: {}", target,
            e.getMessage());
        if (firstError == null) {
          firstError = e;
        }
        continue;
      }
      connection = conn;
      autoconfigure(target);
      logger.info("connected to syslog target {} using {}", target, format);
      return;
    }
    logger.warn("cannot connect to any syslog target {}", targets);
    throw new SyslogConnectException("cannot connect to syslog targets " +
        targets, firstError);
  }

  private void autoconfigure(Target target) {
    String network = connection.getNetwork();
    if (network == null) {
      network = target.getNetwork();
    }
    format = ResolvedFormat.resolve(config, network, hostName);
  }

  /**
   * Prefers the HOSTNAME environment variable, which needs no name service.
   * Empty, written as "-", if neither source knows the name.
   */
  static String localHostName(String environmentValue) {
    if (environmentValue != null && !environmentValue.trim().isEmpty()) {
      return environmentValue.trim();
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      logger.warn("cannot determine local host name, using '-': {}",
          e.getMessage());
      return "";
    }
  }

  private void destroyConnection() {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (IOException e) {
      logger.debug("error closing syslog connection", e);
    }
    connection = null;
    format = null;
  }

  /**
   * Closes the connection, if any. Later writes fail with
   * {@link SyslogClosedException}. Idempotent.
   */
  @Override
  public void close() {
    lock.lock();
    try {
      destroyConnection();
      closed = true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /** @return the format of the live connection, or null if disconnected */
  public ResolvedFormat getResolvedFormat() {
    lock.lock();
    try {
      return format;
    } finally {
      lock.unlock();
    }
  }

  public List<Target> getTargets() {
    return targets;
  }
}
