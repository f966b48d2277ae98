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
package com.vgu.flume.sink.syslog;

import com.google.common.base.Preconditions;
import com.vgu.flume.syslog.BomMode;
import com.vgu.flume.syslog.ExponentialBackoff;
import com.vgu.flume.syslog.Facility;
import com.vgu.flume.syslog.FacilityParseException;
import com.vgu.flume.syslog.Framing;
import com.vgu.flume.syslog.Protocol;
import com.vgu.flume.syslog.Severity;
import com.vgu.flume.syslog.SeverityParseException;
import com.vgu.flume.syslog.SyslogClient;
import com.vgu.flume.syslog.SyslogConfig;
import com.vgu.flume.syslog.SyslogConfigurationException;
import com.vgu.flume.syslog.SyslogException;
import com.vgu.flume.syslog.SyslogMessage;
import com.vgu.flume.syslog.transport.SyslogTargetSpec;
import org.apache.flume.Channel;
import org.apache.flume.Context;
import org.apache.flume.Event;
import org.apache.flume.EventDeliveryException;
import org.apache.flume.FlumeException;
import org.apache.flume.Transaction;
import org.apache.flume.conf.Configurable;
import org.apache.flume.instrumentation.SinkCounter;
import org.apache.flume.sink.AbstractSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;

/**
 * Sends every event to a SYSLOG receiver. The event body becomes the message
 * body; facility, severity, message ID, structured data and timestamp may be
 * taken from event headers. See {@link SyslogSinkConfigurationConstants} for
 * the configurable items.
 * <p/>
 * A failed write rolls the transaction back, so undelivered events stay in
 * the channel until the receiver is reachable again.
 */
public class SyslogSink extends AbstractSink implements Configurable {
  private static final Logger logger = LoggerFactory
      .getLogger(SyslogSink.class);

  private SinkCounter sinkCounter;
  private int batchSize;

  private SyslogConfig clientConfig;
  private Facility facility;
  private Severity severity;
  private String facilityHeader;
  private String severityHeader;
  private String messageIdHeader;
  private String structuredDataHeader;
  private String timestampHeader;

  private SyslogClient client;

  @Override
  public void configure(Context context) {
    if (sinkCounter == null) {
      sinkCounter = new SinkCounter(getName());
    }

    String network = context.getString(SyslogSinkConfigurationConstants.NETWORK);
    String address = context.getString(SyslogSinkConfigurationConstants.ADDRESS);
    String target = context.getString(SyslogSinkConfigurationConstants.TARGET);
    if (target != null) {
      try {
        SyslogTargetSpec spec = SyslogTargetSpec.parse(target);
        network = spec.getNetwork();
        address = spec.getAddress();
      } catch (SyslogConfigurationException e) {
        throw new IllegalArgumentException("invalid syslog target: " + target,
            e);
      }
    }

    Protocol protocol = parseEnum(Protocol.class, context.getString(
        SyslogSinkConfigurationConstants.PROTOCOL,
        SyslogSinkConfigurationConstants.DEFAULT_PROTOCOL));
    Framing framing = parseEnum(Framing.class, context.getString(
        SyslogSinkConfigurationConstants.FRAMING,
        SyslogSinkConfigurationConstants.DEFAULT_FRAMING));
    BomMode bomMode = parseEnum(BomMode.class, context.getString(
        SyslogSinkConfigurationConstants.BOM,
        SyslogSinkConfigurationConstants.DEFAULT_BOM));

    facility = parseFacility(context.getString(
        SyslogSinkConfigurationConstants.FACILITY,
        SyslogSinkConfigurationConstants.DEFAULT_FACILITY));
    Preconditions.checkArgument(facility != null, "unsupported facility: %s",
        context.getString(SyslogSinkConfigurationConstants.FACILITY));
    severity = parseSeverity(context.getString(
        SyslogSinkConfigurationConstants.SEVERITY,
        SyslogSinkConfigurationConstants.DEFAULT_SEVERITY));
    Preconditions.checkArgument(severity != null, "unsupported severity: %s",
        context.getString(SyslogSinkConfigurationConstants.SEVERITY));

    facilityHeader = context.getString(
        SyslogSinkConfigurationConstants.FACILITY_HEADER,
        SyslogSinkConfigurationConstants.DEFAULT_FACILITY_HEADER);
    severityHeader = context.getString(
        SyslogSinkConfigurationConstants.SEVERITY_HEADER,
        SyslogSinkConfigurationConstants.DEFAULT_SEVERITY_HEADER);
    messageIdHeader = context.getString(
        SyslogSinkConfigurationConstants.MESSAGE_ID_HEADER,
        SyslogSinkConfigurationConstants.DEFAULT_MESSAGE_ID_HEADER);
    structuredDataHeader = context.getString(
        SyslogSinkConfigurationConstants.STRUCTURED_DATA_HEADER,
        SyslogSinkConfigurationConstants.DEFAULT_STRUCTURED_DATA_HEADER);
    timestampHeader = context.getString(
        SyslogSinkConfigurationConstants.TIMESTAMP_HEADER,
        SyslogSinkConfigurationConstants.DEFAULT_TIMESTAMP_HEADER);

    batchSize = context.getInteger(SyslogSinkConfigurationConstants.BATCH_SIZE,
        SyslogSinkConfigurationConstants.DEFAULT_BATCH_SIZE);
    Preconditions.checkArgument(batchSize > 0, "batchSize must be positive");

    long initialDelay = context.getLong(
        SyslogSinkConfigurationConstants.BACKOFF_INITIAL_DELAY,
        ExponentialBackoff.DEFAULT_INITIAL_DELAY_MILLIS);
    long maxDelay = context.getLong(
        SyslogSinkConfigurationConstants.BACKOFF_MAX_DELAY,
        Math.max(initialDelay, ExponentialBackoff.DEFAULT_MAX_DELAY_MILLIS));
    int connectTimeout = context.getInteger(
        SyslogSinkConfigurationConstants.CONNECT_TIMEOUT,
        SyslogConfig.DEFAULT_CONNECT_TIMEOUT_MILLIS);

    clientConfig = SyslogConfig.builder()
        .network(network)
        .address(address)
        .protocol(protocol)
        .framing(framing)
        .bomMode(bomMode)
        .hostName(context.getString(SyslogSinkConfigurationConstants.HOST_NAME))
        .processName(context.getString(
            SyslogSinkConfigurationConstants.PROCESS_NAME, getName()))
        .backoff(ExponentialBackoff.builder()
            .initialDelayMillis(initialDelay)
            .maxDelayMillis(maxDelay)
            .buildSupplier())
        .connectTimeoutMillis(connectTimeout)
        .build();
  }

  @Override
  public synchronized void start() {
    logger.info("syslog sink {} starting...", getName());

    try {
      client = new SyslogClient(clientConfig);
    } catch (SyslogConfigurationException e) {
      sinkCounter.incrementConnectionFailedCount();
      throw new FlumeException("error while creating syslog client for " +
          "sink " + getName(), e);
    }

    super.start();
    sinkCounter.start();

    logger.info("syslog sink {} started, targets: {}", getName(),
        client.getTargets());
  }

  @Override
  public synchronized void stop() {
    logger.info("syslog sink {} stopping...", getName());

    if (client != null) {
      client.close();
      sinkCounter.incrementConnectionClosedCount();
    }

    sinkCounter.stop();
    super.stop();

    logger.info("syslog sink {} stopped. Event metrics: {}", getName(),
        sinkCounter);
  }

  @Override
  public Status process()
      throws EventDeliveryException {
    Channel channel = getChannel();
    Transaction txn = channel.getTransaction();
    Status result = Status.READY;
    txn.begin();

    try {
      int i = 0;
      for (; i < batchSize; i++) {
        Event event = channel.take();
        if (event == null) {
          // No events found, request back-off semantics from runner
          result = Status.BACKOFF;
          if (i == 0) {
            sinkCounter.incrementBatchEmptyCount();
          } else {
            sinkCounter.incrementBatchUnderflowCount();
          }
          break;
        }
        sinkCounter.incrementEventDrainAttemptCount();
        client.write(toMessage(event));
      }
      if (i == batchSize) {
        sinkCounter.incrementBatchCompleteCount();
      }

      txn.commit();
      sinkCounter.addToEventDrainSuccessCount(i);
    } catch (SyslogException e) {
      txn.rollback();
      sinkCounter.incrementConnectionFailedCount();
      throw new EventDeliveryException("Failed to deliver events to syslog",
          e);
    } catch (RuntimeException e) {
      txn.rollback();
      throw new EventDeliveryException("Failed to process transaction", e);
    } finally {
      txn.close();
    }

    return result;
  }

  SyslogMessage toMessage(Event event) {
    Map<String, String> headers = event.getHeaders();
    SyslogMessage.Builder builder = SyslogMessage.builder()
        .facility(facility)
        .severity(severity)
        .id(headers.get(messageIdHeader))
        .structuredData(headers.get(structuredDataHeader))
        .body(new String(event.getBody(), StandardCharsets.UTF_8));

    String value = headers.get(facilityHeader);
    if (value != null) {
      Facility f = parseFacility(value);
      if (f == null) {
        logger.warn("unknown facility header '{}', using {}", value, facility);
      } else {
        builder.facility(f);
      }
    }
    value = headers.get(severityHeader);
    if (value != null) {
      Severity s = parseSeverity(value);
      if (s == null) {
        logger.warn("unknown severity header '{}', using {}", value, severity);
      } else {
        builder.severity(s);
      }
    }
    value = headers.get(timestampHeader);
    if (value != null) {
      try {
        builder.time(ZonedDateTime.ofInstant(
            Instant.ofEpochMilli(Long.parseLong(value)),
            ZoneId.systemDefault()));
      } catch (NumberFormatException e) {
        logger.warn("invalid timestamp header '{}', using current time", value);
      }
    }
    return builder.build();
  }

  /** @return null when the value is neither a facility name nor a code */
  static Facility parseFacility(String value) {
    try {
      return Facility.parse(value.trim());
    } catch (FacilityParseException e) {
      try {
        return Facility.valueOf(Integer.parseInt(value.trim()));
      } catch (IllegalArgumentException notNumeric) {
        return null;
      }
    }
  }

  /** @return null when the value is neither a severity name nor a code */
  static Severity parseSeverity(String value) {
    try {
      return Severity.parse(value.trim());
    } catch (SeverityParseException e) {
      try {
        return Severity.valueOf(Integer.parseInt(value.trim()));
      } catch (IllegalArgumentException notNumeric) {
        return null;
      }
    }
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unsupported " +
          type.getSimpleName().toLowerCase(Locale.ROOT) + ": " + value, e);
    }
  }

  SyslogClient getClient() {
    return client;
  }
}
