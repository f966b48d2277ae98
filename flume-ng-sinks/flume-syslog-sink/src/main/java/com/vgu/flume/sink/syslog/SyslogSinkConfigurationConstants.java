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

/**
 * Configuration keys of {@link SyslogSink}. Facility and severity values may
 * be names ("daemon", "warning") or numeric codes.
 */
public class SyslogSinkConfigurationConstants {
  /**
   * "network:address", e.g. "udp:192.0.2.1", "tcp://logs:514" or
   * "unixgram:/dev/log". Takes precedence over {@link #NETWORK} and
   * {@link #ADDRESS}. If nothing is set the local syslog daemon is used.
   */
  public static final String TARGET = "target";
  public static final String NETWORK = "network";
  public static final String ADDRESS = "address";

  /** "auto", "v0_local", "v0_net" or "v1_net", defaults to "auto" */
  public static final String PROTOCOL = "protocol";
  public static final String DEFAULT_PROTOCOL = "auto";

  /** "auto", "length", "delimiter_nul", "delimiter_lf" or "none" */
  public static final String FRAMING = "framing";
  public static final String DEFAULT_FRAMING = "auto";

  /** "auto", "always" or "never" */
  public static final String BOM = "bom";
  public static final String DEFAULT_BOM = "auto";

  /** defaults to the local host name */
  public static final String HOST_NAME = "hostName";

  /** defaults to the sink name */
  public static final String PROCESS_NAME = "processName";

  /** defaults to (1)user-level messages */
  public static final String FACILITY = "facility";
  public static final String DEFAULT_FACILITY = "user";

  /** defaults to (5)Notice: normal but significant condition */
  public static final String SEVERITY = "severity";
  public static final String DEFAULT_SEVERITY = "notice";

  /** event header overriding the facility */
  public static final String FACILITY_HEADER = "key.facility";
  public static final String DEFAULT_FACILITY_HEADER = "Facility";

  /** event header overriding the severity */
  public static final String SEVERITY_HEADER = "key.severity";
  public static final String DEFAULT_SEVERITY_HEADER = "Severity";

  public static final String MESSAGE_ID_HEADER = "key.msgId";
  public static final String DEFAULT_MESSAGE_ID_HEADER = "msgId";

  public static final String STRUCTURED_DATA_HEADER = "key.structuredData";
  public static final String DEFAULT_STRUCTURED_DATA_HEADER = "structuredData";

  /** epoch milliseconds, as set by Flume's timestamp interceptor */
  public static final String TIMESTAMP_HEADER = "key.timestamp";
  public static final String DEFAULT_TIMESTAMP_HEADER = "timestamp";

  /** first reconnect delay in milliseconds, defaults to 5000 */
  public static final String BACKOFF_INITIAL_DELAY = "backoff.initialDelay";

  /** reconnect delay cap in milliseconds, defaults to 120000 */
  public static final String BACKOFF_MAX_DELAY = "backoff.maxDelay";

  /** milliseconds allowed for establishing a connection, defaults to 10000 */
  public static final String CONNECT_TIMEOUT = "connectTimeout";

  /** how many events are processed in one transaction, defaults to 100 */
  public static final String BATCH_SIZE = "batchSize";
  public static final int DEFAULT_BATCH_SIZE = 100;
}
