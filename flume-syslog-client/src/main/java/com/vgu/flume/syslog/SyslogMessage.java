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

import java.time.ZonedDateTime;

/**
 * One SYSLOG message. The message ID and structured data are written as
 * given; the caller is responsible for keeping delimiters out of them.
 */
public final class SyslogMessage {
  private final ZonedDateTime time;
  private final Severity severity;
  private final Facility facility;
  private final String id;
  private final String body;
  private final String structuredData;

  private SyslogMessage(Builder builder) {
    this.time = builder.time;
    this.severity = builder.severity;
    this.facility = builder.facility;
    this.id = builder.id;
    this.body = builder.body;
    this.structuredData = builder.structuredData;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** @return the timestamp, or null to use the time of writing */
  public ZonedDateTime getTime() {
    return time;
  }

  public Severity getSeverity() {
    return severity;
  }

  public Facility getFacility() {
    return facility;
  }

  /**
   * For protocols without a message ID field this is prepended to the body,
   * followed by a space.
   */
  public String getId() {
    return id;
  }

  public String getBody() {
    return body;
  }

  /** Pre-encoded rfc5424 structured data, only used by V1_NET. */
  public String getStructuredData() {
    return structuredData;
  }

  public int getPriority() {
    return Priority.of(severity, facility);
  }

  public static class Builder {
    private ZonedDateTime time;
    private Severity severity = Severity.NOTICE;
    private Facility facility = Facility.USER;
    private String id = "";
    private String body = "";
    private String structuredData = "";

    public Builder time(ZonedDateTime time) {
      this.time = time;
      return this;
    }

    public Builder severity(Severity severity) {
      this.severity = Preconditions.checkNotNull(severity, "severity");
      return this;
    }

    public Builder facility(Facility facility) {
      this.facility = Preconditions.checkNotNull(facility, "facility");
      return this;
    }

    public Builder id(String id) {
      this.id = id == null ? "" : id;
      return this;
    }

    public Builder body(String body) {
      this.body = body == null ? "" : body;
      return this;
    }

    public Builder structuredData(String structuredData) {
      this.structuredData = structuredData == null ? "" : structuredData;
      return this;
    }

    public SyslogMessage build() {
      return new SyslogMessage(this);
    }
  }
}
