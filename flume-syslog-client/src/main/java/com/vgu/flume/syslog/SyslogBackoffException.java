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

/**
 * Raised when a reconnect is requested before the backoff window has passed.
 * No I/O is performed in that case.
 */
public class SyslogBackoffException extends SyslogException {
  private final long notBeforeMillis;

  public SyslogBackoffException(long notBeforeMillis) {
    super("syslog client is waiting to reconnect");
    this.notBeforeMillis = notBeforeMillis;
  }

  /** @return epoch millis before which no reconnect will be attempted */
  public long getNotBeforeMillis() {
    return notBeforeMillis;
  }
}
