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
 * SYSLOG protocol variant.
 *
 * <pre>
 * Feature          V0_LOCAL  V0_NET  V1_NET
 * ---------------  --------  ------  ------
 * Timestamp        Old       Old     New
 * Hostname                   X       X
 * Message ID                         X
 * Structured Data                    X
 * </pre>
 */
public enum Protocol {
  /** Select automatically from the connected transport. */
  AUTO,
  /** Old timestamps, no hostname field. Used with local daemon sockets. */
  V0_LOCAL,
  /** rfc3164: old timestamps and a hostname field. */
  V0_NET,
  /** rfc5424. */
  V1_NET;

  public Protocol resolve(boolean localSocket) {
    if (this != AUTO) {
      return this;
    }
    return localSocket ? V0_LOCAL : V1_NET;
  }
}
