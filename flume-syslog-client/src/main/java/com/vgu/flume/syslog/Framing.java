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
 * Message framing for byte-stream transports (rfc6587). Datagram and local
 * socket transports always use {@link #NONE}.
 */
public enum Framing {
  AUTO,
  /** Explicit decimal length prefix. */
  LENGTH,
  DELIMITER_NUL,
  DELIMITER_LF,
  /** For UDP and UNIX sockets, which keep message boundaries. */
  NONE;

  public Framing resolve(boolean needsFraming) {
    if (!needsFraming) {
      return NONE;
    }
    return this == AUTO ? DELIMITER_NUL : this;
  }
}
