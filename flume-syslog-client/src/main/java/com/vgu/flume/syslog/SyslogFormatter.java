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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * Renders one message into the bytes of a protocol variant, framing and BOM
 * policy. Output depends on the arguments only; the scratch buffer is reset
 * on every call, so an instance must not be shared between threads.
 */
public class SyslogFormatter {
  private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
  private static final String NIL = "-";

  /** rfc3164 timestamp, e.g. {@code "Oct  1 07:25:00"}. */
  static final DateTimeFormatter LEGACY_TIMESTAMP =
      DateTimeFormatter.ofPattern("MMM ppd HH:mm:ss", Locale.ENGLISH);

  /** rfc3339 timestamp with trailing zeros of the fraction trimmed. */
  static final DateTimeFormatter RFC3339_TIMESTAMP =
      new DateTimeFormatterBuilder()
          .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .appendOffset("+HH:MM", "Z")
          .toFormatter(Locale.ENGLISH);

  private final ByteArrayOutputStream scratch = new ByteArrayOutputStream(256);

  public byte[] format(ResolvedFormat fmt, int pri, ZonedDateTime timestamp,
                       int processId, String messageId, String body,
                       String structuredData) {
    return format(fmt.getProtocol(), fmt.getFraming(), fmt.getBomMode(), pri,
        timestamp, fmt.getHostName(), fmt.getProcessName(), processId,
        messageId, body, structuredData);
  }

  public byte[] format(Protocol protocol, Framing framing, BomMode bomMode,
                       int pri, ZonedDateTime timestamp, String hostName,
                       String processName, int processId, String messageId,
                       String body, String structuredData) {
    scratch.reset();
    hostName = orNil(hostName);
    processName = orNil(processName);
    structuredData = orNil(structuredData);
    messageId = messageId == null ? "" : messageId;
    body = body == null ? "" : body;

    StringBuilder head = new StringBuilder(64);
    head.append('<').append(pri).append('>');
    switch (protocol) {
      case V0_LOCAL:
      case V0_NET:
        head.append(LEGACY_TIMESTAMP.format(timestamp)).append(' ');
        if (protocol == Protocol.V0_NET) {
          head.append(hostName).append(' ');
        }
        head.append(processName).append('[').append(processId).append("]: ");
        put(head);
        putBom(bomMode);
        // no message ID field in v0, it is folded into the body
        if (messageId.length() > 0) {
          put(messageId);
          scratch.write(' ');
        }
        break;
      case V1_NET:
        head.append("1 ")
            .append(RFC3339_TIMESTAMP.format(timestamp)).append(' ')
            .append(hostName).append(' ')
            .append(processName).append(' ')
            .append(processId).append(' ')
            .append(messageId.length() == 0 ? NIL : messageId).append(' ')
            .append(structuredData).append(' ');
        put(head);
        putBom(bomMode);
        break;
      default:
        throw new IllegalArgumentException("unresolved syslog protocol: " +
            protocol);
    }
    put(body);

    switch (framing) {
      case DELIMITER_NUL:
        scratch.write(0);
        break;
      case DELIMITER_LF:
        scratch.write('\n');
        break;
      default:
        break;
    }

    byte[] payload = scratch.toByteArray();
    if (framing != Framing.LENGTH) {
      return payload;
    }
    byte[] prefix = (payload.length + " ").getBytes(StandardCharsets.US_ASCII);
    byte[] framed = new byte[prefix.length + payload.length];
    System.arraycopy(prefix, 0, framed, 0, prefix.length);
    System.arraycopy(payload, 0, framed, prefix.length, payload.length);
    return framed;
  }

  /** Formats and hands the whole message to {@code out} in one write. */
  public void formatTo(OutputStream out, ResolvedFormat fmt, int pri,
                       ZonedDateTime timestamp, int processId,
                       String messageId, String body, String structuredData)
      throws IOException {
    out.write(format(fmt, pri, timestamp, processId, messageId, body,
        structuredData));
  }

  private void put(CharSequence s) {
    byte[] b = s.toString().getBytes(StandardCharsets.UTF_8);
    scratch.write(b, 0, b.length);
  }

  private void putBom(BomMode bomMode) {
    if (bomMode == BomMode.ALWAYS) {
      scratch.write(BOM, 0, BOM.length);
    }
  }

  private static String orNil(String s) {
    return s == null || s.length() == 0 ? NIL : s;
  }
}
