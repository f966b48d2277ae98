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

/** Unknown severity name; falls back to {@link Severity#FALLBACK}. */
public class SeverityParseException extends SyslogParseException {
  public SeverityParseException(String name) {
    super("bad severity string: " + name);
  }

  @Override
  public Severity getFallback() {
    return Severity.FALLBACK;
  }
}
