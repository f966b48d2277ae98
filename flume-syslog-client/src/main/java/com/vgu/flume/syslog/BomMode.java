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

/** Whether a UTF-8 BOM is placed before every message body. */
public enum BomMode {
  /** BOM for {@link Protocol#V1_NET} only. */
  AUTO,
  ALWAYS,
  NEVER;

  public BomMode resolve(Protocol protocol) {
    if (this != AUTO) {
      return this;
    }
    return protocol == Protocol.V1_NET ? ALWAYS : NEVER;
  }
}
