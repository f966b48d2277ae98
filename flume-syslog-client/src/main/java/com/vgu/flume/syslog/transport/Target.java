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
package com.vgu.flume.syslog.transport;

import com.google.common.base.Preconditions;

/** A (network, address) pair to dial. */
public final class Target {
  private final String network;
  private final String address;

  public Target(String network, String address) {
    this.network = Preconditions.checkNotNull(network, "network");
    this.address = Preconditions.checkNotNull(address, "address");
  }

  public String getNetwork() {
    return network;
  }

  public String getAddress() {
    return address;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Target)) return false;
    Target other = (Target) o;
    return network.equals(other.network) && address.equals(other.address);
  }

  @Override
  public int hashCode() {
    return 31 * network.hashCode() + address.hashCode();
  }

  @Override
  public String toString() {
    return network + ":" + address;
  }
}
