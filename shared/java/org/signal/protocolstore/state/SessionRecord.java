//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state;

import java.util.Arrays;
import java.util.Objects;

/**
 * The ratchet state for one remote device's session.
 *
 * <p>The contents are serialized by the protocol engine and never interpreted here. Both the
 * constructor and {@link #serialize()} copy, so a record never shares its bytes with a caller.
 */
public class SessionRecord {

  private final byte[] serialized;

  public SessionRecord(byte[] serialized) {
    this.serialized = Objects.requireNonNull(serialized, "serialized").clone();
  }

  public byte[] serialize() {
    return serialized.clone();
  }

  public int size() {
    return serialized.length;
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof SessionRecord)) return false;

    return Arrays.equals(serialized, ((SessionRecord) other).serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
