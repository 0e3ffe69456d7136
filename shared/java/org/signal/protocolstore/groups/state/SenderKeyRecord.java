//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.groups.state;

import java.util.Arrays;
import java.util.Objects;

/**
 * The sender key state for one (group, sender, device) triple.
 *
 * <p>The contents are serialized by the protocol engine and never interpreted here. Both the
 * constructor and {@link #serialize()} copy, so a record never shares its bytes with a caller.
 */
public class SenderKeyRecord {

  private final byte[] serialized;

  public SenderKeyRecord(byte[] serialized) {
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
    if (!(other instanceof SenderKeyRecord)) return false;

    return Arrays.equals(serialized, ((SenderKeyRecord) other).serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
