//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.state;

import java.util.Arrays;
import java.util.Objects;

/** A serialized local signed pre-key. */
public class SignedPreKeyRecord {

  private final byte[] serialized;

  public SignedPreKeyRecord(byte[] serialized) {
    this.serialized = Objects.requireNonNull(serialized, "serialized").clone();
  }

  public byte[] serialize() {
    return serialized.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof SignedPreKeyRecord)) return false;

    return Arrays.equals(serialized, ((SignedPreKeyRecord) other).serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
