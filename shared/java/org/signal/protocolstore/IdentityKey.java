//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore;

import java.util.Arrays;
import java.util.Objects;
import org.signal.protocolstore.util.Hex;

/**
 * A serialized public identity key.
 *
 * <p>The bytes are opaque to the stores; two keys are the same identity only if they are
 * byte-for-byte identical.
 */
public class IdentityKey {

  private final byte[] serialized;

  public IdentityKey(byte[] serialized) {
    this.serialized = Objects.requireNonNull(serialized, "serialized").clone();
  }

  public byte[] serialize() {
    return serialized.clone();
  }

  public int size() {
    return serialized.length;
  }

  public String getFingerprint() {
    return Hex.toStringCondensed(serialized);
  }

  @Override
  public boolean equals(Object other) {
    if (other == null) return false;
    if (!(other instanceof IdentityKey)) return false;

    return Arrays.equals(serialized, ((IdentityKey) other).serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
