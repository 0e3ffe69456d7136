//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.util;

import java.nio.charset.StandardCharsets;

/**
 * Bob Jenkins' one-at-a-time hash, widened to 64 bits.
 *
 * <p>Maps variable-length recipient and group identifiers onto the fixed-size fields of the
 * in-memory stores' composite keys. This is not a cryptographic hash: distinct identifiers may
 * collide, and a collision makes two recipients share store entries.
 *
 * @see <a href="http://www.burtleburtle.net/bob/hash/doobs.html">doobs.html</a>
 */
public final class JenkinsHash {

  private JenkinsHash() {}

  public static long hash(byte[] key) {
    return hash(key, 0, key.length);
  }

  public static long hash(String key) {
    return hash(key.getBytes(StandardCharsets.UTF_8));
  }

  public static long hash(byte[] key, int offset, int length) {
    long hash = 0;
    for (int i = offset; i < offset + length; i++) {
      // Bytes are added sign-extended.
      hash += key[i];
      hash += (hash << 10);
      hash ^= (hash >>> 6);
    }
    hash += (hash << 3);
    hash ^= (hash >>> 11);
    hash += (hash << 15);
    return hash;
  }
}
