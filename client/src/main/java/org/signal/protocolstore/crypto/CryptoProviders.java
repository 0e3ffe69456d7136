//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.crypto;

import java.util.Locale;
import org.signal.protocolstore.crypto.bc.BouncyCastleCryptoProvider;
import org.signal.protocolstore.crypto.jce.JceCryptoProvider;
import org.signal.protocolstore.logging.Log;

/**
 * Chooses a {@link CryptoProvider} implementation by name.
 *
 * <p>The default is read from the {@value #ENVIRONMENT_VARIABLE} environment variable, then from
 * the {@value #PROPERTY_NAME} system property, and falls back to {@value #JCE}.
 */
public final class CryptoProviders {

  private static final String TAG = CryptoProviders.class.getSimpleName();

  public static final String ENVIRONMENT_VARIABLE = "SIGNAL_CRYPTO_PROVIDER";
  public static final String PROPERTY_NAME = "org.signal.protocolstore.crypto.provider";

  public static final String JCE = "jce";
  public static final String BOUNCY_CASTLE = "bouncycastle";

  private CryptoProviders() {}

  public static CryptoProvider getDefault() {
    return forName(getConfiguredName());
  }

  /**
   * @param name {@value #JCE} or {@value #BOUNCY_CASTLE}, case-insensitive.
   * @throws IllegalArgumentException for any other name.
   */
  public static CryptoProvider forName(String name) {
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case JCE:
        return new JceCryptoProvider();
      case BOUNCY_CASTLE:
        return new BouncyCastleCryptoProvider();
      default:
        throw new IllegalArgumentException("unknown crypto provider: " + name);
    }
  }

  static String getConfiguredName() {
    String name = System.getenv(ENVIRONMENT_VARIABLE);
    if (name == null || name.isEmpty()) {
      name = System.getProperty(PROPERTY_NAME, JCE);
    }
    Log.d(TAG, "Using crypto provider " + name);
    return name;
  }
}
