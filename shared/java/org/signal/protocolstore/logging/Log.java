//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.signal.protocolstore.logging;

import java.io.PrintWriter;
import java.io.StringWriter;

public class Log {

  private Log() {}

  public static void v(String tag, String msg) {
    log(SignalProtocolLogger.VERBOSE, tag, msg);
  }

  public static void d(String tag, String msg) {
    log(SignalProtocolLogger.DEBUG, tag, msg);
  }

  public static void i(String tag, String msg) {
    log(SignalProtocolLogger.INFO, tag, msg);
  }

  public static void w(String tag, String msg) {
    log(SignalProtocolLogger.WARN, tag, msg);
  }

  public static void w(String tag, String msg, Throwable tr) {
    log(SignalProtocolLogger.WARN, tag, msg + '\n' + getStackTraceString(tr));
  }

  public static void e(String tag, String msg) {
    log(SignalProtocolLogger.ERROR, tag, msg);
  }

  public static void e(String tag, String msg, Throwable tr) {
    log(SignalProtocolLogger.ERROR, tag, msg + '\n' + getStackTraceString(tr));
  }

  private static String getStackTraceString(Throwable tr) {
    if (tr == null) {
      return "";
    }

    StringWriter sw = new StringWriter();
    PrintWriter pw = new PrintWriter(sw);
    tr.printStackTrace(pw);
    pw.flush();
    return sw.toString();
  }

  private static void log(int priority, String tag, String msg) {
    SignalProtocolLogger logger = SignalProtocolLoggerProvider.getProvider();

    if (logger != null && priority >= SignalProtocolLoggerProvider.getMaxLevel()) {
      logger.log(priority, tag, msg);
    }
  }
}
