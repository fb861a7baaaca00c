package com.standings.harvester.harvest.util;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_UNEXPECTED_STATUS = "HTTP_UNEXPECTED_STATUS";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String CONNECTION_FAILURE = "CONNECTION_FAILURE";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String UNREADABLE_BODY = "UNREADABLE_BODY";
  public static final String MISSING_RESULTS = "MISSING_RESULTS";
  public static final String OUTPUT_WRITE_FAILED = "OUTPUT_WRITE_FAILED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(int status) {
    if (status <= 0) {
      return UNKNOWN;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    return HTTP_UNEXPECTED_STATUS;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.equals("invalid_url")) {
      return INVALID_URL;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("unresolvedaddress")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return CONNECTION_FAILURE;
    }
    return UNKNOWN;
  }

  public static boolean isServerError(int status) {
    return status >= 500 && status < 600;
  }
}
