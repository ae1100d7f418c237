package com.cinemaregistry.scrape.util;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String CONNECTION_FAILURE = "CONNECTION_FAILURE";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  /**
   * Maps a failure reason as recorded in the error log back to a stable code.
   * Reasons look like {@code "<error_code>: <message>"} or
   * {@code "http_status: <status>"}.
   */
  public static String fromFailureReason(String reason) {
    if (reason == null || reason.isBlank()) {
      return UNKNOWN;
    }
    String lower = reason.toLowerCase(Locale.ROOT);
    if (lower.startsWith("http_status:")) {
      try {
        return fromHttpStatus(Integer.parseInt(lower.substring("http_status:".length()).trim()));
      } catch (NumberFormatException e) {
        return UNKNOWN;
      }
    }
    if (lower.startsWith("parsing_failed")) {
      return PARSING_FAILED;
    }
    if (lower.startsWith("interrupted")) {
      return INTERRUPTED;
    }
    if (lower.contains("timeout") || lower.contains("timed out")) {
      return TIMEOUT;
    }
    if (lower.contains("unknownhost")
        || lower.contains("name or service not known")
        || lower.contains("no such host")) {
      return DNS_FAILURE;
    }
    if (lower.contains("ssl") || lower.contains("handshake")) {
      return TLS_FAILURE;
    }
    if (lower.startsWith("io_error")) {
      return CONNECTION_FAILURE;
    }
    return UNKNOWN;
  }
}
