package com.feedreader.ingest.feed.util;

import com.feedreader.ingest.feed.model.HttpFetchResult;

import java.util.Locale;

public final class FetchFailureClassifier {
  public static final String EMPTY_URL = "Error loading feed - invalid (empty) URL";
  public static final String INVALID_URL = "Error loading feed - invalid URL";
  public static final String LOCAL_FILE_NOT_FOUND = "Error loading feed - local file not found";
  public static final String LOCAL_FILE_UNREADABLE = "Failed to read local RSS file";
  public static final String NETWORK_ERROR = "Error loading feed - network/DNS error";
  public static final String HTTP_ERROR_PREFIX = "Error loading feed - HTTP ";
  public static final String EMPTY_RESPONSE = "Error loading feed - empty response";
  public static final String GENERIC_ERROR = "Error loading feed";

  public static final String OFFLINE_MESSAGE = "No network connection. Check your connection and try again.";
  public static final String NO_ITEMS_MESSAGE = "No articles could be loaded from this source.";

  private FetchFailureClassifier() {}

  public static String labelFor(HttpFetchResult result) {
    if (result == null) {
      return GENERIC_ERROR;
    }
    String code = result.errorCode();
    if (code != null && !code.isBlank()) {
      String lower = code.toLowerCase(Locale.ROOT);
      if (lower.equals("invalid_url")) {
        return INVALID_URL;
      }
      if (isTransportErrorCode(lower)) {
        return NETWORK_ERROR;
      }
      return GENERIC_ERROR;
    }
    if (result.statusCode() < 200 || result.statusCode() >= 300) {
      return HTTP_ERROR_PREFIX + result.statusCode();
    }
    if (!result.hasBody()) {
      return EMPTY_RESPONSE;
    }
    return GENERIC_ERROR;
  }

  /**
   * True for failures worth pruning a locally registered feed for and for the offline banner.
   */
  public static boolean isNetworkFailure(HttpFetchResult result) {
    if (result == null) {
      return false;
    }
    String code = result.errorCode();
    if (code != null && !code.isBlank()) {
      return isTransportErrorCode(code.toLowerCase(Locale.ROOT));
    }
    return !result.isSuccessful() || !result.hasBody();
  }

  public static boolean isErrorLabel(String label) {
    if (label == null) {
      return false;
    }
    String lower = label.toLowerCase(Locale.ROOT);
    return lower.contains("error") || lower.contains("failed");
  }

  private static boolean isTransportErrorCode(String lowerCode) {
    return lowerCode.equals("dns_error")
        || lowerCode.equals("connect_error")
        || lowerCode.equals("timeout")
        || lowerCode.equals("io_error");
  }
}
