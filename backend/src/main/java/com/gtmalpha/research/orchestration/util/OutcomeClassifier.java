package com.gtmalpha.research.orchestration.util;

import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.model.HttpFetchResult;
import java.util.Locale;

public final class OutcomeClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String INVALID_REQUEST = "INVALID_REQUEST";
  public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";
  public static final String PERMANENT_REJECTION = "PERMANENT_REJECTION";
  public static final String PROVIDER_EXCEPTION = "PROVIDER_EXCEPTION";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String BUDGET_CAP_REACHED = "BUDGET_CAP_REACHED";
  public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";
  public static final String QUALITY_REJECTED = "QUALITY_REJECTED";
  public static final String RETRY_EXHAUSTED = "RETRY_EXHAUSTED";
  public static final String SINK_EXCEPTION = "SINK_EXCEPTION";
  public static final String UNKNOWN = "UNKNOWN";

  private OutcomeClassifier() {}

  public static AttemptOutcome classify(String reasonCode) {
    return isRetryable(reasonCode) ? AttemptOutcome.RETRYABLE_FAILURE : AttemptOutcome.TERMINAL_FAILURE;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, TLS_FAILURE, IO_ERROR, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }

  public static String fromFetchResult(HttpFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null && !result.errorCode().isBlank()) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    return fromHttpStatus(result.statusCode());
  }

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
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    if (status == 400 || status == 422) {
      return INVALID_REQUEST;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.contains("invalid_url")) {
      return INVALID_REQUEST;
    }
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return IO_ERROR;
    }
    return UNKNOWN;
  }
}
