package com.flamingo.ai.contextengine.service.embedding;

import com.flamingo.ai.contextengine.exception.ProviderClientException;
import com.flamingo.ai.contextengine.exception.ProviderRateLimitedException;
import com.flamingo.ai.contextengine.exception.ProviderUnavailableException;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps LangChain4j and Resilience4j failures onto the engine's provider exceptions.
 *
 * <p>Client errors (4xx other than 429) become {@link ProviderClientException} and are never
 * retried. Rate limits become {@link ProviderRateLimitedException}. Everything else is treated as
 * a transient outage.
 *
 * <p>The provider's retry hint ({@code Retry-After: 7} or OpenAI's "Please try again in 1.5s") is
 * read from the error messages along the cause chain; without one the caller waits one second.
 */
public final class ProviderErrorTranslator {

  static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);
  static final Duration MAX_RETRY_AFTER = Duration.ofMinutes(1);

  private static final Pattern RETRY_HINT =
      Pattern.compile(
          "(?:retry-after\\W*|try again in\\s*)(\\d+(?:\\.\\d+)?)\\s*(ms|s|sec|seconds?)?\\b",
          Pattern.CASE_INSENSITIVE);

  private ProviderErrorTranslator() {}

  public static RuntimeException translate(String operation, Throwable error) {
    if (error instanceof ProviderClientException
        || error instanceof ProviderRateLimitedException
        || error instanceof ProviderUnavailableException) {
      return (RuntimeException) error;
    }
    if (error instanceof RateLimitException) {
      return new ProviderRateLimitedException(
          operation + " rate limited: " + error.getMessage(), retryAfter(error), error);
    }
    if (error instanceof AuthenticationException) {
      return new ProviderClientException(
          operation + " authentication failed: " + error.getMessage(), 401, error);
    }
    if (error instanceof ModelNotFoundException) {
      return new ProviderClientException(
          operation + " model not found: " + error.getMessage(), 404, error);
    }
    if (error instanceof InvalidRequestException) {
      return new ProviderClientException(
          operation + " invalid request: " + error.getMessage(), 400, error);
    }
    if (error instanceof HttpException httpException) {
      int status = httpException.statusCode();
      if (status == 429) {
        return new ProviderRateLimitedException(
            operation + " rate limited: " + error.getMessage(), retryAfter(error), error);
      }
      if (status >= 400 && status < 500) {
        return new ProviderClientException(
            operation + " rejected with status " + status + ": " + error.getMessage(),
            status,
            error);
      }
    }
    if (error instanceof CallNotPermittedException) {
      return new ProviderUnavailableException(operation + " circuit open", error);
    }
    if (error instanceof BulkheadFullException) {
      return new ProviderUnavailableException(operation + " concurrency limit reached", error);
    }
    return new ProviderUnavailableException(operation + " failed: " + error.getMessage(), error);
  }

  /** Retry hint found in the error or its causes, capped at one minute. */
  static Duration retryAfter(Throwable error) {
    for (Throwable current = error; current != null; current = current.getCause()) {
      if (current.getMessage() == null) {
        continue;
      }
      Matcher matcher = RETRY_HINT.matcher(current.getMessage());
      if (matcher.find()) {
        double amount = Double.parseDouble(matcher.group(1));
        long millis =
            "ms".equalsIgnoreCase(matcher.group(2)) ? (long) amount : (long) (amount * 1000);
        Duration hint = Duration.ofMillis(Math.max(millis, 1));
        return hint.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : hint;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return DEFAULT_RETRY_AFTER;
  }
}
