package com.flamingo.ai.contextengine.exception;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    request = new MockHttpServletRequest("POST", "/api/responses");
  }

  @Test
  @DisplayName("Should map rate limiting to 429 with a Retry-After header")
  void shouldMapRateLimiting() {
    ResponseEntity<ApiError> response =
        handler.handleRateLimited(
            new ProviderRateLimitedException("429 from provider", Duration.ofMillis(200), null),
            request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.PROVIDER_RATE_LIMITED);
    assertThat(response.getBody().getPath()).isEqualTo("/api/responses");
    assertThat(response.getBody().getRetryAfterSeconds()).isEqualTo(1L);
    assertThat(meterRegistry.counter("errors", "type", "provider_rate_limited").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should omit Retry-After when the provider gave no hint")
  void shouldOmitRetryAfterWithoutHint() {
    ResponseEntity<ApiError> response =
        handler.handleRateLimited(
            new ProviderRateLimitedException("429 from provider", null, null), request);

    assertThat(response.getHeaders().containsKey(HttpHeaders.RETRY_AFTER)).isFalse();
    assertThat(response.getBody().getRetryAfterSeconds()).isNull();
  }

  @Test
  @DisplayName("Should report the provider's wait in whole seconds in header and body")
  void shouldReportRetryAfterInSeconds() {
    ResponseEntity<ApiError> response =
        handler.handleRateLimited(
            new ProviderRateLimitedException("429 from provider", Duration.ofMillis(7500), null),
            request);

    assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("7");
    assertThat(response.getBody().getRetryAfterSeconds()).isEqualTo(7L);
  }

  @Test
  @DisplayName("Should map a provider rejection to 502")
  void shouldMapProviderRejection() {
    ResponseEntity<ApiError> response =
        handler.handleProviderClient(
            new ProviderClientException("bad request", 400, null), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.PROVIDER_REJECTED);
  }

  @Test
  @DisplayName("Should map an unavailable provider to 503")
  void shouldMapProviderUnavailable() {
    ResponseEntity<ApiError> response =
        handler.handleProviderUnavailable(
            new ProviderUnavailableException("timeout", new RuntimeException("io")), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.PROVIDER_UNAVAILABLE);
  }

  @Test
  @DisplayName("Should map a failed store query to 503")
  void shouldMapStoreFailure() {
    ResponseEntity<ApiError> response =
        handler.handleStoreQueryFailed(
            new StoreQueryFailedException("recent", "connection refused"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.STORE_UNAVAILABLE);
  }

  @Test
  @DisplayName("Should map an exhausted budget to 429")
  void shouldMapBudgetExceeded() {
    ResponseEntity<ApiError> response =
        handler.handleBudgetExceeded(new BudgetExceededException("hourly", 5.2, 5.0), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    assertThat(response.getBody().getMessage()).isEqualTo("Spending budget exhausted");
  }

  @Test
  @DisplayName("Should hide internal details of unexpected errors")
  void shouldHideInternalDetails() {
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new IllegalStateException("secret state"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INTERNAL_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("secret");
    assertThat(response.getBody().getErrorId()).hasSize(8);
  }
}
