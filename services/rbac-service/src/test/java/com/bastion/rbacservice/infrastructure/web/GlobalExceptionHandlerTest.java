package com.bastion.rbacservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.database.StoreUnavailableException;
import com.bastion.database.StoreUnavailableException.Reason;
import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void illegalArgumentIsBadRequest() {
        ProblemDetail result =
                handler.handleIllegalArgument(new IllegalArgumentException("bad role"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("bad role");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Nested
    @DisplayName("store unavailable")
    class StoreUnavailable {

        @Test
        @DisplayName("answers 503 with the breaker's remaining cooldown, rounded up")
        void usesRetryHint() {
            var ex =
                    new StoreUnavailableException(
                            Reason.CIRCUIT_OPEN, "open", null, Duration.ofMillis(12_300));

            ResponseEntity<ProblemDetail> result = handler.handleStoreUnavailable(ex);

            assertThat(result.getStatusCode().value()).isEqualTo(503);
            assertThat(result.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("13");
            assertThat(result.getBody().getProperties()).containsEntry("reason", "CIRCUIT_OPEN");
        }

        @Test
        @DisplayName("never advertises a zero-second retry")
        void retryAfterIsAtLeastOneSecond() {
            var ex =
                    new StoreUnavailableException(
                            Reason.CIRCUIT_OPEN, "probing", null, Duration.ZERO);

            ResponseEntity<ProblemDetail> result = handler.handleStoreUnavailable(ex);

            assertThat(result.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
        }

        @Test
        @DisplayName("falls back to the default hint when the failure carries none")
        void defaultRetryHint() {
            var ex = new StoreUnavailableException(Reason.POOL_EXHAUSTED, "busy", null);

            ResponseEntity<ProblemDetail> result = handler.handleStoreUnavailable(ex);

            long defaultSeconds = GlobalExceptionHandler.DEFAULT_RETRY_AFTER.toSeconds();
            assertThat(result.getHeaders().getFirst(HttpHeaders.RETRY_AFTER))
                    .isEqualTo(Long.toString(defaultSeconds));
            assertThat(result.getBody().getDetail()).doesNotContain("busy");
        }
    }

    @Test
    @DisplayName("maps unexpected exceptions to 500 without leaking the message")
    void genericIsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("jdbc:secret-host"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("secret-host");
        assertThat(result.getProperties()).containsKey("timestamp");
    }

    @Test
    @DisplayName("keeps the status of Spring MVC's own error responses")
    void keepsFrameworkStatus() {
        ProblemDetail result =
                handler.handleGeneric(new NoResourceFoundException(HttpMethod.GET, "nowhere"));

        assertThat(result.getStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("adds the correlation ID of the current request")
    void addsCorrelationId() {
        CorrelationContextHolder.set(new CorrelationContext("corr-7", null));

        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("x"));

        assertThat(result.getProperties()).containsEntry("correlationId", "corr-7");
    }
}
