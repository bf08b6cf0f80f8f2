package com.example.resilience.circuitbreaker;

import com.example.resilience.exception.AuthorizationException;
import com.example.resilience.exception.OperationTimeoutException;
import com.example.resilience.exception.TransportException;
import com.example.resilience.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultErrorFilterTest {

    private final DefaultErrorFilter filter = DefaultErrorFilter.INSTANCE;

    @Test
    void callerErrorsAreIgnored() {
        assertThat(filter.test(new ValidationException("invalid payload"))).isFalse();
        assertThat(filter.test(AuthorizationException.unauthorized("missing token"))).isFalse();
        assertThat(filter.test(AuthorizationException.forbidden("not allowed"))).isFalse();
        assertThat(filter.test(new ResponseStatusException(HttpStatus.BAD_REQUEST))).isFalse();
    }

    @Test
    void serviceErrorsCount() {
        assertThat(filter.test(new TransportException("connection reset"))).isTrue();
        assertThat(filter.test(new OperationTimeoutException("slow", 2000))).isTrue();
        assertThat(filter.test(new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR))).isTrue();
        assertThat(filter.test(new IllegalStateException("boom"))).isTrue();
    }

    @Test
    void wrappedCallerErrorIsIgnored() {
        RuntimeException wrapped = new RuntimeException("rpc failed",
                new ValidationException("email is required"));

        assertThat(filter.test(wrapped)).isFalse();
    }
}
