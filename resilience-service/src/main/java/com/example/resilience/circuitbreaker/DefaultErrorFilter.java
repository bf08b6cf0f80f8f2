package com.example.resilience.circuitbreaker;

import com.example.resilience.exception.AuthorizationException;
import com.example.resilience.exception.StatusAware;
import com.example.resilience.exception.ValidationException;
import org.springframework.web.server.ResponseStatusException;

import java.util.function.Predicate;

/**
 * Decide si un error cuenta como fallo del servicio destino.
 * Los errores del llamante (validación, 400, 401, 403) no cuentan.
 */
public final class DefaultErrorFilter implements Predicate<Throwable> {

    public static final DefaultErrorFilter INSTANCE = new DefaultErrorFilter();

    private static final int MAX_CAUSE_DEPTH = 10;

    private DefaultErrorFilter() {
    }

    @Override
    public boolean test(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (isCallerError(current)) {
                return false;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return true;
    }

    static boolean isCallerError(Throwable error) {
        if (error instanceof ValidationException || error instanceof AuthorizationException) {
            return true;
        }
        if (error instanceof StatusAware) {
            return isCallerStatus(((StatusAware) error).getStatusCode());
        }
        if (error instanceof ResponseStatusException) {
            return isCallerStatus(((ResponseStatusException) error).getStatusCode().value());
        }
        return false;
    }

    private static boolean isCallerStatus(int status) {
        return status == 400 || status == 401 || status == 403;
    }
}
