package com.example.resilience.utils;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Utilidades para operaciones reactivas comunes
 */
public final class ReactiveUtils {

    private ReactiveUtils() {
        // Utility class
    }

    /**
     * Ejecuta la operación con las claves indicadas en el MDC y las retira al terminar.
     * Las claves con valor nulo se ignoran.
     */
    public static <T> Mono<T> withDiagnosticContext(Map<String, String> context, Supplier<Mono<T>> operation) {
        return Mono.fromCallable(() -> {
                    context.forEach((key, value) -> {
                        if (value != null) {
                            MDC.put(key, value);
                        }
                    });
                    return true;
                })
                .flatMap(ignored -> operation.get())
                .doFinally(signal -> context.keySet().forEach(MDC::remove));
    }

    /**
     * Mide la duración del Mono en un Timer con tag status=success|failed (y error_type en fallos).
     */
    public static <T> Mono<T> withMetrics(Mono<T> mono, MeterRegistry meterRegistry, String metricName, Tag... tags) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            return mono
                    .doOnSuccess(value -> sample.stop(meterRegistry.timer(metricName, withTag(tags, "status", "success"))))
                    .doOnError(error -> {
                        List<Tag> failedTags = withTag(tags, "status", "failed");
                        failedTags.add(Tag.of("error_type", error.getClass().getSimpleName()));
                        sample.stop(meterRegistry.timer(metricName, failedTags));
                    });
        });
    }

    public static <T> Mono<T> withContextAndMetrics(
            Map<String, String> context,
            Supplier<Mono<T>> operation,
            MeterRegistry meterRegistry,
            String metricName,
            Tag... tags) {

        return withDiagnosticContext(context, () ->
                withMetrics(operation.get(), meterRegistry, metricName, tags));
    }

    /**
     * Crea un mapa de contexto para diagnóstico a partir de pares clave/valor
     */
    public static Map<String, String> createContext(String... keyValuePairs) {
        if (keyValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Key-value pairs must be even");
        }

        Map<String, String> context = new LinkedHashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            context.put(keyValuePairs[i], keyValuePairs[i + 1]);
        }
        return context;
    }

    private static List<Tag> withTag(Tag[] tags, String key, String value) {
        List<Tag> result = new ArrayList<>(Arrays.asList(tags));
        result.add(Tag.of(key, value));
        return result;
    }
}
