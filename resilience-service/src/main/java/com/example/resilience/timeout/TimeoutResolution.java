package com.example.resilience.timeout;

import lombok.Builder;
import lombok.Value;

/**
 * Timeout efectivo de una llamada junto con el origen del valor.
 * originalTimeout y scaleFactor sólo se informan si se aplicó escalado.
 */
@Value
@Builder
public class TimeoutResolution {
    long timeout;
    TimeoutSource source;
    ServiceTier tier;
    boolean scaled;
    Double scaleFactor;
    Long originalTimeout;
}
