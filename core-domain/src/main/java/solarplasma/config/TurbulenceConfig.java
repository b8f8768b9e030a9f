package solarplasma.config;

import lombok.Builder;
import lombok.With;

import java.time.Duration;
import java.util.Objects;

/**
 * Parámetros del promedio móvil con el que se extraen las fluctuaciones de una
 * turbulencia alfvénica.
 *
 * @param window     Ancho temporal de la ventana. Cada fila promedia los datos en (t - window, t].
 * @param minPeriods Número mínimo de valores válidos (no NaN) en la ventana; con menos, la media es NaN.
 */
@Builder
@With
public record TurbulenceConfig(Duration window, int minPeriods) {

    public TurbulenceConfig {
        Objects.requireNonNull(window, "La ventana de promediado no puede ser nula.");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("La ventana de promediado debe ser positiva: " + window);
        }
        if (minPeriods < 1) {
            throw new IllegalArgumentException("minPeriods debe ser al menos 1: " + minPeriods);
        }
    }

    /**
     * Ventana de 15 minutos con al menos 5 medidas.
     */
    public static TurbulenceConfig getDefault() {
        return new TurbulenceConfig(Duration.ofMinutes(15), 5);
    }
}
