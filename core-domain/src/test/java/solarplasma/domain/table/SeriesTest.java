package solarplasma.domain.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import solarplasma.domain.exception.SchemaViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SeriesTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    private static TimeIndex minutes(int rows) {
        Instant[] epochs = new Instant[rows];
        for (int i = 0; i < rows; i++) {
            epochs[i] = T0.plusSeconds(60L * i);
        }
        return TimeIndex.of(epochs);
    }

    @Test
    @DisplayName("La aritmética propaga NaN: un hueco nunca se convierte en número")
    void arithmetic_shouldPropagateNaN() {
        // ARRANGE
        TimeIndex index = minutes(3);
        Series a = Series.of(index, "a", 1.0, Double.NaN, 3.0);
        Series b = Series.of(index, "b", 10.0, 20.0, Double.NaN);

        // ACT
        Series sum = a.plus(b);
        Series total = Series.sum(List.of(a, b));

        // ASSERT
        assertThat(sum.get(0)).isEqualTo(11.0);
        assertThat(sum.isMissing(1)).isTrue();
        assertThat(sum.isMissing(2)).isTrue();
        assertThat(total).isEqualTo(sum);
    }

    @Test
    @DisplayName("Operar series con índices distintos es un error de esquema")
    void zip_whenIndexesDiffer_shouldThrow() {
        Series a = Series.of(minutes(2), "a", 1.0, 2.0);
        Series b = Series.of(TimeIndex.of(T0, T0.plusSeconds(1)), "b", 1.0, 2.0);

        assertThatThrownBy(() -> a.plus(b)).isInstanceOf(SchemaViolationException.class);
    }

    @Test
    @DisplayName("El número de valores debe coincidir con el índice")
    void of_whenLengthMismatch_shouldThrow() {
        assertThatThrownBy(() -> Series.of(minutes(3), "x", 1.0, 2.0))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("3 filas");
    }

    @Test
    @DisplayName("toArray devuelve una copia: modificarla no altera la serie")
    void toArray_shouldReturnDefensiveCopy() {
        Series s = Series.of(minutes(2), "s", 1.0, 2.0);

        double[] copy = s.toArray();
        copy[0] = 99.0;

        assertThat(s.get(0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Media móvil cerrada por la derecha que ignora NaN dentro de la ventana")
    void rollingMean_shouldAverageRightClosedWindow() {
        // ARRANGE
        Series s = Series.of(minutes(4), "s", 1.0, 2.0, Double.NaN, 4.0);

        // ACT
        Series mean = s.rollingMean(Duration.ofMinutes(2), 1);

        // ASSERT
        // Fila 3 abarca (1 min, 3 min]: el valor de t = 1 min queda fuera.
        assertThat(mean.toArray()).containsExactly(1.0, 1.5, 2.0, 4.0);
    }

    @Test
    @DisplayName("Media móvil con menos valores válidos que minPeriods da NaN")
    void rollingMean_withMinPeriods_shouldYieldNaN() {
        Series s = Series.of(minutes(4), "s", 1.0, 2.0, Double.NaN, 4.0);

        Series mean = s.rollingMean(Duration.ofMinutes(2), 2);

        assertThat(mean.isMissing(0)).isTrue();
        assertThat(mean.get(1)).isCloseTo(1.5, within(1e-12));
        assertThat(mean.isMissing(2)).isTrue();
        assertThat(mean.isMissing(3)).isTrue();
    }

    @Test
    @DisplayName("La media móvil exige un índice monótono creciente")
    void rollingMean_whenIndexUnsorted_shouldThrow() {
        TimeIndex unsorted = TimeIndex.of(T0.plusSeconds(60), T0);
        Series s = Series.of(unsorted, "s", 1.0, 2.0);

        assertThatThrownBy(() -> s.rollingMean(Duration.ofMinutes(1), 1))
                .isInstanceOf(SchemaViolationException.class);
    }

    @Test
    @DisplayName("Las estadísticas sólo cuentan los valores presentes")
    void statistics_shouldSkipMissingValues() {
        Series s = Series.of(minutes(3), "s", 2.0, Double.NaN, 4.0);

        assertThat(s.statistics().getCount()).isEqualTo(2);
        assertThat(s.statistics().getAverage()).isEqualTo(3.0);
        assertThat(s.missingCount()).isEqualTo(1);
    }
}
