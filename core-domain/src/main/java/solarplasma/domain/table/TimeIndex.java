package solarplasma.domain.table;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Índice temporal inmutable de una tabla de medidas.
 * <p>
 * Se espera monótono creciente, pero no se exige: un índice desordenado suele
 * indicar datos malos y sólo se avisa en el log de quien lo consume.
 */
public final class TimeIndex {

    private final Instant[] epochs;

    private TimeIndex(Instant[] epochs) {
        for (Instant epoch : epochs) {
            Objects.requireNonNull(epoch, "El índice temporal no puede contener valores nulos.");
        }
        this.epochs = epochs;
    }

    public static TimeIndex of(Instant... epochs) {
        return new TimeIndex(epochs.clone());
    }

    public static TimeIndex of(List<Instant> epochs) {
        return new TimeIndex(epochs.toArray(new Instant[0]));
    }

    public int size() {
        return epochs.length;
    }

    public boolean isEmpty() {
        return epochs.length == 0;
    }

    public Instant get(int row) {
        return epochs[row];
    }

    public List<Instant> toList() {
        return List.of(epochs);
    }

    public Instant first() {
        return epochs.length == 0 ? null : epochs[0];
    }

    public Instant last() {
        return epochs.length == 0 ? null : epochs[epochs.length - 1];
    }

    public boolean isMonotonicIncreasing() {
        for (int i = 1; i < epochs.length; i++) {
            if (epochs[i].isBefore(epochs[i - 1])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Filas cuyo instante cae en [start, stop]. Cualquiera de los dos extremos puede ser nulo (sin límite).
     */
    public int[] rowsBetween(Instant start, Instant stop) {
        return IntStream.range(0, epochs.length)
                .filter(i -> start == null || !epochs[i].isBefore(start))
                .filter(i -> stop == null || !epochs[i].isAfter(stop))
                .toArray();
    }

    public TimeIndex select(int[] rows) {
        Instant[] subset = new Instant[rows.length];
        for (int i = 0; i < rows.length; i++) {
            subset[i] = epochs[rows[i]];
        }
        return new TimeIndex(subset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(epochs, ((TimeIndex) o).epochs);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(epochs);
    }

    @Override
    public String toString() {
        return "TimeIndex[" + epochs.length + " filas, " + first() + " .. " + last() + "]";
    }
}
