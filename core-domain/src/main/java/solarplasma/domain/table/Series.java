package solarplasma.domain.table;

import lombok.Getter;
import solarplasma.domain.exception.SchemaViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Serie temporal inmutable de valores en coma flotante alineada a un {@link TimeIndex}.
 * <p>
 * NaN es la única representación de un dato ausente. Toda la aritmética de esta
 * clase propaga NaN: nunca se sustituye un hueco por un valor numérico.
 * <p>
 * Las operaciones binarias exigen el mismo índice en ambos operandos; un índice
 * distinto es un error de esquema, no una alineación implícita.
 */
public final class Series {

    @Getter
    private final TimeIndex index;
    @Getter
    private final String name;
    private final double[] values;

    private Series(TimeIndex index, String name, double[] values) {
        Objects.requireNonNull(index, "El índice de la serie no puede ser nulo.");
        Objects.requireNonNull(values, "Los valores de la serie no pueden ser nulos.");
        if (values.length != index.size()) {
            throw new SchemaViolationException("La serie '" + name + "' tiene " + values.length
                    + " valores pero el índice tiene " + index.size() + " filas.");
        }
        this.index = index;
        this.name = name == null ? "" : name;
        this.values = values;
    }

    public static Series of(TimeIndex index, String name, double... values) {
        return new Series(index, name, values.clone());
    }

    public static Series constant(TimeIndex index, String name, double value) {
        double[] out = new double[index.size()];
        Arrays.fill(out, value);
        return new Series(index, name, out);
    }

    /**
     * Construcción sin copia para uso interno del paquete (los arrays ya son propios).
     */
    static Series wrap(TimeIndex index, String name, double[] values) {
        return new Series(index, name, values);
    }

    public int size() {
        return values.length;
    }

    public double get(int row) {
        return values[row];
    }

    public boolean isMissing(int row) {
        return Double.isNaN(values[row]);
    }

    /**
     * Copia de los valores; modificarla no afecta a la serie.
     */
    public double[] toArray() {
        return values.clone();
    }

    public Series withName(String newName) {
        return new Series(index, newName, values);
    }

    // --- Aritmética elemento a elemento ---

    public Series map(DoubleUnaryOperator op) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = op.applyAsDouble(values[i]);
        }
        return new Series(index, name, out);
    }

    public Series zip(Series other, DoubleBinaryOperator op) {
        requireAligned(other);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = op.applyAsDouble(values[i], other.values[i]);
        }
        return new Series(index, name, out);
    }

    public Series plus(Series other) {
        return zip(other, Double::sum);
    }

    public Series minus(Series other) {
        return zip(other, (a, b) -> a - b);
    }

    public Series times(Series other) {
        return zip(other, (a, b) -> a * b);
    }

    public Series dividedBy(Series other) {
        return zip(other, (a, b) -> a / b);
    }

    public Series plus(double scalar) {
        return map(v -> v + scalar);
    }

    public Series times(double scalar) {
        return map(v -> v * scalar);
    }

    public Series dividedBy(double scalar) {
        return map(v -> v / scalar);
    }

    public Series pow(double exponent) {
        return map(v -> Math.pow(v, exponent));
    }

    public Series sqrt() {
        return map(Math::sqrt);
    }

    public Series log() {
        return map(Math::log);
    }

    /**
     * Suma elemento a elemento. Un NaN en cualquier término hace NaN el resultado.
     */
    public static Series sum(List<Series> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("No se puede sumar una lista vacía de series.");
        }
        Series acc = terms.get(0);
        for (int i = 1; i < terms.size(); i++) {
            acc = acc.plus(terms.get(i));
        }
        return acc;
    }

    public static Series product(List<Series> factors) {
        if (factors.isEmpty()) {
            throw new IllegalArgumentException("No se puede multiplicar una lista vacía de series.");
        }
        Series acc = factors.get(0);
        for (int i = 1; i < factors.size(); i++) {
            acc = acc.times(factors.get(i));
        }
        return acc;
    }

    /**
     * Estadísticos de los valores no ausentes.
     */
    public DoubleSummaryStatistics statistics() {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).summaryStatistics();
    }

    /**
     * Media móvil temporal cerrada por la derecha: la fila i promedia los valores
     * no ausentes con instante en (t_i - window, t_i]. Con menos de
     * {@code minPeriods} valores válidos el resultado es NaN.
     *
     * @throws SchemaViolationException si el índice no es monótono creciente.
     */
    public Series rollingMean(Duration window, int minPeriods) {
        if (!index.isMonotonicIncreasing()) {
            throw new SchemaViolationException("La media móvil exige un índice temporal monótono creciente.");
        }
        double[] out = new double[values.length];
        int start = 0;
        for (int i = 0; i < values.length; i++) {
            Instant lowerExclusive = index.get(i).minus(window);
            while (!index.get(start).isAfter(lowerExclusive)) {
                start++;
            }
            double sum = 0.0;
            int count = 0;
            for (int j = start; j <= i; j++) {
                if (!Double.isNaN(values[j])) {
                    sum += values[j];
                    count++;
                }
            }
            out[i] = count >= minPeriods ? sum / count : Double.NaN;
        }
        return new Series(index, name, out);
    }

    public long missingCount() {
        return Arrays.stream(values).filter(Double::isNaN).count();
    }

    private void requireAligned(Series other) {
        Objects.requireNonNull(other, "La serie a combinar no puede ser nula.");
        if (index != other.index && !index.equals(other.index)) {
            throw new SchemaViolationException("Las series '" + name + "' y '" + other.name
                    + "' no comparten índice temporal.");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Series that = (Series) o;
        return name.equals(that.name) && index.equals(that.index) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = index.hashCode();
        result = 31 * result + name.hashCode();
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    @Override
    public String toString() {
        return "Series[" + name + "]" + Arrays.toString(values);
    }
}
