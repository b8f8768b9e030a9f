package solarplasma.domain.table;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import solarplasma.domain.exception.SchemaViolationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Tabla etiquetada, indexada por tiempo e inmutable.
 * <p>
 * Es el único tipo tabular del modelo: el plasma, los iones, la nave, los
 * vectores y los tensores son vistas sobre una {@code DataTable} con el
 * {@link ColumnScheme} adecuado. Las columnas se mantienen ordenadas por clave y
 * son únicas.
 * <p>
 * No existe ninguna operación de escritura in situ. Cada transformación devuelve
 * una tabla nueva y los accesores devuelven copias, de forma que ningún
 * llamador puede corromper la tabla de la que sale una vista.
 */
@Slf4j
public final class DataTable {

    @Getter
    private final TimeIndex index;
    @Getter
    private final ColumnScheme scheme;
    private final SortedMap<ColumnKey, double[]> columns;

    private DataTable(TimeIndex index, ColumnScheme scheme, SortedMap<ColumnKey, double[]> columns) {
        this.index = index;
        this.scheme = scheme;
        this.columns = Collections.unmodifiableSortedMap(columns);
    }

    public static Builder builder(ColumnScheme scheme, TimeIndex index) {
        return new Builder(scheme, index);
    }

    /**
     * Construye una tabla a partir de series ya alineadas.
     */
    public static DataTable ofSeries(ColumnScheme scheme, TimeIndex index, Map<ColumnKey, Series> series) {
        Builder builder = builder(scheme, index);
        series.forEach(builder::put);
        return builder.build();
    }

    // --- Consultas de estructura ---

    public int rowCount() {
        return index.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty() || index.isEmpty();
    }

    public List<ColumnKey> keys() {
        return List.copyOf(columns.keySet());
    }

    public boolean contains(ColumnKey key) {
        return columns.containsKey(key);
    }

    public boolean containsAll(List<ColumnKey> keys) {
        return columns.keySet().containsAll(keys);
    }

    /**
     * Valores distintos del nivel S (puede incluir "" para medidas sin especie).
     */
    public SortedSet<String> speciesLevel() {
        return levelValues(ColumnKey::s);
    }

    public SortedSet<String> componentLevel() {
        return levelValues(ColumnKey::c);
    }

    public SortedSet<String> measurementLevel() {
        return levelValues(ColumnKey::m);
    }

    private SortedSet<String> levelValues(Function<ColumnKey, String> level) {
        SortedSet<String> out = new TreeSet<>();
        columns.keySet().forEach(k -> out.add(level.apply(k)));
        return Collections.unmodifiableSortedSet(out);
    }

    // --- Acceso a columnas ---

    /**
     * Columna como serie. El nombre de la serie es la etiqueta de la clave.
     *
     * @throws SchemaViolationException si la columna no existe.
     */
    public Series column(ColumnKey key) {
        double[] values = columns.get(key);
        if (values == null) {
            throw new SchemaViolationException("Columna inexistente " + key + ". Disponibles: " + columns.keySet());
        }
        return Series.wrap(index, label(key), values.clone());
    }

    /**
     * Atajo para tablas de un nivel.
     */
    public Series component(String c) {
        return column(ColumnKey.component(c));
    }

    public Series column(String m, String c) {
        return column(ColumnKey.of(m, c, ""));
    }

    public Series column(String m, String c, String s) {
        return column(ColumnKey.of(m, c, s));
    }

    private String label(ColumnKey key) {
        return scheme.levelsOf(key).stream().filter(level -> !level.isEmpty()).collect(Collectors.joining("_"));
    }

    // --- Selecciones (siempre devuelven tablas nuevas) ---

    public DataTable filter(Predicate<ColumnKey> keep) {
        SortedMap<ColumnKey, double[]> out = new TreeMap<>();
        columns.forEach((k, v) -> {
            if (keep.test(k)) {
                out.put(k, v);
            }
        });
        return new DataTable(index, scheme, out);
    }

    public DataTable drop(Predicate<ColumnKey> remove) {
        return filter(remove.negate());
    }

    /**
     * Corte transversal por especie: tabla MC con las columnas de la especie {@code s}.
     */
    public DataTable species(String s) {
        requireScheme(ColumnScheme.MCS);
        SortedMap<ColumnKey, double[]> out = new TreeMap<>();
        columns.forEach((k, v) -> {
            if (k.s().equals(s)) {
                out.put(k.withoutSpecies(), v);
            }
        });
        return new DataTable(index, ColumnScheme.MC, out);
    }

    /**
     * Corte transversal por medida en una tabla MC: tabla C con sus componentes.
     */
    public DataTable measurement(String m) {
        requireScheme(ColumnScheme.MC);
        return measurement(m, "");
    }

    /**
     * Corte transversal por medida y especie: tabla C con sus componentes.
     */
    public DataTable measurement(String m, String s) {
        SortedMap<ColumnKey, double[]> out = new TreeMap<>();
        columns.forEach((k, v) -> {
            if (k.m().equals(m) && k.s().equals(s)) {
                out.put(ColumnKey.component(k.c()), v);
            }
        });
        return new DataTable(index, ColumnScheme.C, out);
    }

    /**
     * Filas cuyo instante cae en [start, stop] (extremos nulos = sin límite).
     */
    public DataTable between(Instant start, Instant stop) {
        int[] rows = index.rowsBetween(start, stop);
        SortedMap<ColumnKey, double[]> out = new TreeMap<>();
        columns.forEach((k, v) -> {
            double[] subset = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                subset[i] = v[rows[i]];
            }
            out.put(k, subset);
        });
        return new DataTable(index.select(rows), scheme, out);
    }

    /**
     * Une las columnas de dos tablas con el mismo índice y esquema.
     *
     * @throws SchemaViolationException si los índices, esquemas o columnas chocan.
     */
    public DataTable concat(DataTable other) {
        if (scheme != other.scheme) {
            throw new SchemaViolationException("No se pueden unir tablas " + scheme + " y " + other.scheme);
        }
        if (!index.equals(other.index)) {
            throw new SchemaViolationException("No se pueden unir tablas con distinto índice temporal.");
        }
        SortedMap<ColumnKey, double[]> out = new TreeMap<>(columns);
        other.columns.forEach((k, v) -> {
            if (out.putIfAbsent(k, v) != null) {
                throw new SchemaViolationException("Columna duplicada al unir tablas: " + k);
            }
        });
        return new DataTable(index, scheme, out);
    }

    private void requireScheme(ColumnScheme expected) {
        if (scheme != expected) {
            throw new SchemaViolationException("Operación válida sólo para tablas " + expected + ", la tabla es " + scheme);
        }
    }

    // --- Igualdad ---

    /**
     * Dos tablas son iguales si tienen el mismo esquema, índice, columnas y
     * valores (NaN es igual a NaN). Tablas con etiquetas o formas distintas
     * simplemente no son iguales.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataTable that = (DataTable) o;
        if (scheme != that.scheme || !index.equals(that.index) || !columns.keySet().equals(that.columns.keySet())) {
            return false;
        }
        for (Map.Entry<ColumnKey, double[]> entry : columns.entrySet()) {
            if (!Arrays.equals(entry.getValue(), that.columns.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(scheme, index, columns.keySet());
        for (double[] values : columns.values()) {
            result = 31 * result + Arrays.hashCode(values);
        }
        return result;
    }

    @Override
    public String toString() {
        return "DataTable[" + scheme + ", " + rowCount() + "x" + columnCount() + ", columnas=" + columns.keySet() + "]";
    }

    /**
     * Constructor incremental. Una vez llamado {@link #build()} la tabla no puede cambiar.
     * <p>
     * Si una clave se añade dos veces se conserva la primera aparición y se avisa en el log.
     */
    public static final class Builder {

        private final ColumnScheme scheme;
        private final TimeIndex index;
        private final SortedMap<ColumnKey, double[]> columns = new TreeMap<>();
        private final List<ColumnKey> duplicates = new ArrayList<>();

        private Builder(ColumnScheme scheme, TimeIndex index) {
            this.scheme = Objects.requireNonNull(scheme, "El esquema no puede ser nulo.");
            this.index = Objects.requireNonNull(index, "El índice no puede ser nulo.");
        }

        public Builder put(ColumnKey key, double... values) {
            Objects.requireNonNull(key, "La clave de columna no puede ser nula.");
            Objects.requireNonNull(values, "Los valores de la columna " + key + " no pueden ser nulos.");
            validateKey(key);
            if (values.length != index.size()) {
                throw new SchemaViolationException("La columna " + key + " tiene " + values.length
                        + " valores pero el índice tiene " + index.size() + " filas.");
            }
            if (columns.containsKey(key)) {
                duplicates.add(key);
                return this;
            }
            columns.put(key, values.clone());
            return this;
        }

        public Builder put(ColumnKey key, Series series) {
            if (!index.equals(series.getIndex())) {
                throw new SchemaViolationException("La serie de la columna " + key + " no comparte el índice de la tabla.");
            }
            return put(key, series.toArray());
        }

        public Builder put(String m, String c, String s, double... values) {
            return put(ColumnKey.of(m, c, s), values);
        }

        public Builder putAll(DataTable table) {
            table.columns.forEach((k, v) -> put(k, v));
            return this;
        }

        private void validateKey(ColumnKey key) {
            boolean ok = switch (scheme) {
                case C -> key.m().isEmpty() && key.s().isEmpty();
                case MC -> key.s().isEmpty();
                case MCS -> true;
            };
            if (!ok) {
                throw new SchemaViolationException("La clave " + key + " no encaja en el esquema " + scheme
                        + " " + scheme.getLevelNames());
            }
        }

        public DataTable build() {
            if (!duplicates.isEmpty()) {
                log.warn("Columnas duplicadas descartadas (se conserva la primera): {}", duplicates);
            }
            return new DataTable(index, scheme, new TreeMap<>(columns));
        }
    }
}
