package solarplasma.io;

import solarplasma.domain.table.ColumnKey;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.TimeIndex;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Forma serializable de una {@link DataTable}: nombres de nivel, índice temporal
 * (segundos de época + nanosegundos) y una entrada por columna.
 */
public record StoredTable(List<String> levels, long[] epochSeconds, int[] nanos, List<StoredColumn> columns) {

    public StoredTable {
        Objects.requireNonNull(levels, "Una tabla almacenada necesita sus nombres de nivel.");
        Objects.requireNonNull(epochSeconds, "Una tabla almacenada necesita su índice temporal.");
        Objects.requireNonNull(nanos, "Una tabla almacenada necesita su índice temporal.");
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (epochSeconds.length != nanos.length) {
            throw new IllegalArgumentException("Índice temporal corrupto: " + epochSeconds.length
                    + " segundos y " + nanos.length + " nanosegundos.");
        }
    }

    /**
     * @param key    Niveles de la clave en el orden de {@code levels}.
     * @param values Valores de la columna; NaN para los datos ausentes.
     */
    public record StoredColumn(List<String> key, double[] values) {
    }

    static StoredTable of(DataTable table) {
        TimeIndex index = table.getIndex();
        long[] seconds = new long[index.size()];
        int[] nanos = new int[index.size()];
        for (int i = 0; i < index.size(); i++) {
            seconds[i] = index.get(i).getEpochSecond();
            nanos[i] = index.get(i).getNano();
        }
        ColumnScheme scheme = table.getScheme();
        List<StoredColumn> columns = table.keys().stream()
                .map(key -> new StoredColumn(scheme.levelsOf(key), table.column(key).toArray()))
                .toList();
        return new StoredTable(scheme.getLevelNames(), seconds, nanos, columns);
    }

    DataTable toDataTable() {
        ColumnScheme scheme = ColumnScheme.fromLevelNames(levels);
        Instant[] epochs = new Instant[epochSeconds.length];
        for (int i = 0; i < epochs.length; i++) {
            epochs[i] = Instant.ofEpochSecond(epochSeconds[i], nanos[i]);
        }
        DataTable.Builder builder = DataTable.builder(scheme, TimeIndex.of(epochs));
        for (StoredColumn column : columns) {
            ColumnKey key = scheme.keyOf(column.key());
            builder.put(key, column.values());
        }
        return builder.build();
    }

    int rowCount() {
        return epochSeconds.length;
    }
}
