package solarplasma.domain.table;

import java.util.List;

/**
 * Resultado de filtrar una tabla de entrada al construir un plasma.
 *
 * @param accepted Columnas reconocidas que pasan a la tabla canónica.
 * @param dropped  Columnas con combinaciones medida/componente/especie no reconocidas.
 */
public record IngestReport(List<ColumnKey> accepted, List<ColumnKey> dropped) {

    public IngestReport {
        accepted = List.copyOf(accepted);
        dropped = List.copyOf(dropped);
    }

    public boolean hasDroppedColumns() {
        return !dropped.isEmpty();
    }
}
