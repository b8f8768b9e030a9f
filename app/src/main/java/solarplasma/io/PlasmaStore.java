package solarplasma.io;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Documento completo de un archivo de plasma: tablas con nombre.
 */
public record PlasmaStore(Map<String, StoredTable> tables) {

    public PlasmaStore {
        tables = tables == null ? Map.of() : new LinkedHashMap<>(tables);
    }
}
