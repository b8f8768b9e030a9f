package solarplasma.domain.table;

import lombok.Getter;

import java.util.List;

/**
 * Descriptor explícito de los niveles de columna que tiene sentido leer en una tabla.
 * <ul>
 * <li><b>C:</b> sólo componente (vectores {x,y,z}, tensores {par,per,scalar}).</li>
 * <li><b>MC:</b> medida y componente (iones ya cortados por especie, nave).</li>
 * <li><b>MCS:</b> medida, componente y especie (tabla canónica del plasma).</li>
 * </ul>
 */
@Getter
public enum ColumnScheme {
    C(List.of("C")),
    MC(List.of("M", "C")),
    MCS(List.of("M", "C", "S"));

    private final List<String> levelNames;

    ColumnScheme(List<String> levelNames) {
        this.levelNames = levelNames;
    }

    public int depth() {
        return levelNames.size();
    }

    /**
     * Extrae de una clave sólo los niveles que tiene este esquema, en orden.
     */
    public List<String> levelsOf(ColumnKey key) {
        return switch (this) {
            case C -> List.of(key.c());
            case MC -> List.of(key.m(), key.c());
            case MCS -> List.of(key.m(), key.c(), key.s());
        };
    }

    /**
     * Operación inversa de {@link #levelsOf(ColumnKey)}.
     */
    public ColumnKey keyOf(List<String> levels) {
        if (levels.size() != depth()) {
            throw new IllegalArgumentException("El esquema " + this + " espera " + depth()
                    + " niveles y se recibieron " + levels.size() + ": " + levels);
        }
        return switch (this) {
            case C -> ColumnKey.component(levels.get(0));
            case MC -> ColumnKey.of(levels.get(0), levels.get(1), "");
            case MCS -> ColumnKey.of(levels.get(0), levels.get(1), levels.get(2));
        };
    }

    /**
     * Busca el esquema a partir de los nombres de nivel (ej: ["M", "C", "S"]).
     */
    public static ColumnScheme fromLevelNames(List<String> names) {
        for (ColumnScheme scheme : values()) {
            if (scheme.levelNames.equals(names)) {
                return scheme;
            }
        }
        throw new IllegalArgumentException("Nombres de nivel no reconocidos: " + names);
    }
}
