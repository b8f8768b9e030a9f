package solarplasma.config;

import lombok.Builder;
import lombok.With;

import java.time.Instant;

/**
 * Parámetros de lectura y escritura de un plasma en disco.
 *
 * @param dataKey         Nombre de la tabla del plasma dentro del archivo.
 * @param spacecraftKey   Nombre de la tabla de la nave. Nulo para ignorarla al cargar.
 * @param auxiliaryKey    Nombre de la tabla de datos auxiliares. Nulo para ignorarla al cargar.
 * @param spacecraftName  Nave (WIND, PSP). Obligatorio si el archivo contiene datos de nave.
 * @param spacecraftFrame Sistema de referencia de la nave (GSE, HCI). Obligatorio junto al nombre.
 * @param start           Primer instante a cargar (inclusive), nulo sin límite.
 * @param stop            Último instante a cargar (inclusive), nulo sin límite.
 * @param logPlasmaStats  Registrar estadísticas de cada tabla al construir el plasma.
 */
@Builder
@With
public record PlasmaStoreConfig(
        String dataKey,
        String spacecraftKey,
        String auxiliaryKey,
        String spacecraftName,
        String spacecraftFrame,
        Instant start,
        Instant stop,
        boolean logPlasmaStats
) {

    public static final String DEFAULT_DATA_KEY = "FC";
    public static final String DEFAULT_SPACECRAFT_KEY = "SC";
    public static final String DEFAULT_AUXILIARY_KEY = "FC_AUX";

    /**
     * Claves FC / SC / FC_AUX, sin nave, sin ventana temporal y sin estadísticas.
     */
    public static PlasmaStoreConfig getDefault() {
        return new PlasmaStoreConfig(DEFAULT_DATA_KEY, DEFAULT_SPACECRAFT_KEY, DEFAULT_AUXILIARY_KEY,
                null, null, null, null, false);
    }

    public boolean hasSpacecraftIdentity() {
        return spacecraftName != null && spacecraftFrame != null;
    }
}
