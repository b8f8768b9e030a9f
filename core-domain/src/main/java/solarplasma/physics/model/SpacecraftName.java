package solarplasma.physics.model;

import solarplasma.domain.exception.UnrecognizedFrameException;

import java.util.Locale;

/**
 * Naves cuyas trayectorias sabe interpretar el modelo.
 */
public enum SpacecraftName {
    WIND,
    PSP;

    /**
     * @throws UnrecognizedFrameException si el nombre no es una nave soportada.
     */
    public static SpacecraftName fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (SpacecraftName spacecraft : values()) {
                if (spacecraft.name().equals(normalized)) {
                    return spacecraft;
                }
            }
        }
        throw new UnrecognizedFrameException("Nave no reconocida: " + name);
    }
}
