package solarplasma.physics.model;

import solarplasma.domain.exception.UnrecognizedFrameException;

import java.util.Locale;

/**
 * Sistemas de referencia en los que se dan la posición y la velocidad de la nave.
 */
public enum ReferenceFrame {
    /**
     * Geocéntrico solar eclíptico. Posición en radios terrestres.
     */
    GSE,
    /**
     * Heliocéntrico inercial. Posición en radios solares.
     */
    HCI;

    /**
     * Resuelve el nombre del sistema sin distinguir mayúsculas.
     *
     * @throws UnrecognizedFrameException si el nombre no es un sistema soportado.
     */
    public static ReferenceFrame fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (ReferenceFrame frame : values()) {
                if (frame.name().equals(normalized)) {
                    return frame;
                }
            }
        }
        throw new UnrecognizedFrameException("Sistema de referencia no reconocido: " + name);
    }
}
