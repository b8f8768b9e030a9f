package solarplasma.domain.exception;

/**
 * Raíz de la taxonomía de errores del modelo de plasma.
 * <p>
 * Todas las excepciones son no comprobadas: ninguna operación se reintenta y
 * cualquier entrada inválida se propaga inmediatamente al llamador.
 */
public class PlasmaDataException extends RuntimeException {

    public PlasmaDataException(String message) {
        super(message);
    }

    public PlasmaDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
