package solarplasma.domain.exception;

/**
 * Operación indefinida o ambigua por construcción (ej: flujo diferencial de una
 * especie consigo misma, velocidad térmica de una especie compuesta).
 */
public class AmbiguousOperationException extends PlasmaDataException {

    public AmbiguousOperationException(String message) {
        super(message);
    }
}
