package solarplasma.domain.exception;

/**
 * Esquema de columnas mal formado, columnas obligatorias ausentes o sintaxis
 * de especies inválida.
 */
public class SchemaViolationException extends PlasmaDataException {

    public SchemaViolationException(String message) {
        super(message);
    }
}
