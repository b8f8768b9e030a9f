package solarplasma.domain.exception;

/**
 * Se ha pedido un cálculo que necesita un colaborador opcional (la nave) que no está presente.
 */
public class MissingCollaboratorException extends PlasmaDataException {

    public MissingCollaboratorException(String message) {
        super(message);
    }
}
