package solarplasma.domain.exception;

public class UnrecognizedFrameException extends PlasmaDataException {

    public UnrecognizedFrameException(String message) {
        super(message);
    }
}
