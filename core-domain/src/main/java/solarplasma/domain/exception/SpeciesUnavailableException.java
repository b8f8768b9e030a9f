package solarplasma.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Se han pedido especies que no existen en el mapa de iones del plasma.
 * <p>
 * El mensaje enumera siempre las especies solicitadas, las disponibles y las
 * que faltan, para que el llamador no tenga que adivinar.
 */
@Getter
public class SpeciesUnavailableException extends PlasmaDataException {

    private final List<String> requested;
    private final List<String> available;
    private final List<String> unavailable;

    public SpeciesUnavailableException(List<String> requested, List<String> available, List<String> unavailable) {
        super("Especies solicitadas no disponibles.\n"
                + "Solicitadas: " + String.join(", ", requested) + "\n"
                + "Disponibles: " + String.join(", ", available) + "\n"
                + "No disponibles: " + String.join(", ", unavailable));
        this.requested = List.copyOf(requested);
        this.available = List.copyOf(available);
        this.unavailable = List.copyOf(unavailable);
    }
}
