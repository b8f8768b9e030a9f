package solarplasma.physics.model;

import solarplasma.domain.table.IngestReport;

import java.util.Objects;

/**
 * Plasma recién construido junto con el informe de columnas aceptadas y descartadas.
 */
public record PlasmaIngest(Plasma plasma, IngestReport report) {

    public PlasmaIngest {
        Objects.requireNonNull(plasma, "El plasma no puede ser nulo.");
        Objects.requireNonNull(report, "El informe de ingesta no puede ser nulo.");
    }
}
