package solarplasma.physics.model;

import solarplasma.domain.table.Series;

/**
 * Componentes de un vector paralela y perpendicular a una dirección de referencia.
 *
 * @param parallel      Proyección con signo sobre la dirección.
 * @param perpendicular Módulo del resto.
 */
public record VectorProjection(Series parallel, Series perpendicular) {
}
