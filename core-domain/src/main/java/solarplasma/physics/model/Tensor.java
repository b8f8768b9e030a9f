package solarplasma.physics.model;

import lombok.Getter;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.table.ColumnKey;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.Series;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Cantidad anisótropa con componentes paralela, perpendicular y escalar.
 */
public final class Tensor {

    public static final List<String> COMPONENTS = List.of("par", "per", "scalar");
    private static final List<ColumnKey> REQUIRED = COMPONENTS.stream().map(ColumnKey::component).toList();

    @Getter
    private final DataTable data;

    public Tensor(DataTable data) {
        Objects.requireNonNull(data, "La tabla del tensor no puede ser nula.");
        if (data.getScheme() != ColumnScheme.C || !data.containsAll(REQUIRED)) {
            throw new SchemaViolationException("\nColumnas objetivo:\n" + COMPONENTS + "\nRecibidas:\n" + data.keys());
        }
        this.data = data;
    }

    public static Tensor of(Series par, Series per, Series scalar) {
        return new Tensor(DataTable.builder(ColumnScheme.C, par.getIndex())
                .put(ColumnKey.component("par"), par)
                .put(ColumnKey.component("per"), per)
                .put(ColumnKey.component("scalar"), scalar)
                .build());
    }

    /**
     * Aplica la misma operación a las tres componentes.
     */
    public Tensor map(UnaryOperator<Series> op) {
        return Tensor.of(op.apply(par()), op.apply(per()), op.apply(scalar()));
    }

    public Series component(String name) {
        return data.component(name);
    }

    public Series par() {
        return component("par");
    }

    public Series per() {
        return component("per");
    }

    public Series scalar() {
        return component("scalar");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return data.equals(((Tensor) o).data);
    }

    @Override
    public int hashCode() {
        return data.hashCode();
    }

    @Override
    public String toString() {
        return "Tensor[" + data + "]";
    }
}
