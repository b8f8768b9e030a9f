package solarplasma.physics.model;

import lombok.Getter;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.table.ColumnKey;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.Series;
import solarplasma.domain.table.TimeIndex;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Vector cartesiano de tres componentes sobre una tabla de esquema {@link ColumnScheme#C}.
 * <p>
 * Es un envoltorio sin estado propio: se crea bajo demanda a partir de las
 * columnas {x, y, z} de otra tabla. Cualquier componente ausente (NaN) hace
 * ausente la magnitud en esa fila.
 */
public class Vector {

    public static final List<String> COMPONENTS = List.of("x", "y", "z");
    private static final List<ColumnKey> REQUIRED = COMPONENTS.stream().map(ColumnKey::component).toList();

    @Getter
    private final DataTable data;

    public Vector(DataTable data) {
        Objects.requireNonNull(data, "La tabla del vector no puede ser nula.");
        if (data.getScheme() != ColumnScheme.C) {
            throw new SchemaViolationException("Un vector necesita una tabla de un nivel (C), se recibió " + data.getScheme());
        }
        if (!data.containsAll(REQUIRED)) {
            throw new SchemaViolationException("\nColumnas objetivo:\n" + COMPONENTS + "\nRecibidas:\n" + data.keys());
        }
        this.data = data;
    }

    public static Vector of(Series x, Series y, Series z) {
        TimeIndex index = x.getIndex();
        return new Vector(DataTable.builder(ColumnScheme.C, index)
                .put(ColumnKey.component("x"), x)
                .put(ColumnKey.component("y"), y)
                .put(ColumnKey.component("z"), z)
                .build());
    }

    public TimeIndex getIndex() {
        return data.getIndex();
    }

    public Series component(String name) {
        return data.component(name);
    }

    public Series x() {
        return component("x");
    }

    public Series y() {
        return component("y");
    }

    public Series z() {
        return component("z");
    }

    /**
     * Sólo las componentes cartesianas (x, y, z).
     */
    public DataTable cartesian() {
        return data.filter(REQUIRED::contains);
    }

    public Series magnitude() {
        return x().pow(2).plus(y().pow(2)).plus(z().pow(2)).sqrt().withName("mag");
    }

    /**
     * Alias de {@link #magnitude()} para quien piensa en coordenadas esféricas.
     */
    public Series r() {
        return magnitude().withName("r");
    }

    /**
     * Magnitud en el plano xy.
     */
    public Series rho() {
        return x().pow(2).plus(y().pow(2)).sqrt().withName("rho");
    }

    /**
     * Ángulo sobre el plano xy [grados].
     */
    public Series latitude() {
        return z().zip(rho(), (z, rho) -> Math.toDegrees(Math.atan2(z, rho))).withName("latitude");
    }

    /**
     * Ángulo medido desde el eje z [grados].
     */
    public Series colatitude() {
        return rho().zip(z(), (rho, z) -> Math.toDegrees(Math.atan2(rho, z))).withName("colatitude");
    }

    public Series longitude() {
        return y().zip(x(), (y, x) -> Math.toDegrees(Math.atan2(y, x))).withName("longitude");
    }

    public Vector unitVector() {
        Series mag = magnitude();
        return Vector.of(x().dividedBy(mag), y().dividedBy(mag), z().dividedBy(mag));
    }

    /**
     * Descompone este vector respecto a la dirección de {@code other}.
     * <p>
     * par = self · û, per = |self − û par|.
     */
    public VectorProjection project(Vector other) {
        Vector uv = other.unitVector();
        Series par = dot(uv);
        Series per = x().minus(uv.x().times(par)).pow(2)
                .plus(y().minus(uv.y().times(par)).pow(2))
                .plus(z().minus(uv.z().times(par)).pow(2))
                .sqrt();
        return new VectorProjection(par.withName("par"), per.withName("per"));
    }

    /**
     * Coseno del ángulo entre ambos vectores.
     */
    public Series cosTheta(Vector other) {
        return unitVector().dot(other.unitVector()).withName("cos_theta");
    }

    public Series dot(Vector other) {
        return x().times(other.x()).plus(y().times(other.y())).plus(z().times(other.z()));
    }

    public Vector minus(Vector other) {
        return Vector.of(x().minus(other.x()), y().minus(other.y()), z().minus(other.z()));
    }

    public Vector times(Series factor) {
        return map(c -> c.times(factor));
    }

    public Vector times(double factor) {
        return map(c -> c.times(factor));
    }

    Vector map(UnaryOperator<Series> op) {
        return Vector.of(op.apply(x()), op.apply(y()), op.apply(z()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return data.equals(((Vector) o).data);
    }

    @Override
    public int hashCode() {
        return data.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + data + "]";
    }
}
