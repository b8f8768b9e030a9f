package solarplasma.physics.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.table.ColumnKey;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.Series;
import solarplasma.domain.table.TimeIndex;
import solarplasma.physics.units.Constants;
import solarplasma.physics.units.Units;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Trayectoria de la nave que acompaña a las medidas de plasma.
 * <p>
 * La tabla es de esquema MC: posición {@code pos} (x, y, z) obligatoria,
 * velocidad {@code v} (x, y, z) y coordenadas de Carrington {@code carr}
 * (lat, lon) opcionales. Cualquier otra medida se descarta.
 */
@Slf4j
public class Spacecraft {

    private static final List<String> CARRINGTON = List.of("lat", "lon");

    @Getter
    private final SpacecraftName name;
    @Getter
    private final ReferenceFrame frame;
    @Getter
    private final DataTable data;

    public Spacecraft(DataTable data, String name, String frame) {
        this(data, SpacecraftName.fromName(name), ReferenceFrame.fromName(frame));
    }

    public Spacecraft(DataTable data, SpacecraftName name, ReferenceFrame frame) {
        Objects.requireNonNull(data, "La tabla de la nave no puede ser nula.");
        this.name = Objects.requireNonNull(name, "El nombre de la nave no puede ser nulo.");
        this.frame = Objects.requireNonNull(frame, "El sistema de referencia no puede ser nulo.");
        if (data.getScheme() != ColumnScheme.MC) {
            throw new SchemaViolationException("La nave necesita una tabla (M, C), se recibió " + data.getScheme().getLevelNames());
        }
        this.data = selectColumns(data);
        log.info("Creada la nave {} en el sistema de referencia {}", name, frame);
    }

    private static DataTable selectColumns(DataTable data) {
        requireComponents(data, "pos", Vector.COMPONENTS, true);
        boolean hasVelocity = requireComponents(data, "v", Vector.COMPONENTS, false);
        boolean hasCarrington = requireComponents(data, "carr", CARRINGTON, false);
        return data.filter(k -> (k.m().equals("pos") && Vector.COMPONENTS.contains(k.c()))
                || (hasVelocity && k.m().equals("v") && Vector.COMPONENTS.contains(k.c()))
                || (hasCarrington && k.m().equals("carr") && CARRINGTON.contains(k.c())));
    }

    /**
     * @return {@code true} si la medida está presente con todas sus componentes.
     * @throws SchemaViolationException si la medida es obligatoria y falta, o si está incompleta.
     */
    private static boolean requireComponents(DataTable data, String m, List<String> components, boolean required) {
        List<ColumnKey> keys = components.stream().map(c -> ColumnKey.of(m, c, "")).toList();
        boolean anyPresent = keys.stream().anyMatch(data::contains);
        if (!anyPresent && !required) {
            return false;
        }
        if (!data.containsAll(keys)) {
            throw new SchemaViolationException("La medida '" + m + "' de la nave necesita las componentes "
                    + components + ". Columnas recibidas: " + data.keys());
        }
        return true;
    }

    public TimeIndex getIndex() {
        return data.getIndex();
    }

    public Vector position() {
        return new Vector(data.measurement("pos"));
    }

    /**
     * Velocidad de la nave, si la trayectoria la incluye.
     */
    public Optional<Vector> velocity() {
        DataTable v = data.measurement("v");
        return v.isEmpty() ? Optional.empty() : Optional.of(new Vector(v));
    }

    /**
     * Latitud y longitud de Carrington (tabla C con {@code lat}, {@code lon}).
     */
    public Optional<DataTable> carrington() {
        DataTable carr = data.measurement("carr");
        return carr.isEmpty() ? Optional.empty() : Optional.of(carr);
    }

    /**
     * Distancia radial al Sol [m].
     * <p>
     * En GSE la posición viene en radios terrestres con origen en la Tierra: se
     * invierte x y se traslada el origen 1 UA. En HCI basta con escalar por el
     * radio solar.
     */
    public Series distanceToSun() {
        Vector pos = position();
        Vector inMeters = switch (frame) {
            case GSE -> Vector.of(
                    pos.x().times(-Constants.EARTH_RADIUS).plus(Constants.ASTRONOMICAL_UNIT),
                    pos.y().times(Constants.EARTH_RADIUS),
                    pos.z().times(Constants.EARTH_RADIUS));
            case HCI -> pos.times(Constants.SUN_RADIUS);
        };
        return inMeters.magnitude().dividedBy(Units.DISTANCE_TO_SUN).withName("distance2sun");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Spacecraft that = (Spacecraft) o;
        return name == that.name && frame == that.frame && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, frame, data);
    }

    @Override
    public String toString() {
        return "Spacecraft[" + name + ", " + frame + ", " + data.rowCount() + " filas]";
    }
}
