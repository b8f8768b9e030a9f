package solarplasma.physics.turbulence;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import solarplasma.config.TurbulenceConfig;
import solarplasma.domain.species.SpeciesAlgebra;
import solarplasma.domain.table.ColumnKey;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.Series;
import solarplasma.physics.model.Vector;
import solarplasma.physics.units.Constants;
import solarplasma.physics.units.Units;

import java.util.Objects;

/**
 * Diagnósticos de turbulencia alfvénica con variables de Elsasser.
 * <p>
 * Sigue el formalismo de Bruno &amp; Carbone (2013), Living Reviews in Solar
 * Physics 10(1). El campo se pasa a unidades de Alfvén antes de restar la media
 * móvil, de modo que las fluctuaciones {@code δv} y {@code δb} comparten unidades
 * (km/s). Las fluctuaciones se fijan en la construcción; todas las magnitudes
 * derivadas se recalculan en cada llamada.
 */
@Slf4j
public final class AlfvenicTurbulence {

    private static final String V = "v";
    private static final String B = "b";

    /**
     * Etiqueta de especie normalizada ({@code "a+p1"} o {@code "a+p1,p2"}).
     */
    @Getter
    private final String species;

    /**
     * Ventana y mínimo de periodos con los que se calculó la media móvil.
     */
    @Getter
    private final TurbulenceConfig averaging;

    /**
     * Velocidad y campo en unidades de Alfvén, antes de restar la media (tabla MC).
     */
    @Getter
    private final DataTable measurements;

    /**
     * Fluctuaciones: medidas menos su media móvil (tabla MC).
     */
    @Getter
    private final DataTable data;

    /**
     * @param velocity Velocidad del plasma [km/s].
     * @param bfield   Campo magnético [nT], en la misma base que la velocidad.
     * @param rho      Densidad de masa [m_p cm⁻³] con la que se normaliza el campo.
     * @param species  Especie que identifica la velocidad y la densidad usadas.
     * @param config   Parámetros del promedio móvil.
     */
    public AlfvenicTurbulence(Vector velocity, Vector bfield, Series rho, String species, TurbulenceConfig config) {
        Objects.requireNonNull(velocity, "La velocidad no puede ser nula.");
        Objects.requireNonNull(bfield, "El campo magnético no puede ser nulo.");
        Objects.requireNonNull(rho, "La densidad de masa no puede ser nula.");
        this.averaging = Objects.requireNonNull(config, "La configuración de promediado no puede ser nula.");
        this.species = SpeciesAlgebra.normalizeTwoPartLabel(getClass().getSimpleName(), species);

        if (!velocity.getIndex().equals(bfield.getIndex())) {
            log.warn("v y b tienen índices distintos. Los resultados pueden no ser los esperados.");
        }
        if (!velocity.getIndex().equals(rho.getIndex())) {
            log.warn("v y rho tienen índices distintos. Los resultados pueden no ser los esperados.");
        }

        double coeff = Units.B / (Math.sqrt(Units.RHO * Constants.VACUUM_PERMEABILITY) * Units.V);
        Series sqrtRho = rho.sqrt();
        DataTable.Builder measured = DataTable.builder(ColumnScheme.MC, velocity.getIndex());
        DataTable.Builder deltas = DataTable.builder(ColumnScheme.MC, velocity.getIndex());
        for (String c : Vector.COMPONENTS) {
            Series v = velocity.component(c);
            Series b = bfield.component(c).dividedBy(sqrtRho).times(coeff);
            measured.put(ColumnKey.of(V, c, ""), v).put(ColumnKey.of(B, c, ""), b);
            deltas.put(ColumnKey.of(V, c, ""), fluctuation(v))
                    .put(ColumnKey.of(B, c, ""), fluctuation(b));
        }
        this.measurements = measured.build();
        this.data = deltas.build();
        log.debug("Turbulencia alfvénica de '{}' con ventana {} y minPeriods {}",
                this.species, config.window(), config.minPeriods());
    }

    private Series fluctuation(Series raw) {
        return raw.minus(raw.rollingMean(averaging.window(), averaging.minPeriods()));
    }

    /**
     * Fluctuaciones de velocidad δv [km/s].
     */
    public Vector velocity() {
        return new Vector(data.measurement(V));
    }

    /**
     * Fluctuaciones del campo δb en unidades de Alfvén [km/s].
     */
    public Vector bfield() {
        return new Vector(data.measurement(B));
    }

    /**
     * z⁺ = δv + δb
     */
    public Vector zPlus() {
        Vector v = velocity();
        Vector b = bfield();
        return Vector.of(v.x().plus(b.x()), v.y().plus(b.y()), v.z().plus(b.z()));
    }

    /**
     * z⁻ = δv − δb
     */
    public Vector zMinus() {
        return velocity().minus(bfield());
    }

    public Series ePlus() {
        return halfSquare(zPlus()).withName("e_plus");
    }

    public Series eMinus() {
        return halfSquare(zMinus()).withName("e_minus");
    }

    /**
     * E_v = ½ δv²
     */
    public Series kineticEnergy() {
        return halfSquare(velocity()).withName("ev");
    }

    /**
     * E_b = ½ δb²
     */
    public Series magneticEnergy() {
        return halfSquare(bfield()).withName("eb");
    }

    public Series totalEnergy() {
        return kineticEnergy().plus(magneticEnergy()).withName("etot");
    }

    public Series residualEnergy() {
        return kineticEnergy().minus(magneticEnergy()).withName("eres");
    }

    /**
     * σ_r = E_R / E_T
     */
    public Series normalizedResidualEnergy() {
        return residualEnergy().dividedBy(totalEnergy()).withName("sigma_r");
    }

    /**
     * ½ δv · δb
     */
    public Series crossHelicity() {
        return velocity().dot(bfield()).times(0.5).withName("cross_helicity");
    }

    /**
     * σ_c = (e⁺ − e⁻) / (e⁺ + e⁻)
     */
    public Series normalizedCrossHelicity() {
        Series ep = ePlus();
        Series em = eMinus();
        return ep.minus(em).dividedBy(ep.plus(em)).withName("sigma_c");
    }

    /**
     * r_A = E_v / E_b
     */
    public Series alfvenRatio() {
        return kineticEnergy().dividedBy(magneticEnergy()).withName("rA");
    }

    /**
     * r_E = e⁻ / e⁺
     */
    public Series elsasserRatio() {
        return eMinus().dividedBy(ePlus()).withName("rE");
    }

    private static Series halfSquare(Vector vector) {
        return vector.dot(vector).times(0.5);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AlfvenicTurbulence that = (AlfvenicTurbulence) o;
        return species.equals(that.species) && averaging.equals(that.averaging) && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(species, averaging, data);
    }
}
