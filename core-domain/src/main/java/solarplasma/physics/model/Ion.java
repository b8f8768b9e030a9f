package solarplasma.physics.model;

import lombok.Getter;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.species.SpeciesAlgebra;
import solarplasma.domain.table.ColumnKey;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.Series;
import solarplasma.physics.units.Constants;
import solarplasma.physics.units.ParticleSpecies;
import solarplasma.physics.units.Units;

import java.util.List;
import java.util.Objects;

/**
 * Vista de sólo lectura de una especie iónica.
 * <p>
 * Expone las magnitudes primarias (densidad, velocidad, velocidad térmica) y
 * las derivadas de una sola especie. Nada se cachea: cada accesor recalcula a
 * partir de la tabla.
 * <p>
 * La velocidad térmica sigue la convención m w² = 2 k T.
 */
public final class Ion {

    static final List<ColumnKey> REQUIRED_COLUMNS = List.of(
            ColumnKey.of("n", "", ""),
            ColumnKey.of("v", "x", ""),
            ColumnKey.of("v", "y", ""),
            ColumnKey.of("v", "z", ""),
            ColumnKey.of("w", "par", ""),
            ColumnKey.of("w", "per", ""));

    private static final ColumnKey W_SCALAR = ColumnKey.of("w", "scalar", "");

    @Getter
    private final String species;

    /**
     * Tabla MC de la especie (medida, componente).
     */
    @Getter
    private final DataTable data;

    /**
     * @param data    Tabla MC ya cortada por especie, o la tabla MCS completa del plasma.
     * @param species Código de especie atómica (sin '+').
     * @throws SchemaViolationException si faltan columnas mínimas o la especie es compuesta.
     */
    public Ion(DataTable data, String species) {
        Objects.requireNonNull(data, "La tabla del ion no puede ser nula.");
        Objects.requireNonNull(species, "La especie del ion no puede ser nula.");
        if (species.contains(SpeciesAlgebra.SUM)) {
            throw new SchemaViolationException("Un Ion no admite especies con '+': " + species);
        }
        DataTable sliced = switch (data.getScheme()) {
            case MCS -> data.species(species);
            case MC -> data;
            case C -> throw new SchemaViolationException("Nombres de nivel no reconocidos: " + ColumnScheme.C.getLevelNames());
        };
        if (!sliced.containsAll(REQUIRED_COLUMNS)) {
            throw new SchemaViolationException("Faltan columnas obligatorias para el ion '" + species + "'.\n"
                    + "Requeridas: " + REQUIRED_COLUMNS + "\nPresentes: " + sliced.keys());
        }
        if (!sliced.contains(W_SCALAR)) {
            sliced = sliced.concat(DataTable.builder(ColumnScheme.MC, sliced.getIndex())
                    .put(W_SCALAR, scalarThermalSpeed(sliced.column(ColumnKey.of("w", "par", "")),
                            sliced.column(ColumnKey.of("w", "per", ""))))
                    .build());
        }
        this.species = species;
        this.data = sliced;
    }

    /**
     * Velocidad térmica escalar por cuadratura: w² = (w_par² + 2 w_per²) / 3.
     */
    public static Series scalarThermalSpeed(Series par, Series per) {
        return par.pow(2).times(1.0 / 3.0).plus(per.pow(2).times(2.0 / 3.0)).sqrt().withName("w_scalar");
    }

    private ParticleSpecies constants() {
        return ParticleSpecies.fromCode(species);
    }

    public Vector velocity() {
        return new Vector(data.measurement("v"));
    }

    public Tensor thermalSpeed() {
        return new Tensor(data.measurement("w"));
    }

    public Series numberDensity() {
        return data.column("n", "").withName("n");
    }

    /**
     * Densidad de masa en m_p cm⁻³.
     */
    public Series massDensity() {
        return numberDensity().times(constants().getMassInProtonMasses()).withName("rho");
    }

    /**
     * Anisotropía de temperatura R_T = p_⟂ / p_∥.
     */
    public Series anisotropy() {
        Tensor pth = thermalPressure();
        return pth.per().dividedBy(pth.par()).withName("RT");
    }

    /**
     * Temperatura T = m w² / (2 k_B) [10⁵ K].
     */
    public Tensor temperature() {
        double coeff = 0.5 * constants().getMass() / (Constants.BOLTZMANN_J * Units.TEMPERATURE);
        return thermalSpeed().map(w -> w.times(Units.W).pow(2).times(coeff).withName("T"));
    }

    /**
     * Presión térmica p_th = ρ w² / 2 [pPa].
     */
    public Tensor thermalPressure() {
        Series rho = massDensity().times(Units.RHO);
        return thermalSpeed().map(w -> w.times(Units.W).pow(2).times(rho).times(0.5 / Units.PTH).withName("pth"));
    }

    /**
     * Velocidad del sonido de la especie c_s = sqrt(γ p / ρ) [km/s].
     */
    public Series soundSpeed() {
        Series pth = thermalPressure().scalar().times(Units.PTH);
        Series rho = massDensity().times(Units.RHO);
        return pth.dividedBy(rho).times(Constants.POLYTROPIC_INDEX).sqrt().dividedBy(Units.CS).withName("cs");
    }

    /**
     * Entropía específica S = p_th ρ^(−γ) [eV cm²].
     * <p>
     * Siscoe, G. L. (1983). Solar System Magnetohydrodynamics (pp. 11-100).
     */
    public Series specificEntropy() {
        Series pth = thermalPressure().scalar().times(Units.PTH);
        Series rho = massDensity().times(Units.RHO);
        return pth.times(rho.pow(-Constants.POLYTROPIC_INDEX)).dividedBy(Units.SPECIFIC_ENTROPY).withName("S");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Ion ion = (Ion) o;
        return species.equals(ion.species) && data.equals(ion.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(species, data);
    }

    @Override
    public String toString() {
        return "Ion[" + species + ", " + data.rowCount() + " filas]";
    }
}
