package solarplasma.physics.turbulence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import solarplasma.config.TurbulenceConfig;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.table.Series;
import solarplasma.domain.table.TimeIndex;
import solarplasma.physics.model.PlasmaTestData;
import solarplasma.physics.model.Vector;
import solarplasma.physics.units.Constants;
import solarplasma.physics.units.Units;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AlfvenicTurbulenceTest {

    private static final TurbulenceConfig CONFIG = TurbulenceConfig.builder()
            .window(Duration.ofMinutes(3))
            .minPeriods(1)
            .build();

    private TimeIndex index;
    private Vector velocity;
    private Vector bfield;
    private Series rho;

    @BeforeEach
    void setUp() {
        index = PlasmaTestData.index(6);
        velocity = Vector.of(
                Series.of(index, "x", -400, -395, -410, -402, -398, -405),
                Series.of(index, "y", 10, 12, 9, 11, 13, 8),
                Series.of(index, "z", -5, -4, -6, -5, -3, -7));
        bfield = Vector.of(
                Series.of(index, "x", 3.0, 3.2, 2.9, 3.1, 3.3, 2.8),
                Series.of(index, "y", 4.0, 4.1, 3.8, 4.2, 3.9, 4.0),
                Series.of(index, "z", 0.0, 0.3, -0.2, 0.1, -0.1, 0.2));
        rho = Series.constant(index, "rho", 4.0);
    }

    @Test
    @DisplayName("El campo se pasa a unidades de Alfvén con la densidad de masa")
    void constructor_shouldConvertFieldToAlfvenUnits() {
        AlfvenicTurbulence turbulence = new AlfvenicTurbulence(velocity, bfield, rho, "p1", CONFIG);

        double coeff = Units.B / (Math.sqrt(Units.RHO * Constants.VACUUM_PERMEABILITY) * Units.V);
        assertThat(turbulence.getMeasurements().column("b", "x").get(1)).isCloseTo(3.2 / 2.0 * coeff, within(1e-9));
    }

    @Test
    @DisplayName("La primera fila coincide con su propia media: fluctuación nula")
    void fluctuations_atFirstRow_shouldBeZero() {
        AlfvenicTurbulence turbulence = new AlfvenicTurbulence(velocity, bfield, rho, "p1", CONFIG);

        assertThat(turbulence.velocity().x().get(0)).isCloseTo(0.0, within(1e-12));
        assertThat(turbulence.bfield().y().get(0)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("e⁺ + e⁻ = 2 E_T y e⁺ − e⁻ = 4 H_c")
    void elsasserEnergies_shouldMatchTotalEnergyAndCrossHelicity() {
        AlfvenicTurbulence turbulence = new AlfvenicTurbulence(velocity, bfield, rho, "p1", CONFIG);

        Series ep = turbulence.ePlus();
        Series em = turbulence.eMinus();
        Series etot = turbulence.totalEnergy();
        Series hc = turbulence.crossHelicity();

        for (int i = 0; i < index.size(); i++) {
            assertThat(ep.get(i) + em.get(i)).isCloseTo(2.0 * etot.get(i), within(1e-9));
            assertThat(ep.get(i) - em.get(i)).isCloseTo(4.0 * hc.get(i), within(1e-9));
        }
    }

    @Test
    @DisplayName("z⁺ − z⁻ = 2 δb y z⁺ + z⁻ = 2 δv")
    void elsasserVariables_shouldRecoverFluctuations() {
        AlfvenicTurbulence turbulence = new AlfvenicTurbulence(velocity, bfield, rho, "p1", CONFIG);

        Vector zp = turbulence.zPlus();
        Vector zm = turbulence.zMinus();
        Vector dv = turbulence.velocity();
        Vector db = turbulence.bfield();

        for (String c : Vector.COMPONENTS) {
            for (int i = 0; i < index.size(); i++) {
                double plus = zp.component(c).get(i);
                double minus = zm.component(c).get(i);
                assertThat(plus - minus).isCloseTo(2.0 * db.component(c).get(i), within(1e-9));
                assertThat(plus + minus).isCloseTo(2.0 * dv.component(c).get(i), within(1e-9));
            }
        }
    }

    @Test
    @DisplayName("σ_c y σ_r están acotados en [-1, 1]")
    void normalizedQuantities_shouldBeBounded() {
        AlfvenicTurbulence turbulence = new AlfvenicTurbulence(velocity, bfield, rho, "p1", CONFIG);

        Series sigmaC = turbulence.normalizedCrossHelicity();
        Series sigmaR = turbulence.normalizedResidualEnergy();

        assertThat(sigmaC.getName()).isEqualTo("sigma_c");
        for (int i = 1; i < index.size(); i++) {
            assertThat(sigmaC.get(i)).isBetween(-1.0 - 1e-12, 1.0 + 1e-12);
            assertThat(sigmaR.get(i)).isBetween(-1.0 - 1e-12, 1.0 + 1e-12);
        }
    }

    @Test
    @DisplayName("Los cocientes r_A y r_E se construyen con sus energías")
    void ratios_shouldUseEnergies() {
        AlfvenicTurbulence turbulence = new AlfvenicTurbulence(velocity, bfield, rho, "p1", CONFIG);

        assertThat(turbulence.alfvenRatio().get(3))
                .isCloseTo(turbulence.kineticEnergy().get(3) / turbulence.magneticEnergy().get(3), within(1e-9));
        assertThat(turbulence.elsasserRatio().get(3))
                .isCloseTo(turbulence.eMinus().get(3) / turbulence.ePlus().get(3), within(1e-9));
    }

    @Test
    @DisplayName("La etiqueta de especie se normaliza")
    void species_shouldBeNormalized() {
        AlfvenicTurbulence turbulence = new AlfvenicTurbulence(velocity, bfield, rho, "p1+a", CONFIG);

        assertThat(turbulence.getSpecies()).isEqualTo("a+p1");
        assertThat(turbulence.getAveraging()).isEqualTo(CONFIG);
    }

    @Test
    @DisplayName("Una densidad con otro índice no se puede alinear")
    void constructor_whenIndexesDiffer_shouldThrow() {
        Series shortRho = Series.constant(PlasmaTestData.index(3), "rho", 4.0);

        assertThatThrownBy(() -> new AlfvenicTurbulence(velocity, bfield, shortRho, "p1", CONFIG))
                .isInstanceOf(SchemaViolationException.class);
    }
}
