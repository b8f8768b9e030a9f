package solarplasma.physics.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.physics.units.Constants;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

class IonTest {

    private DataTable table;

    @BeforeEach
    void setUp() {
        table = PlasmaTestData.twoSpecies().build();
    }

    @Test
    @DisplayName("La velocidad térmica escalar se añade por cuadratura si falta")
    void constructor_shouldAddScalarThermalSpeed() {
        Ion p1 = new Ion(table, "p1");

        double expected = Math.sqrt((30.0 * 30.0 + 2.0 * 40.0 * 40.0) / 3.0);
        assertThat(p1.thermalSpeed().scalar().get(0)).isCloseTo(expected, within(1e-12));
    }

    @Test
    @DisplayName("Una tabla MC ya cortada se usa tal cual")
    void constructor_withSlicedTable_shouldMatchFullTable() {
        assertThat(new Ion(table.species("a"), "a")).isEqualTo(new Ion(table, "a"));
    }

    @Test
    @DisplayName("Un ion no puede ser una especie compuesta")
    void constructor_whenComposite_shouldThrow() {
        assertThatThrownBy(() -> new Ion(table, "a+p1")).isInstanceOf(SchemaViolationException.class);
    }

    @Test
    @DisplayName("Faltan columnas obligatorias: error que enumera las requeridas")
    void constructor_whenColumnsMissing_shouldThrow() {
        DataTable incomplete = table.drop(k -> k.m().equals("w") && k.c().equals("per"));

        assertThatThrownBy(() -> new Ion(incomplete, "p1"))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("Requeridas");
    }

    @Test
    @DisplayName("Una tabla de un solo nivel no es un ion")
    void constructor_withComponentTable_shouldThrow() {
        DataTable c = DataTable.builder(ColumnScheme.C, table.getIndex()).put("", "x", "", 1.0, 2.0, 3.0).build();

        assertThatThrownBy(() -> new Ion(c, "p1")).isInstanceOf(SchemaViolationException.class);
    }

    @Test
    @DisplayName("La densidad de masa de las alfa es n por su masa en masas de protón")
    void massDensity_shouldScaleByProtonMasses() {
        Ion a = new Ion(table, "a");

        assertThat(a.massDensity().get(0)).isCloseTo(PlasmaTestData.N_A * Constants.ALPHA_PROTON_MASS_RATIO, within(1e-12));
        assertThat(a.massDensity().getName()).isEqualTo("rho");
    }

    @Test
    @DisplayName("Temperatura y velocidad térmica cumplen m w² = 2 k T")
    void temperature_shouldFollowThermalSpeedConvention() {
        Ion p1 = new Ion(table, "p1");

        double tPar = p1.temperature().par().get(0) * 1e5;
        double wPar = Math.sqrt(2.0 * Constants.BOLTZMANN_J * tPar / Constants.PROTON_MASS) / 1e3;

        assertThat(wPar).isCloseTo(30.0, within(1e-9));
    }

    @Test
    @DisplayName("La anisotropía es el cociente de presiones perpendicular y paralela")
    void anisotropy_shouldBeRatioOfPressures() {
        Ion p1 = new Ion(table, "p1");

        assertThat(p1.anisotropy().get(0)).isCloseTo(1600.0 / 900.0, withinPercentage(1e-9));
    }

    @Test
    @DisplayName("c_s = w sqrt(γ/2) porque p_th = ρ w²/2")
    void soundSpeed_shouldMatchThermalSpeed() {
        Ion p1 = new Ion(table, "p1");
        double w = p1.thermalSpeed().scalar().get(0);

        assertThat(p1.soundSpeed().get(0)).isCloseTo(w * Math.sqrt(Constants.POLYTROPIC_INDEX / 2.0), withinPercentage(1e-9));
    }
}
