package solarplasma.domain.species;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import solarplasma.domain.exception.SchemaViolationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeciesAlgebraTest {

    @Test
    @DisplayName("Una especie compuesta se parte en sus constituyentes ordenados")
    void conform_shouldSplitCompositeSpecies() {
        assertThat(SpeciesAlgebra.conform("p1+a")).containsExactly("a", "p1");
    }

    @Test
    @DisplayName("Varias especies se ordenan tal cual")
    void conform_shouldSortPluralSpecies() {
        assertThat(SpeciesAlgebra.conform("p2", "a", "p1")).containsExactly("a", "p1", "p2");
    }

    @ParameterizedTest
    @ValueSource(strings = {"p1+a", "a", "p2+p1+a"})
    @DisplayName("Conformar una salida ya conformada no la cambia")
    void conform_shouldBeIdempotent(String species) {
        List<String> once = SpeciesAlgebra.conform(species);
        List<String> twice = SpeciesAlgebra.conform(once.toArray(new String[0]));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("'+' mezclado con varias especies no se puede aplicar de forma uniforme")
    void conform_whenCompositeMixedWithList_shouldThrow() {
        assertThatThrownBy(() -> SpeciesAlgebra.conform("a+p1", "p2"))
                .isInstanceOf(SchemaViolationException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a,p1", "", "a++p1"})
    @DisplayName("Especies mal formadas se rechazan")
    void conform_whenMalformed_shouldThrow(String species) {
        assertThatThrownBy(() -> SpeciesAlgebra.conform(species))
                .isInstanceOf(SchemaViolationException.class);
    }

    @Test
    @DisplayName("Los constituyentes atómicos no se repiten")
    void atomic_shouldDeduplicate() {
        assertThat(SpeciesAlgebra.atomic(List.of("a+p1", "p1"))).containsExactly("a", "p1");
    }

    @Test
    @DisplayName("Las especies de construcción admiten una lista separada por comas")
    void cleanForSetting_shouldAcceptCommaSeparatedList() {
        assertThat(SpeciesAlgebra.cleanForSetting("Plasma", "p1,a,p1")).containsExactly("a", "p1");
    }

    @Test
    @DisplayName("Las especies de construcción no pueden contener '+'")
    void cleanForSetting_whenComposite_shouldThrow() {
        assertThatThrownBy(() -> SpeciesAlgebra.cleanForSetting("Plasma", "a+p1"))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("Plasma");
    }

    @Test
    @DisplayName("La etiqueta de turbulencia ordena cada parte y admite una sola coma")
    void normalizeTwoPartLabel_shouldSortEachPart() {
        assertThat(SpeciesAlgebra.normalizeTwoPartLabel("Turb", "p1+a,p2")).isEqualTo("a+p1,p2");
        assertThatThrownBy(() -> SpeciesAlgebra.normalizeTwoPartLabel("Turb", "a,p1,p2"))
                .isInstanceOf(SchemaViolationException.class);
    }
}
