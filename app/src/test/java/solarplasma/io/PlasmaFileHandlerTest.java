package solarplasma.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import solarplasma.config.PlasmaStoreConfig;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.table.ColumnKey;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.TimeIndex;
import solarplasma.physics.model.Plasma;
import solarplasma.physics.model.ReferenceFrame;
import solarplasma.physics.model.Spacecraft;
import solarplasma.physics.model.SpacecraftName;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Pruebas de guardado y carga de plasmas en el almacén CBOR.
 */
class PlasmaFileHandlerTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private PlasmaFileHandler handler;
    private TimeIndex index;
    private DataTable data;

    @BeforeEach
    void setUp() {
        handler = new PlasmaFileHandler();
        index = TimeIndex.of(T0, T0.plusSeconds(60), T0.plusSeconds(120));
        DataTable.Builder builder = DataTable.builder(ColumnScheme.MCS, index)
                .put("b", "x", "", 3.0, 3.1, 3.2)
                .put("b", "y", "", 4.0, 4.1, Double.NaN)
                .put("b", "z", "", 0.0, 0.1, 0.2);
        for (String s : List.of("p1", "a")) {
            double scale = s.equals("p1") ? 1.0 : 0.05;
            builder.put("n", "", s, 10.0 * scale, 11.0 * scale, 12.0 * scale)
                    .put("v", "x", s, -400.0, -401.0, -402.0)
                    .put("v", "y", s, 10.0, 11.0, 12.0)
                    .put("v", "z", s, -5.0, -6.0, -7.0)
                    .put("w", "par", s, 30.0, 31.0, 32.0)
                    .put("w", "per", s, 40.0, 41.0, 42.0);
        }
        data = builder.build();
    }

    private Spacecraft spacecraft() {
        DataTable pos = DataTable.builder(ColumnScheme.MC, index)
                .put("pos", "x", "", 200.0, 201.0, 202.0)
                .put("pos", "y", "", 0.0, 1.0, 2.0)
                .put("pos", "z", "", 0.0, 0.0, 0.0)
                .build();
        return new Spacecraft(pos, SpacecraftName.WIND, ReferenceFrame.GSE);
    }

    private PlasmaStoreConfig withIdentity() {
        return PlasmaStoreConfig.getDefault().withSpacecraftName("Wind").withSpacecraftFrame("GSE");
    }

    @Test
    @DisplayName("Guardar y cargar conserva datos y especies; los escalares se recalculan")
    void saveAndLoad_shouldPreservePlasma() throws IOException {
        // --- 1. Arrange ---
        Plasma original = new Plasma(data, "a", "p1");
        Path file = tempDir.resolve("plasma.cbor");

        // --- 2. Act ---
        handler.save(original, file, PlasmaStoreConfig.getDefault());
        Plasma loaded = handler.load(file, PlasmaStoreConfig.getDefault());

        // --- 3. Assert ---
        assertThat(file).exists();
        assertThat(loaded.getSpecies()).isEqualTo(original.getSpecies());
        assertThat(loaded).isEqualTo(original);
        assertThat(loaded.getData().contains(ColumnKey.of("w", "scalar", "p1"))).isTrue();
        assertThat(loaded.getData().column("b", "y", "").isMissing(2)).isTrue();
        assertThat(loaded.getSpacecraft()).isEmpty();
        assertThat(loaded.getAuxiliaryData()).isEmpty();
    }

    @Test
    @DisplayName("La nave y los datos auxiliares viajan con el plasma")
    void saveAndLoad_withSpacecraftAndAuxiliaryData_shouldRestoreBoth() throws IOException {
        DataTable aux = DataTable.builder(ColumnScheme.MCS, index)
                .put("quality", "", "p1", 0.0, 1.0, 0.0)
                .build();
        Plasma original = new Plasma(data, List.of("a", "p1"), spacecraft(), aux, false);
        Path file = tempDir.resolve("full.cbor");

        handler.save(original, file, PlasmaStoreConfig.getDefault());
        Plasma loaded = handler.load(file, withIdentity());

        assertThat(loaded.getSpacecraft()).contains(original.getSpacecraft().orElseThrow());
        assertThat(loaded.getAuxiliaryData()).contains(aux);
    }

    @Test
    @DisplayName("Un archivo con nave exige su nombre y sistema de referencia")
    void load_withSpacecraftButNoIdentity_shouldThrow() throws IOException {
        Plasma original = new Plasma(data, List.of("a", "p1"), spacecraft(), null, false);
        Path file = tempDir.resolve("sc.cbor");
        handler.save(original, file, PlasmaStoreConfig.getDefault());

        assertThatThrownBy(() -> handler.load(file, PlasmaStoreConfig.getDefault()))
                .isInstanceOf(SchemaViolationException.class);

        // Sin clave de nave la tabla se ignora.
        Plasma withoutSpacecraft = handler.load(file, PlasmaStoreConfig.getDefault().withSpacecraftKey(null));
        assertThat(withoutSpacecraft.getSpacecraft()).isEmpty();
    }

    @Test
    @DisplayName("La ventana temporal y la lista de especies recortan lo cargado")
    void load_withWindowAndSpecies_shouldSubset() throws IOException {
        Path file = tempDir.resolve("subset.cbor");
        handler.save(new Plasma(data, "a", "p1"), file, PlasmaStoreConfig.getDefault());
        PlasmaStoreConfig config = PlasmaStoreConfig.builder()
                .dataKey(PlasmaStoreConfig.DEFAULT_DATA_KEY)
                .start(T0.plusSeconds(60))
                .build();

        Plasma loaded = handler.load(file, config, "p1");

        assertThat(loaded.getSpecies()).containsExactly("p1");
        assertThat(loaded.epoch().size()).isEqualTo(2);
        assertThat(loaded.epoch().first()).isEqualTo(T0.plusSeconds(60));
        assertThat(loaded.getIngestReport().dropped()).contains(ColumnKey.of("n", "", "a"));
    }

    @Test
    @DisplayName("Debería lanzar IOException al intentar leer un archivo que no existe")
    void load_whenFileDoesNotExist_shouldThrowIOException() {
        Path missing = tempDir.resolve("imaginary.cbor");

        assertThatThrownBy(() -> handler.load(missing, PlasmaStoreConfig.getDefault()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no existe");
    }

    @Test
    @DisplayName("Debería lanzar IOException al leer un archivo corrupto")
    void load_whenFileIsCorrupt_shouldThrowIOException() throws IOException {
        Path corrupt = tempDir.resolve("corrupt.cbor");
        Files.writeString(corrupt, "esto no es un almacén de plasma");

        assertThatThrownBy(() -> handler.load(corrupt, PlasmaStoreConfig.getDefault()))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Una clave de datos inexistente es un error de esquema")
    void load_whenDataKeyMissing_shouldThrow() throws IOException {
        Path file = tempDir.resolve("keys.cbor");
        handler.save(new Plasma(data, "a", "p1"), file, PlasmaStoreConfig.getDefault());

        assertThatThrownBy(() -> handler.load(file, PlasmaStoreConfig.getDefault().withDataKey("SWE")))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("FC");
    }
}
