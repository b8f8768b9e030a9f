package solarplasma.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import lombok.extern.slf4j.Slf4j;
import solarplasma.config.PlasmaStoreConfig;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.table.DataTable;
import solarplasma.physics.model.Plasma;
import solarplasma.physics.model.Spacecraft;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Guarda y carga plasmas en un almacén binario columnar (CBOR).
 * <p>
 * Cada archivo contiene hasta tres tablas con nombre: los datos del plasma
 * (sin las velocidades térmicas escalares, que se recalculan al cargar), la
 * trayectoria de la nave y los datos auxiliares.
 */
@Slf4j
public class PlasmaFileHandler {

    // Reutilizable y thread-safe.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new CBORMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Escribe el plasma en {@code path}. Si el archivo existe se sobrescribe.
     *
     * @param plasma El plasma a guardar. No puede ser nulo.
     * @param path   Archivo de destino.
     * @param config Claves de las tablas dentro del archivo.
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public void save(Plasma plasma, Path path, PlasmaStoreConfig config) throws IOException {
        Objects.requireNonNull(plasma, "El plasma a guardar no puede ser nulo.");
        Objects.requireNonNull(path, "La ruta de destino no puede ser nula.");
        Objects.requireNonNull(config, "La configuración de almacenamiento no puede ser nula.");

        Map<String, StoredTable> tables = new LinkedHashMap<>();
        DataTable data = plasma.getData().drop(k -> k.c().equals("scalar"));
        tables.put(config.dataKey(), StoredTable.of(data));
        log.info("Datos guardados\nfile   {}\ndkey   {}\nshape  {}x{}",
                path.toAbsolutePath(), config.dataKey(), data.rowCount(), data.columnCount());

        if (plasma.getSpacecraft().isPresent()) {
            DataTable sc = plasma.getSpacecraft().get().getData();
            tables.put(config.spacecraftKey(), StoredTable.of(sc));
            log.info("Nave guardada\nfile   {}\nsckey  {}\nshape  {}x{}",
                    path.toAbsolutePath(), config.spacecraftKey(), sc.rowCount(), sc.columnCount());
        } else {
            log.info("No hay datos de nave que guardar");
        }

        if (plasma.getAuxiliaryData().isPresent()) {
            DataTable aux = plasma.getAuxiliaryData().get();
            tables.put(config.auxiliaryKey(), StoredTable.of(aux));
            log.info("Datos auxiliares guardados\nfile   {}\nakey   {}\nshape  {}x{}",
                    path.toAbsolutePath(), config.auxiliaryKey(), aux.rowCount(), aux.columnCount());
        } else {
            log.info("No hay datos auxiliares que guardar");
        }

        try {
            if (path.toAbsolutePath().getParent() != null) {
                Files.createDirectories(path.toAbsolutePath().getParent());
            }
            objectMapper.writeValue(path.toFile(), new PlasmaStore(tables));
            log.debug("Escritura del plasma completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo de plasma en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Reconstruye un plasma guardado con {@link #save}.
     *
     * @param path    Archivo a leer.
     * @param config  Claves de las tablas, ventana temporal e identidad de la nave.
     * @param species Especies a cargar. Sin especies se cargan todas las del archivo.
     * @return El plasma con su nave y datos auxiliares, si el archivo los contiene.
     * @throws IOException              Si el archivo no existe o no se puede leer.
     * @throws SchemaViolationException Si falta la tabla del plasma o la identidad de la nave.
     */
    public Plasma load(Path path, PlasmaStoreConfig config, String... species) throws IOException {
        Objects.requireNonNull(path, "La ruta de origen no puede ser nula.");
        Objects.requireNonNull(config, "La configuración de almacenamiento no puede ser nula.");
        log.info("Cargando plasma desde {}", path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        PlasmaStore store;
        try {
            store = objectMapper.readValue(path.toFile(), PlasmaStore.class);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo de plasma desde {}", path.toAbsolutePath(), e);
            throw e;
        }

        StoredTable storedData = store.tables().get(config.dataKey());
        if (storedData == null) {
            throw new SchemaViolationException("El archivo " + path + " no contiene la tabla '" + config.dataKey()
                    + "'. Tablas disponibles: " + store.tables().keySet());
        }
        DataTable data = storedData.toDataTable().between(config.start(), config.stop());

        List<String> selected = species.length > 0
                ? Arrays.asList(species)
                : data.speciesLevel().stream().filter(s -> !s.isEmpty()).toList();

        Spacecraft spacecraft = loadSpacecraft(store, config);
        DataTable aux = loadAuxiliaryData(store, config);

        Plasma plasma = new Plasma(data, selected, spacecraft, aux, config.logPlasmaStats());
        log.info("Plasma cargado\nfile   {}\ndkey   {}\nshape  {}x{}\nstart  {}\nstop   {}",
                path.toAbsolutePath(), config.dataKey(), data.rowCount(), data.columnCount(),
                data.getIndex().first(), data.getIndex().last());
        return plasma;
    }

    private Spacecraft loadSpacecraft(PlasmaStore store, PlasmaStoreConfig config) {
        if (config.spacecraftKey() == null || !store.tables().containsKey(config.spacecraftKey())) {
            return null;
        }
        if (!config.hasSpacecraftIdentity()) {
            throw new SchemaViolationException("Hay que indicar el nombre y el sistema de referencia de la nave\n"
                    + "name : " + config.spacecraftName() + "\nframe: " + config.spacecraftFrame());
        }
        DataTable sc = store.tables().get(config.spacecraftKey()).toDataTable().between(config.start(), config.stop());
        log.info("Datos de nave cargados\nsckey  {}\nshape  {}x{}", config.spacecraftKey(), sc.rowCount(), sc.columnCount());
        return new Spacecraft(sc, config.spacecraftName(), config.spacecraftFrame());
    }

    private DataTable loadAuxiliaryData(PlasmaStore store, PlasmaStoreConfig config) {
        if (config.auxiliaryKey() == null || !store.tables().containsKey(config.auxiliaryKey())) {
            return null;
        }
        DataTable aux = store.tables().get(config.auxiliaryKey()).toDataTable().between(config.start(), config.stop());
        log.info("Datos auxiliares cargados\nakey   {}\nshape  {}x{}", config.auxiliaryKey(), aux.rowCount(), aux.columnCount());
        return aux;
    }
}
