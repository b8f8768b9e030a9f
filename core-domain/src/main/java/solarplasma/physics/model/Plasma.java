package solarplasma.physics.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import solarplasma.config.TurbulenceConfig;
import solarplasma.domain.exception.AmbiguousOperationException;
import solarplasma.domain.exception.MissingCollaboratorException;
import solarplasma.domain.exception.SchemaViolationException;
import solarplasma.domain.exception.SpeciesUnavailableException;
import solarplasma.domain.species.SpeciesAlgebra;
import solarplasma.domain.table.ColumnKey;
import solarplasma.domain.table.ColumnScheme;
import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.IngestReport;
import solarplasma.domain.table.Series;
import solarplasma.domain.table.TimeIndex;
import solarplasma.physics.collisions.CoulombCollisions;
import solarplasma.physics.turbulence.AlfvenicTurbulence;
import solarplasma.physics.units.Constants;
import solarplasma.physics.units.ParticleSpecies;
import solarplasma.physics.units.Units;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.DoubleSummaryStatistics;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;

/**
 * Plasma multiespecie: campo magnético, iones y, opcionalmente, la nave y datos auxiliares.
 * <p>
 * La tabla canónica es de esquema MCS. En la construcción sólo se conservan las
 * combinaciones reconocidas de medida {b, n, v, w}, componente
 * {"", x, y, z, per, par} y especie (las pedidas más ""); el resto se descarta y
 * queda en el {@link IngestReport}. La velocidad térmica escalar de cada especie se
 * recalcula por cuadratura.
 * <p>
 * Convención de especies en los métodos de cálculo:
 * <ul>
 * <li>Forma singular, {@code numberDensity("a+p1")}: una única especie, quizá
 * compuesta con '+'. Devuelve el resultado combinado.</li>
 * <li>Forma plural, {@code numberDensity("a", "p1")}: varias especies atómicas.
 * Devuelve una tabla MCS con una columna (o grupo de componentes) por especie.</li>
 * </ul>
 * El estado interno se reconstruye completo y se sustituye de una vez; ningún
 * llamador ve un plasma a medio reconstruir.
 */
@Slf4j
public class Plasma {

    static final Set<String> MEASUREMENTS = Set.of("b", "n", "v", "w");
    static final Set<String> COMPONENTS = Set.of("", "x", "y", "z", "per", "par");

    private static final String SCALAR = "scalar";
    private static final String ELECTRONS = "e";

    /**
     * Todo lo que se reconstruye en bloque cuando cambian los datos o las especies.
     */
    private record State(List<String> species, DataTable data, Map<String, Ion> ions,
                         BField bfield, IngestReport report) {
    }

    private volatile State state;

    private final Spacecraft spacecraft;
    private final DataTable auxiliaryData;

    /**
     * Registrar estadísticas de cada tabla al cargarla.
     */
    @Getter
    private final boolean logPlasmaStats;

    public Plasma(DataTable data, String... species) {
        this(data, Arrays.asList(species), null, null, false);
    }

    /**
     * @param data           Tabla MCS con el campo magnético y los momentos iónicos.
     * @param species        Especies a extraer de la tabla (sin '+'; una única entrada puede ir separada por comas).
     * @param spacecraft     Trayectoria de la nave, puede ser nula. Sin ella no hay número de Coulomb.
     * @param auxiliaryData  Medidas adicionales (tabla MCS) que viajan con el plasma, puede ser nula.
     * @param logPlasmaStats Registrar estadísticas (NaN, media, extremos) de cada tabla al cargarla.
     * @throws SchemaViolationException si la tabla, la nave o los datos auxiliares no encajan.
     */
    public Plasma(DataTable data, List<String> species, Spacecraft spacecraft, DataTable auxiliaryData,
                  boolean logPlasmaStats) {
        Objects.requireNonNull(data, "Los datos del plasma no pueden ser nulos.");
        Objects.requireNonNull(species, "Las especies del plasma no pueden ser nulas.");
        this.logPlasmaStats = logPlasmaStats;
        this.state = buildState(data, species);
        this.spacecraft = validateSpacecraft(spacecraft);
        this.auxiliaryData = validateAuxiliaryData(auxiliaryData);
    }

    /**
     * Construye el plasma y devuelve también el informe de columnas aceptadas y descartadas.
     */
    public static PlasmaIngest ingest(DataTable data, List<String> species, Spacecraft spacecraft,
                                      DataTable auxiliaryData, boolean logPlasmaStats) {
        Plasma plasma = new Plasma(data, species, spacecraft, auxiliaryData, logPlasmaStats);
        return new PlasmaIngest(plasma, plasma.getIngestReport());
    }

    // --- Construcción del estado ---

    private State buildState(DataTable raw, List<String> requested) {
        if (raw.getScheme() != ColumnScheme.MCS) {
            throw new SchemaViolationException("Los niveles de columna deben ser " + ColumnScheme.MCS.getLevelNames()
                    + ", se recibió " + raw.getScheme().getLevelNames());
        }
        List<String> species = SpeciesAlgebra.cleanForSetting(getClass().getSimpleName(), requested.toArray(new String[0]));
        log.debug("{} creado con las especies {}", getClass().getSimpleName(), species);

        if (!raw.getIndex().isMonotonicIncreasing()) {
            log.warn("Índice temporal no monótono: suele indicar datos malos.");
        }

        Set<String> allowedSpecies = new HashSet<>(species);
        allowedSpecies.add("");
        Predicate<ColumnKey> recognized = k -> MEASUREMENTS.contains(k.m())
                && COMPONENTS.contains(k.c())
                && allowedSpecies.contains(k.s());
        DataTable accepted = raw.filter(recognized);
        List<ColumnKey> dropped = raw.drop(recognized).keys();

        DataTable.Builder builder = DataTable.builder(ColumnScheme.MCS, raw.getIndex()).putAll(accepted);
        for (String s : species) {
            ColumnKey par = ColumnKey.of("w", "par", s);
            ColumnKey per = ColumnKey.of("w", "per", s);
            if (accepted.contains(par) && accepted.contains(per)) {
                builder.put(ColumnKey.of("w", SCALAR, s), Ion.scalarThermalSpeed(accepted.column(par), accepted.column(per)));
            }
        }
        DataTable data = builder.build();

        log.debug("forma del plasma: {} filas x {} columnas\ninicio: {}\nfin: {}",
                data.rowCount(), data.columnCount(), data.getIndex().first(), data.getIndex().last());
        if (dropped.isEmpty()) {
            log.info("Ninguna columna descartada del plasma");
        } else {
            log.info("Columnas descartadas del plasma\n{}", dropped);
        }

        BField bfield = new BField(data.measurement("b", ""));
        Map<String, Ion> ions = new LinkedHashMap<>();
        for (String s : species) {
            ions.put(s, new Ion(data, s));
        }
        logObjectAtLoad(data, "plasma");
        return new State(species, data, Collections.unmodifiableMap(ions), bfield,
                new IngestReport(accepted.keys(), dropped));
    }

    private Spacecraft validateSpacecraft(Spacecraft candidate) {
        if (candidate != null && !candidate.getIndex().equals(epoch())) {
            throw new SchemaViolationException("El índice temporal de la nave debe coincidir con el del plasma.");
        }
        logObjectAtLoad(candidate == null ? null : candidate.getData(), "spacecraft");
        return candidate;
    }

    private DataTable validateAuxiliaryData(DataTable candidate) {
        if (candidate != null) {
            if (candidate.getScheme() != ColumnScheme.MCS) {
                throw new SchemaViolationException("Los datos auxiliares deben tener niveles " + ColumnScheme.MCS.getLevelNames());
            }
            if (!candidate.getIndex().equals(epoch())) {
                throw new SchemaViolationException("El índice temporal de los datos auxiliares debe coincidir con el del plasma.");
            }
            List<ColumnKey> duplicated = candidate.keys().stream().filter(state.data()::contains).toList();
            if (!duplicated.isEmpty()) {
                throw new SchemaViolationException("Los datos auxiliares no deben duplicar datos del plasma: " + duplicated);
            }
        }
        logObjectAtLoad(candidate, "auxiliary_data");
        return candidate;
    }

    private void logObjectAtLoad(DataTable data, String name) {
        if (data == null) {
            log.info("No se han pasado datos de {} a {}", name, getClass().getSimpleName());
            return;
        }
        if (!logPlasmaStats) {
            return;
        }
        List<ColumnKey> keys = data.keys();
        List<Series> columns = keys.stream().map(data::column).toList();
        long rowsWithNaN = IntStream.range(0, data.rowCount())
                .filter(row -> columns.stream().anyMatch(c -> c.isMissing(row)))
                .count();
        if (rowsWithNaN > 0) {
            log.info("{}: {} espectros contienen al menos un NaN", name, rowsWithNaN);
        } else {
            log.debug("{} no contiene NaN", name);
        }
        for (int i = 0; i < keys.size(); i++) {
            Series column = columns.get(i);
            DoubleSummaryStatistics stats = column.statistics();
            log.debug("{} {} -> count={} NaN={} mean={} min={} max={}", name, keys.get(i),
                    stats.getCount(), column.missingCount(), stats.getAverage(), stats.getMin(), stats.getMax());
        }
    }

    // --- Accesores ---

    public TimeIndex epoch() {
        return state.data().getIndex();
    }

    public List<String> getSpecies() {
        return state.species();
    }

    /**
     * Tabla canónica MCS (incluye las velocidades térmicas escalares recalculadas).
     */
    public DataTable getData() {
        return state.data();
    }

    public Map<String, Ion> getIons() {
        return state.ions();
    }

    public BField getBField() {
        return state.bfield();
    }

    public IngestReport getIngestReport() {
        return state.report();
    }

    public Optional<Spacecraft> getSpacecraft() {
        return Optional.ofNullable(spacecraft);
    }

    public Optional<DataTable> getAuxiliaryData() {
        return Optional.ofNullable(auxiliaryData);
    }

    /**
     * @throws SpeciesUnavailableException si la especie no está en el plasma.
     */
    public Ion ion(String species) {
        Map<String, Ion> ions = state.ions();
        Ion ion = ions.get(species);
        if (ion == null) {
            throw new SpeciesUnavailableException(List.of(String.valueOf(species)), sorted(ions.keySet()),
                    List.of(String.valueOf(species)));
        }
        return ion;
    }

    // --- Resolución de especies ---

    /**
     * Normaliza las especies de una llamada y comprueba que todos sus
     * constituyentes atómicos existen.
     *
     * @return Constituyentes atómicos, ordenados y sin repetir.
     */
    List<String> checkSpecies(String... species) {
        List<String> conformed = SpeciesAlgebra.conform(species);
        List<String> atoms = SpeciesAlgebra.atomic(conformed);
        Map<String, Ion> ions = state.ions();
        List<String> unavailable = atoms.stream().filter(s -> !ions.containsKey(s)).toList();
        if (!unavailable.isEmpty()) {
            throw new SpeciesUnavailableException(conformed, sorted(ions.keySet()), unavailable);
        }
        return atoms;
    }

    private String requireSingle(String operation, String species) {
        List<String> atoms = checkSpecies(species);
        if (atoms.size() > 1) {
            throw new AmbiguousOperationException("'" + operation + "' sólo admite especies individuales: " + species);
        }
        return atoms.get(0);
    }

    private static List<String> sorted(Set<String> species) {
        List<String> out = new ArrayList<>(species);
        Collections.sort(out);
        return out;
    }

    private static String[] concat(String s0, String s1, String... more) {
        String[] out = new String[more.length + 2];
        out[0] = s0;
        out[1] = s1;
        System.arraycopy(more, 0, out, 2, more.length);
        return out;
    }

    private Series sumOver(List<String> atoms, Function<Ion, Series> quantity) {
        return Series.sum(atoms.stream().map(s -> quantity.apply(ion(s))).toList());
    }

    private Tensor sumTensor(List<String> atoms, Function<Ion, Tensor> quantity) {
        List<Tensor> tensors = atoms.stream().map(s -> quantity.apply(ion(s))).toList();
        return Tensor.of(
                Series.sum(tensors.stream().map(Tensor::par).toList()),
                Series.sum(tensors.stream().map(Tensor::per).toList()),
                Series.sum(tensors.stream().map(Tensor::scalar).toList()));
    }

    private DataTable perSpecies(String m, List<String> species, Function<String, Series> quantity) {
        DataTable.Builder builder = DataTable.builder(ColumnScheme.MCS, epoch());
        for (String s : species) {
            builder.put(ColumnKey.of(m, "", s), quantity.apply(s));
        }
        return builder.build();
    }

    private DataTable perSpeciesComponents(String m, List<String> species, Function<String, DataTable> quantity) {
        DataTable.Builder builder = DataTable.builder(ColumnScheme.MCS, epoch());
        for (String s : species) {
            DataTable components = quantity.apply(s);
            for (ColumnKey key : components.keys()) {
                builder.put(ColumnKey.of(m, key.c(), s), components.column(key));
            }
        }
        return builder.build();
    }

    private Series bSquared() {
        return getBField().magnitude().pow(2);
    }

    // --- Densidades ---

    public Series numberDensity(String species) {
        return sumOver(checkSpecies(species), Ion::numberDensity).withName(species);
    }

    public DataTable numberDensity(String s0, String s1, String... more) {
        return perSpecies("n", checkSpecies(concat(s0, s1, more)), s -> ion(s).numberDensity());
    }

    public Series massDensity(String species) {
        return sumOver(checkSpecies(species), Ion::massDensity).withName(species);
    }

    public DataTable massDensity(String s0, String s1, String... more) {
        return perSpecies("rho", checkSpecies(concat(s0, s1, more)), s -> ion(s).massDensity());
    }

    // --- Velocidad térmica, presión y temperatura ---

    /**
     * @throws AmbiguousOperationException si la especie es compuesta: la velocidad térmica total no está definida.
     */
    public Tensor thermalSpeed(String species) {
        rejectComposite(species);
        return ion(checkSpecies(species).get(0)).thermalSpeed();
    }

    public DataTable thermalSpeed(String s0, String s1, String... more) {
        String[] all = concat(s0, s1, more);
        rejectComposite(all);
        return perSpeciesComponents("w", checkSpecies(all), s -> ion(s).thermalSpeed().getData());
    }

    private static void rejectComposite(String... species) {
        if (Arrays.stream(species).anyMatch(s -> s != null && s.contains(SpeciesAlgebra.SUM))) {
            throw new AmbiguousOperationException("La velocidad térmica de una especie total es físicamente ambigua: "
                    + Arrays.toString(species));
        }
    }

    public Tensor thermalPressure(String species) {
        return sumTensor(checkSpecies(species), Ion::thermalPressure);
    }

    public DataTable thermalPressure(String s0, String s1, String... more) {
        return perSpeciesComponents("pth", checkSpecies(concat(s0, s1, more)), s -> ion(s).thermalPressure().getData());
    }

    public Tensor temperature(String species) {
        return sumTensor(checkSpecies(species), Ion::temperature);
    }

    public DataTable temperature(String s0, String s1, String... more) {
        return perSpeciesComponents("T", checkSpecies(concat(s0, s1, more)), s -> ion(s).temperature().getData());
    }

    /**
     * Beta del plasma por componente de presión: β = 2 μ₀ p_th / B².
     * <p>
     * Con w² = 2kT/m y C_A² = B²/(μ₀ρ) equivale a β = w² / C_A².
     */
    public Tensor beta(String species) {
        Series bsq = bSquared();
        double coeff = 2.0 * Constants.VACUUM_PERMEABILITY * Units.PTH / (Units.B * Units.B) / Units.BETA;
        return thermalPressure(species).map(p -> p.dividedBy(bsq).times(coeff).withName("beta"));
    }

    public DataTable beta(String s0, String s1, String... more) {
        return perSpeciesComponents("beta", checkSpecies(concat(s0, s1, more)), s -> beta(s).getData());
    }

    /**
     * Anisotropía de presión p_⟂ / p_∥. Para una especie compuesta se suman antes las presiones.
     */
    public Series anisotropy(String species) {
        Tensor pth = thermalPressure(species);
        return pth.per().dividedBy(pth.par()).withName(species);
    }

    public DataTable anisotropy(String s0, String s1, String... more) {
        return perSpecies("RT", checkSpecies(concat(s0, s1, more)), this::anisotropy);
    }

    // --- Velocidades ---

    public Vector velocity(String species) {
        return velocity(species, false);
    }

    /**
     * Velocidad de una especie, o velocidad del centro de masas si la especie es compuesta.
     *
     * @param projectM2q Proyectar la velocidad por sqrt(m/q) para comparar instrumentos.
     *                   Sólo válido con una especie atómica.
     * @throws AmbiguousOperationException si se pide la proyección m/q de una especie compuesta.
     */
    public Vector velocity(String species, boolean projectM2q) {
        List<String> atoms = checkSpecies(species);
        if (atoms.size() == 1) {
            String s = atoms.get(0);
            Vector v = ion(s).velocity();
            if (projectM2q) {
                ParticleSpecies constants = ParticleSpecies.fromCode(s);
                v = v.times(Math.sqrt(constants.getMassInProtonMasses() / constants.getChargeState()));
            }
            return v;
        }
        if (projectM2q) {
            throw new AmbiguousOperationException("No se puede proyectar por m/q la velocidad del centro de masas.\n"
                    + "species: " + atoms);
        }
        Series totalRho = sumOver(atoms, Ion::massDensity);
        List<Series> com = new ArrayList<>();
        for (String c : Vector.COMPONENTS) {
            com.add(sumOver(atoms, ion -> ion.velocity().component(c).times(ion.massDensity())).dividedBy(totalRho));
        }
        return Vector.of(com.get(0), com.get(1), com.get(2));
    }

    public DataTable velocity(String s0, String s1, String... more) {
        return perSpeciesComponents("v", checkSpecies(concat(s0, s1, more)), s -> ion(s).velocity().cartesian());
    }

    public Vector differentialFlow(String s0, String s1) {
        return differentialFlow(s0, s1, false);
    }

    /**
     * Flujo diferencial v_s0 − v_s1. Una especie compuesta usa su velocidad del centro de masas.
     *
     * @throws AmbiguousOperationException si s0 y s1 son la misma especie (resultado idénticamente nulo).
     */
    public Vector differentialFlow(String s0, String s1, boolean projectM2q) {
        Objects.requireNonNull(s0, "s0 no puede ser nula.");
        Objects.requireNonNull(s1, "s1 no puede ser nula.");
        if (s0.equals(s1) || SpeciesAlgebra.conform(s0).equals(SpeciesAlgebra.conform(s1))) {
            throw new AmbiguousOperationException("El flujo diferencial de una especie consigo misma es idénticamente nulo.\n"
                    + "s0: " + s0 + "\ns1: " + s1);
        }
        return velocity(s0, projectM2q).minus(velocity(s1, projectM2q));
    }

    public Series dynamicPressure(String... species) {
        return dynamicPressure(false, species);
    }

    /**
     * Presión dinámica del movimiento relativo de las especies respecto a su centro de masas:
     * p_ṽ = ½ Σ ρ_i (v_i − v_com)².
     * <p>
     * Con proyección m/q sólo se admiten dos especies y se usa su flujo diferencial
     * con la masa reducida ρ₀ρ₁/(ρ₀+ρ₁).
     */
    public Series dynamicPressure(boolean projectM2q, String... species) {
        List<String> atoms = checkSpecies(species);
        if (atoms.size() <= 1) {
            throw new SchemaViolationException("Se necesita más de una especie para la presión dinámica.\nSolicitadas: "
                    + Arrays.toString(species));
        }
        double coeff = 0.5 * Units.RHO * Units.DV * Units.DV / Units.PTH;
        Series pdv;
        if (!projectM2q) {
            String com = SpeciesAlgebra.join(atoms);
            pdv = Series.sum(atoms.stream().map(s -> {
                Vector dv = differentialFlow(s, com);
                return dv.dot(dv).times(ion(s).massDensity());
            }).toList());
        } else if (atoms.size() == 2) {
            Vector dv = differentialFlow(atoms.get(0), atoms.get(1), true);
            Series rho0 = ion(atoms.get(0)).massDensity();
            Series rho1 = ion(atoms.get(1)).massDensity();
            Series mu = rho0.times(rho1).dividedBy(rho0.plus(rho1));
            pdv = dv.dot(dv).times(mu);
        } else {
            throw new AmbiguousOperationException("La presión dinámica proyectada por m/q sólo admite dos especies.\n"
                    + "species: " + atoms);
        }
        return pdv.times(coeff).withName("pdynamic");
    }

    // --- Velocidades características ---

    /**
     * c_s = sqrt(γ p_th / ρ). Una especie compuesta suma presiones y densidades.
     */
    public Series soundSpeed(String species) {
        List<String> atoms = checkSpecies(species);
        Series pth = sumTensor(atoms, Ion::thermalPressure).scalar().times(Units.PTH);
        Series rho = sumOver(atoms, Ion::massDensity).times(Units.RHO);
        return pth.dividedBy(rho).times(Constants.POLYTROPIC_INDEX).sqrt().dividedBy(Units.CS).withName(species);
    }

    public DataTable soundSpeed(String s0, String s1, String... more) {
        return perSpecies("cs", checkSpecies(concat(s0, s1, more)), this::soundSpeed);
    }

    /**
     * C_A = B / sqrt(μ₀ ρ).
     */
    public Series alfvenSpeed(String species) {
        Series rho = massDensity(species);
        double coeff = Units.B / (Math.sqrt(Units.RHO * Constants.VACUUM_PERMEABILITY) * Units.CA);
        return rho.pow(-0.5).times(getBField().magnitude()).times(coeff).withName(species);
    }

    public DataTable alfvenSpeed(String s0, String s1, String... more) {
        return perSpecies("ca", checkSpecies(concat(s0, s1, more)), this::alfvenSpeed);
    }

    /**
     * AF² = 1 + μ₀ (p_⟂ − p_∥) / B².
     * <p>
     * No es aditivo: afsq("s0+s1") = 1 + Σ (afsq(s) − 1), que no coincide con la
     * suma de la forma plural.
     */
    public Series anisotropyFactorSquared(String species) {
        Tensor pth = thermalPressure(species);
        double coeff = Constants.VACUUM_PERMEABILITY * Units.PTH / (Units.B * Units.B);
        return pth.per().minus(pth.par()).dividedBy(bSquared()).times(coeff).plus(1.0).withName(species);
    }

    public DataTable anisotropyFactorSquared(String s0, String s1, String... more) {
        return perSpecies("afsq", checkSpecies(concat(s0, s1, more)), this::anisotropyFactorSquared);
    }

    /**
     * Velocidad de Alfvén MHD anisótropa C_A sqrt(AF²), siempre sobre la suma de las especies dadas.
     */
    public Series anisotropicAlfvenSpeed(String... species) {
        String total = SpeciesAlgebra.join(checkSpecies(species));
        return alfvenSpeed(total).times(anisotropyFactorSquared(total).sqrt()).withName(total);
    }

    // --- Colisiones ---

    public Series coulombLogarithm(String s0, String s1) {
        String a = requireSingle("coulombLogarithm", s0);
        String b = requireSingle("coulombLogarithm", s1);
        Ion ion0 = ion(a);
        Ion ion1 = ion(b);
        return CoulombCollisions.coulombLogarithm(
                ParticleSpecies.fromCode(a), ion0.numberDensity(), ion0.temperature().scalar(),
                ParticleSpecies.fromCode(b), ion1.numberDensity(), ion1.temperature().scalar());
    }

    public Series collisionFrequency(String sa, String sb) {
        return collisionFrequency(sa, sb, true);
    }

    /**
     * Frecuencia de colisión de momento de {@code sa} (prueba) sobre {@code sb} (campo).
     *
     * @param bothSpecies Tasa efectiva de un plasma de dos especies (nombre "sa+sb")
     *                    en lugar de la tasa de prueba sobre campo (nombre "sa-sb").
     */
    public Series collisionFrequency(String sa, String sb, boolean bothSpecies) {
        String a = requireSingle("collisionFrequency", sa);
        String b = requireSingle("collisionFrequency", sb);
        Ion ionA = ion(a);
        Ion ionB = ion(b);
        Series nuab = CoulombCollisions.momentumRate(
                ParticleSpecies.fromCode(a), ParticleSpecies.fromCode(b),
                ionB.numberDensity(),
                ionA.thermalSpeed().par(), ionB.thermalSpeed().par(),
                differentialFlow(a, b).magnitude(),
                coulombLogarithm(a, b));
        if (bothSpecies) {
            return CoulombCollisions.twoSpeciesRate(nuab, ionA.massDensity(), ionB.massDensity()).withName(a + "+" + b);
        }
        return nuab.withName(a + "-" + b);
    }

    public Series selfCollisionFrequency(String species) {
        String s = requireSingle("selfCollisionFrequency", species);
        Ion ion = ion(s);
        return CoulombCollisions.selfCollisionFrequency(ParticleSpecies.fromCode(s), ion.numberDensity(),
                ion.temperature().par(), coulombLogarithm(s, s));
    }

    public Series coulombNumber(String sa, String sb) {
        return coulombNumber(sa, sb, true);
    }

    /**
     * Número de Coulomb: frecuencia de colisión por el tiempo de expansión r / v_sw,
     * con v_sw la velocidad del centro de masas de todas las especies.
     *
     * @throws MissingCollaboratorException si el plasma no tiene nave.
     */
    public Series coulombNumber(String sa, String sb, boolean bothSpecies) {
        if (spacecraft == null) {
            throw new MissingCollaboratorException(
                    "El plasma no contiene datos de la nave. No se puede calcular el número de Coulomb.");
        }
        String a = requireSingle("coulombNumber", sa);
        String b = requireSingle("coulombNumber", sb);
        Series r = spacecraft.distanceToSun().times(Units.DISTANCE_TO_SUN);
        Series vsw = velocity(SpeciesAlgebra.join(getSpecies())).magnitude().times(Units.V);
        Series expansionTime = r.dividedBy(vsw);
        Series nuc = collisionFrequency(a, b, bothSpecies);
        return nuc.times(Units.NUC).times(expansionTime).dividedBy(Units.NC).withName(nuc.getName());
    }

    // --- Cocientes de distribuciones ---

    public Series vdfRatio() {
        return vdfRatio("p2", "p1");
    }

    /**
     * ln(f_beam / f_core) evaluado en la velocidad de pico del haz, con ambas
     * poblaciones bi-maxwellianas:
     * ln[(n₂/n₁)(w₁∥/w₂∥)(w₁⟂/w₂⟂)²] + (Δv∥/w₁∥)² + (Δv⟂/w₁⟂)².
     * <p>
     * Δv se proyecta por m/q, como en la validación de datos de copa de Faraday.
     */
    public Series vdfRatio(String beam, String core) {
        String b = requireSingle("vdfRatio", beam);
        String c = requireSingle("vdfRatio", core);
        Tensor w1 = ion(c).thermalSpeed();
        Tensor w2 = ion(b).thermalSpeed();
        VectorProjection dv = differentialFlow(b, c, true).project(getBField());
        Series dvw = dv.parallel().dividedBy(w1.par()).pow(2)
                .plus(dv.perpendicular().dividedBy(w1.per()).pow(2));
        Series nbar = ion(b).numberDensity().dividedBy(ion(c).numberDensity());
        Series wbar = w1.par().dividedBy(w2.par()).times(w1.per().dividedBy(w2.per()).pow(2));
        return nbar.times(wbar).log().plus(dvw).withName(b + "/" + c);
    }

    // --- Electrones ---

    public Ion estimateElectrons() {
        return estimateElectrons(false);
    }

    /**
     * Estima una población de electrones que neutraliza la carga de los iones,
     * suponiendo la misma temperatura escalar que los protones.
     * <p>
     * n_e = Σ n_i Z_i, v_e = Σ n_i Z_i v_i / n_e, w_e = sqrt((n_p/n_e)(m_p/m_e)) w_p.
     * Las filas con n_e = 0 quedan a NaN.
     *
     * @param inplace Añadir los electrones a este plasma (se reconstruye el estado completo).
     * @throws AmbiguousOperationException  si ya hay electrones o si conviven "p" y "p1".
     * @throws SpeciesUnavailableException si no hay ni "p" ni "p1".
     */
    public Ion estimateElectrons(boolean inplace) {
        State current = state;
        List<String> species = current.species();
        if (species.contains(ELECTRONS)) {
            throw new AmbiguousOperationException("No se pueden estimar electrones si el plasma ya los contiene.");
        }
        boolean hasP = species.contains("p");
        boolean hasP1 = species.contains("p1");
        if (hasP && hasP1) {
            throw new AmbiguousOperationException("El plasma no puede contener protones (p) y protones del núcleo (p1).\n"
                    + "Especies disponibles: " + species);
        }
        if (!hasP && !hasP1) {
            throw new SpeciesUnavailableException(List.of("p", "p1"), species, List.of("p", "p1"));
        }
        Ion protons = current.ions().get(hasP ? "p" : "p1");

        List<Series> chargeDensities = species.stream()
                .map(s -> current.ions().get(s).numberDensity().times(ParticleSpecies.fromCode(s).getChargeState()))
                .toList();
        Series ne = Series.sum(chargeDensities);
        UnaryOperator<Series> maskEmpty = s -> s.zip(ne, (value, n) -> n == 0.0 ? Double.NaN : value);

        TimeIndex index = current.data().getIndex();
        DataTable.Builder electrons = DataTable.builder(ColumnScheme.MC, index)
                .put(ColumnKey.of("n", "", ""), maskEmpty.apply(ne));
        for (String c : Vector.COMPONENTS) {
            List<Series> terms = new ArrayList<>();
            for (int i = 0; i < species.size(); i++) {
                terms.add(chargeDensities.get(i).times(current.ions().get(species.get(i)).velocity().component(c)));
            }
            electrons.put(ColumnKey.of("v", c, ""), maskEmpty.apply(Series.sum(terms).dividedBy(ne)));
        }
        Series we = protons.numberDensity().dividedBy(ne)
                .times(1.0 / Constants.ELECTRON_PROTON_MASS_RATIO)
                .times(protons.thermalSpeed().scalar().pow(2))
                .sqrt();
        electrons.put(ColumnKey.of("w", "par", ""), maskEmpty.apply(we))
                .put(ColumnKey.of("w", "per", ""), maskEmpty.apply(we));
        DataTable electronTable = electrons.build();

        if (inplace) {
            DataTable.Builder merged = DataTable.builder(ColumnScheme.MCS, index)
                    .putAll(current.data().drop(k -> k.c().equals(SCALAR)));
            for (ColumnKey key : electronTable.keys()) {
                merged.put(key.withSpecies(ELECTRONS), electronTable.column(key));
            }
            List<String> withElectrons = new ArrayList<>(species);
            withElectrons.add(ELECTRONS);
            state = buildState(merged.build(), withElectrons);
            log.info("Electrones estimados y añadidos al plasma");
        }
        return new Ion(electronTable, ELECTRONS);
    }

    // --- Flujo de calor y entropía ---

    /**
     * Flujo de calor paralelo Q∥ = ρ (v³ + 3/2 v w∥²), con v la deriva de cada especie
     * respecto al centro de masas proyectada sobre B. La forma singular suma las especies.
     */
    public Series heatFlux(String species) {
        List<String> atoms = checkSpecies(species);
        return Series.sum(new ArrayList<>(heatFluxBySpecies(atoms).values())).withName(species);
    }

    public DataTable heatFlux(String s0, String s1, String... more) {
        List<String> atoms = checkSpecies(concat(s0, s1, more));
        Map<String, Series> bySpecies = heatFluxBySpecies(atoms);
        return perSpecies("qpar", atoms, bySpecies::get);
    }

    private Map<String, Series> heatFluxBySpecies(List<String> atoms) {
        if (atoms.size() <= 1) {
            throw new SchemaViolationException("Se necesita más de una especie para el flujo de calor: " + atoms);
        }
        String com = SpeciesAlgebra.join(atoms);
        BField b = getBField();
        double coeff = Units.RHO * Math.pow(Units.V, 3) / Units.QPAR;
        Map<String, Series> out = new LinkedHashMap<>();
        for (String s : atoms) {
            Ion ion = ion(s);
            Series dv = differentialFlow(s, com).project(b).parallel();
            Series w = ion.thermalSpeed().par();
            Series q = dv.pow(3).plus(dv.times(w.pow(2)).times(1.5)).times(ion.massDensity()).times(coeff);
            out.put(s, q.withName(s));
        }
        return out;
    }

    /**
     * Entropía específica p_th ρ^(−γ). Una especie compuesta suma presiones y densidades.
     */
    public Series specificEntropy(String species) {
        List<String> atoms = checkSpecies(species);
        Series pth = sumTensor(atoms, Ion::thermalPressure).scalar().times(Units.PTH);
        Series rho = sumOver(atoms, Ion::massDensity).times(Units.RHO);
        return pth.times(rho.pow(-Constants.POLYTROPIC_INDEX)).dividedBy(Units.SPECIFIC_ENTROPY).withName("S");
    }

    public DataTable specificEntropy(String s0, String s1, String... more) {
        return perSpecies("S", checkSpecies(concat(s0, s1, more)), this::specificEntropy);
    }

    // --- Turbulencia ---

    public AlfvenicTurbulence buildAlfvenicTurbulence(String species) {
        return buildAlfvenicTurbulence(species, TurbulenceConfig.getDefault());
    }

    /**
     * Sin coma se usa la velocidad (del centro de masas) de {@code species}. Con una
     * coma, {@code "s0,s1"}, se usa el flujo diferencial v_s0 − v_s1 y la densidad de
     * masa de s1 para pasar el campo a unidades de Alfvén.
     *
     * @throws SchemaViolationException si hay más de una coma.
     */
    public AlfvenicTurbulence buildAlfvenicTurbulence(String species, TurbulenceConfig config) {
        Objects.requireNonNull(species, "La especie de la turbulencia no puede ser nula.");
        String[] parts = species.split(SpeciesAlgebra.LIST, -1);
        Vector v;
        Series rho;
        if (parts.length == 1) {
            checkSpecies(species);
            v = velocity(species);
            rho = massDensity(species);
        } else if (parts.length == 2) {
            String s0 = SpeciesAlgebra.join(checkSpecies(parts[0]));
            String s1 = SpeciesAlgebra.join(checkSpecies(parts[1]));
            v = differentialFlow(s0, s1);
            rho = massDensity(s1);
        } else {
            throw new SchemaViolationException("species puede contener como mucho una ','\nspecies: " + species);
        }
        return new AlfvenicTurbulence(v, getBField(), rho, species, config);
    }

    // --- Ciclo de vida ---

    /**
     * Nuevo plasma sin las especies indicadas. La nave se conserva y los datos
     * auxiliares se filtran igual que la tabla principal.
     *
     * @throws SchemaViolationException si no queda ninguna especie.
     */
    public Plasma dropSpecies(String... species) {
        List<String> toDrop = checkSpecies(species);
        List<String> remaining = getSpecies().stream().filter(s -> !toDrop.contains(s)).toList();
        if (remaining.isEmpty()) {
            throw new SchemaViolationException("Hay que conservar al menos una especie. No puede haber un plasma vacío.");
        }
        Predicate<ColumnKey> keep = k -> k.s().isEmpty() || remaining.contains(k.s());
        DataTable data = getData().filter(keep).drop(k -> k.c().equals(SCALAR));
        DataTable aux = auxiliaryData == null ? null : auxiliaryData.filter(keep);
        return new Plasma(data, remaining, spacecraft, aux, logPlasmaStats);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getData().equals(((Plasma) o).getData());
    }

    @Override
    public int hashCode() {
        return getData().hashCode();
    }

    @Override
    public String toString() {
        return "Plasma[" + getSpecies() + ", " + getData().rowCount() + " filas]";
    }
}
