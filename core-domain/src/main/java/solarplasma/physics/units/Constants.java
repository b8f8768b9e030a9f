package solarplasma.physics.units;

/**
 * Constantes físicas en SI (CODATA 2018).
 * <p>
 * Estado inmutable de todo el proceso. Las propiedades que dependen de la
 * especie (masa, carga) viven en {@link ParticleSpecies}.
 */
public final class Constants {

    private Constants() {
    }

    // =========================================================================
    // ===========================   ELECTROMAGNETISMO   =======================
    // =========================================================================

    /** Carga elemental [C]. */
    public static final double ELEMENTARY_CHARGE = 1.602176634e-19;

    /** Permitividad del vacío ε₀ [F/m]. */
    public static final double VACUUM_PERMITTIVITY = 8.8541878128e-12;

    /** Permeabilidad del vacío μ₀ [N/A²]. */
    public static final double VACUUM_PERMEABILITY = 1.25663706212e-6;

    /** Velocidad de la luz [m/s]. */
    public static final double SPEED_OF_LIGHT = 299_792_458.0;

    // =========================================================================
    // ===========================   TERMODINÁMICA   ===========================
    // =========================================================================

    /** Constante de Boltzmann [J/K]. */
    public static final double BOLTZMANN_J = 1.380649e-23;

    /** Constante de Boltzmann [eV/K]. */
    public static final double BOLTZMANN_EV = 8.617333262e-5;

    /** Índice politrópico de un gas monoatómico. */
    public static final double POLYTROPIC_INDEX = 5.0 / 3.0;

    /** Constante de Planck reducida [J s]. */
    public static final double HBAR = 1.054571817e-34;

    // =========================================================================
    // ===========================   MASAS   ===================================
    // =========================================================================

    public static final double PROTON_MASS = 1.67262192369e-27;
    public static final double ELECTRON_MASS = 9.1093837015e-31;
    public static final double ALPHA_MASS = 6.6446573357e-27;

    public static final double ALPHA_PROTON_MASS_RATIO = 3.97259969009;
    public static final double ELECTRON_PROTON_MASS_RATIO = 5.44617021487e-4;

    public static final double PROTON_MASS_AMU = 1.007276466621;
    public static final double ELECTRON_MASS_AMU = 5.48579909065e-4;
    public static final double ALPHA_MASS_AMU = 4.001506179127;

    // =========================================================================
    // ===========================   DISTANCIAS   ==============================
    // =========================================================================

    /** Unidad astronómica [m]. */
    public static final double ASTRONOMICAL_UNIT = 149_597_870_700.0;

    /** Radio terrestre [m]. */
    public static final double EARTH_RADIUS = 6378.1e3;

    /** Radio solar [m]. */
    public static final double SUN_RADIUS = 695.508e6;
}
