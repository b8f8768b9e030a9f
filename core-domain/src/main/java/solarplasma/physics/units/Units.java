package solarplasma.physics.units;

/**
 * Factores de escala de las unidades de trabajo a SI.
 * <p>
 * Toda cantidad que se combine con {@link Constants} se pasa antes a SI
 * multiplicando por el factor correspondiente y se devuelve dividiendo por él.
 * Los métodos públicos del modelo nunca devuelven valores en SI.
 */
public final class Units {

    private Units() {
    }

    /** Campo magnético: nT. */
    public static final double B = 1e-9;

    /** Velocidades (bulk, térmica, diferencial, Alfvén, sonido): km/s. */
    public static final double V = 1e3;
    public static final double W = V;
    public static final double DV = V;
    public static final double CA = V;
    public static final double CS = V;

    /** Presión: pPa. */
    public static final double PTH = 1e-12;

    /** Temperatura: 10^5 K. */
    public static final double TEMPERATURE = 1e5;

    /** Densidad numérica: cm^-3. */
    public static final double N = 1e6;

    /** Densidad de masa: m_p cm^-3. */
    public static final double RHO = N * Constants.PROTON_MASS;

    public static final double BETA = 1.0;
    public static final double LN_LAMBDA = 1.0;

    /** Frecuencia de colisión: 10^-7 s^-1. */
    public static final double NUC = 1e-7;

    /** Número de Coulomb (adimensional). */
    public static final double NC = 1.0;

    /** Flujo de calor paralelo. */
    public static final double QPAR = 1e-4;

    /** Entropía específica: eV cm^2. */
    public static final double SPECIFIC_ENTROPY = 1e4 / Constants.ELEMENTARY_CHARGE;

    /** Distancia al Sol: m. */
    public static final double DISTANCE_TO_SUN = 1.0;
}
