package solarplasma.physics.collisions;

import org.apache.commons.math3.special.Erf;
import solarplasma.domain.table.Series;
import solarplasma.physics.units.Constants;
import solarplasma.physics.units.ParticleSpecies;
import solarplasma.physics.units.Units;

/**
 * Fórmulas cerradas de colisiones coulombianas entre especies iónicas.
 * <p>
 * Las entradas llegan en unidades de trabajo (cm⁻³, km/s, 10⁵ K); la conversión
 * a SI ocurre sólo dentro de cada fórmula y el resultado vuelve en unidades de
 * trabajo.
 * <p>
 * Referencias:
 * <ul>
 * <li>Hernández, R., &amp; Marsch, E. (1985). JGR, 90(A11), 11062.</li>
 * <li>Fundamenski, W., &amp; Garcia, O. E. (2007). Comparison of Coulomb Collision
 * Rates in the Plasma Physics and Magnetically Confined Fusion Literature.</li>
 * </ul>
 */
public final class CoulombCollisions {

    private static final double TWO_OVER_SQRT_PI = 2.0 / Math.sqrt(Math.PI);

    /**
     * Por debajo de este x la tasa de difusión longitudinal se evalúa con su
     * desarrollo en serie: la resta erf(x) − x·2/√π·e^(−x²) pierde precisión.
     */
    static final double SMALL_DRIFT = 1e-3;

    private CoulombCollisions() {
    }

    /**
     * Logaritmo de Coulomb ion-ion:
     * ln Λ = 29.9 − ln( Z₀Z₁(A₀+A₁)/(A₀T₁+A₁T₀) · sqrt(Σ nᵢZᵢ²/Tᵢ) ),
     * con n en m⁻³ y T en eV. La suma siempre tiene dos términos: con s₀ = s₁ la
     * misma especie aporta dos veces, una como partícula de prueba y otra como campo.
     *
     * @param t0 Temperatura escalar de la especie 0 [10⁵ K].
     * @param t1 Temperatura escalar de la especie 1 [10⁵ K].
     */
    public static Series coulombLogarithm(ParticleSpecies s0, Series n0, Series t0,
                                          ParticleSpecies s1, Series n1, Series t1) {
        double z0 = s0.getChargeState();
        double z1 = s1.getChargeState();
        double a0 = s0.getMassAmu();
        double a1 = s1.getMassAmu();

        Series t0eV = toElectronVolts(t0);
        Series t1eV = toElectronVolts(t1);

        Series right = n0.times(Units.N).times(z0 * z0).dividedBy(t0eV)
                .plus(n1.times(Units.N).times(z1 * z1).dividedBy(t1eV))
                .sqrt();

        Series left = t1eV.times(a0).plus(t0eV.times(a1)).map(den -> z0 * z1 * (a0 + a1) / den);

        return left.times(right).map(v -> (29.9 - Math.log(v)) / Units.LN_LAMBDA)
                .withName(s0.getCode() + "," + s1.getCode());
    }

    /**
     * Tasa de intercambio de momento de la partícula de prueba {@code a} sobre el
     * campo {@code b} (Hernández &amp; Marsch 1985, ec. 18).
     *
     * @param nb         Densidad de la especie de campo [cm⁻³].
     * @param wParA      Velocidad térmica paralela de a [km/s].
     * @param wParB      Velocidad térmica paralela de b [km/s].
     * @param driftSpeed |v_a − v_b| [km/s].
     * @param lnLambda   Logaritmo de Coulomb entre a y b.
     * @return Frecuencia de colisión [10⁻⁷ s⁻¹].
     */
    public static Series momentumRate(ParticleSpecies a, ParticleSpecies b, Series nb,
                                      Series wParA, Series wParB, Series driftSpeed, Series lnLambda) {
        double qa = a.getCharge();
        double qb = b.getCharge();
        double ma = a.getMass();
        double mu = a.getMass() * b.getMass() / (a.getMass() + b.getMass());
        double coeff = (qa * qa * qb * qb)
                / (4.0 * Math.PI * Constants.VACUUM_PERMITTIVITY * Constants.VACUUM_PERMITTIVITY * ma * mu);

        Series wab = wParA.pow(2).plus(wParB.pow(2)).sqrt().times(Units.W);
        Series x = driftSpeed.times(Units.DV).dividedBy(wab);
        Series ldr = x.map(CoulombCollisions::longitudinalDiffusionRate);

        return nb.times(Units.N)
                .times(lnLambda.times(Units.LN_LAMBDA))
                .times(ldr)
                .dividedBy(wab.pow(3))
                .times(coeff / Units.NUC)
                .withName(a.getCode() + "-" + b.getCode());
    }

    /**
     * Tasa efectiva de un plasma de dos especies iónicas (Hernández &amp; Marsch 1985, ec. 23):
     * ν = ν_ab (1 + ρ_a/ρ_b).
     */
    public static Series twoSpeciesRate(Series nuab, Series rhoA, Series rhoB) {
        return nuab.plus(nuab.times(rhoA.dividedBy(rhoB)));
    }

    /**
     * Frecuencia de autocolisión de una especie (Fundamenski &amp; Garcia 2007, ec. 45):
     * ν = q⁴ n ln Λ / (12 π^(3/2) √m ε₀² T_∥^(3/2)), T en eV.
     *
     * @return Frecuencia de colisión [10⁻⁷ s⁻¹].
     */
    public static Series selfCollisionFrequency(ParticleSpecies s, Series n, Series tPar, Series lnLambda) {
        double q = s.getCharge();
        double coeff = Math.pow(q, 4)
                / (12.0 * Math.pow(Math.PI, 1.5) * Math.sqrt(s.getMass())
                * Constants.VACUUM_PERMITTIVITY * Constants.VACUUM_PERMITTIVITY);
        return n.times(Units.N)
                .times(lnLambda.times(Units.LN_LAMBDA))
                .dividedBy(toElectronVolts(tPar).pow(1.5))
                .times(coeff / Units.NUC)
                .withName(s.getCode() + "," + s.getCode());
    }

    /**
     * (erf(x) − x·2/√π·e^(−x²)) / x³. Para x pequeño se usa 4/(3√π)(1 − 3x²/5),
     * cuyo límite en x = 0 es finito.
     */
    public static double longitudinalDiffusionRate(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (Math.abs(x) < SMALL_DRIFT) {
            return 2.0 * TWO_OVER_SQRT_PI / 3.0 * (1.0 - 0.6 * x * x);
        }
        double erf = Erf.erf(x);
        return (erf - x * TWO_OVER_SQRT_PI * Math.exp(-x * x)) / (x * x * x);
    }

    private static Series toElectronVolts(Series temperature) {
        return temperature.times(Units.TEMPERATURE * Constants.BOLTZMANN_EV);
    }
}
