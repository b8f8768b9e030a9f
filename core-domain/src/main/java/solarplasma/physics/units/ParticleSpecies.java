package solarplasma.physics.units;

import lombok.Getter;

import java.util.Locale;

/**
 * Tabla de propiedades por especie: masa, carga y estado de carga.
 * <p>
 * Los códigos siguen la convención de las columnas S del plasma: {@code p1}
 * protones del núcleo, {@code p2} haz de protones, {@code a} partículas alfa,
 * {@code e} electrones.
 */
@Getter
public enum ParticleSpecies {
    ELECTRON("e", Constants.ELECTRON_MASS, Constants.ELECTRON_PROTON_MASS_RATIO, Constants.ELECTRON_MASS_AMU, -1.0),
    PROTON("p", Constants.PROTON_MASS, 1.0, Constants.PROTON_MASS_AMU, 1.0),
    PROTON_CORE("p1", Constants.PROTON_MASS, 1.0, Constants.PROTON_MASS_AMU, 1.0),
    PROTON_BEAM("p2", Constants.PROTON_MASS, 1.0, Constants.PROTON_MASS_AMU, 1.0),
    ALPHA("a", Constants.ALPHA_MASS, Constants.ALPHA_PROTON_MASS_RATIO, Constants.ALPHA_MASS_AMU, 2.0),
    ALPHA_CORE("a1", Constants.ALPHA_MASS, Constants.ALPHA_PROTON_MASS_RATIO, Constants.ALPHA_MASS_AMU, 2.0),
    ALPHA_BEAM("a2", Constants.ALPHA_MASS, Constants.ALPHA_PROTON_MASS_RATIO, Constants.ALPHA_MASS_AMU, 2.0);

    private final String code;
    /** Masa [kg]. */
    private final double mass;
    /** Masa en unidades de la masa del protón. */
    private final double massInProtonMasses;
    /** Masa [u]. */
    private final double massAmu;
    /** Estado de carga Z (adimensional). */
    private final double chargeState;

    ParticleSpecies(String code, double mass, double massInProtonMasses, double massAmu, double chargeState) {
        this.code = code;
        this.mass = mass;
        this.massInProtonMasses = massInProtonMasses;
        this.massAmu = massAmu;
        this.chargeState = chargeState;
    }

    /**
     * Carga eléctrica de la especie [C].
     */
    public double getCharge() {
        return chargeState * Constants.ELEMENTARY_CHARGE;
    }

    /**
     * Busca la especie por su código de columna.
     *
     * @throws IllegalArgumentException si el código no tiene constantes tabuladas.
     */
    public static ParticleSpecies fromCode(String code) {
        String normalized = code.toLowerCase(Locale.ROOT);
        for (ParticleSpecies species : values()) {
            if (species.code.equals(normalized)) {
                return species;
            }
        }
        throw new IllegalArgumentException("No hay constantes tabuladas para la especie: " + code);
    }
}
