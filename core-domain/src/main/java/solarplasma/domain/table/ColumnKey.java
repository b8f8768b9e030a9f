package solarplasma.domain.table;

import java.util.Comparator;
import java.util.Objects;

/**
 * Clave de columna de tres niveles (Medida, Componente, Especie).
 * <p>
 * Los niveles que no aplican se guardan como cadena vacía: el campo magnético
 * no tiene especie ({@code ("b", "x", "")}) y la densidad no tiene componente
 * ({@code ("n", "", "p1")}).
 *
 * @param m Medida (n, v, w, b, T, pth...).
 * @param c Componente ("", x, y, z, par, per, scalar...).
 * @param s Especie ("" si la medida no depende de la especie).
 */
public record ColumnKey(String m, String c, String s) implements Comparable<ColumnKey> {

    private static final Comparator<ColumnKey> ORDER = Comparator
            .comparing(ColumnKey::m)
            .thenComparing(ColumnKey::c)
            .thenComparing(ColumnKey::s);

    public ColumnKey {
        Objects.requireNonNull(m, "El nivel M no puede ser nulo.");
        Objects.requireNonNull(c, "El nivel C no puede ser nulo.");
        Objects.requireNonNull(s, "El nivel S no puede ser nulo.");
    }

    public static ColumnKey of(String m, String c, String s) {
        return new ColumnKey(m, c, s);
    }

    /**
     * Clave para tablas de un único nivel (componente).
     */
    public static ColumnKey component(String c) {
        return new ColumnKey("", c, "");
    }

    public ColumnKey withSpecies(String species) {
        return new ColumnKey(m, c, species);
    }

    public ColumnKey withoutSpecies() {
        return new ColumnKey(m, c, "");
    }

    @Override
    public int compareTo(ColumnKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + m + ", " + c + ", " + s + ")";
    }
}
