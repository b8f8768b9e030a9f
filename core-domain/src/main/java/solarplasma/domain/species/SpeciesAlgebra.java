package solarplasma.domain.species;

import solarplasma.domain.exception.SchemaViolationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Álgebra de cadenas de especie.
 * <p>
 * Reglas de composición:
 * <ul>
 * <li><b>"+":</b> une especies en un grupo sumado/compuesto ({@code "p1+a"}) y
 * sólo puede aparecer en una llamada de una única especie.</li>
 * <li><b>",":</b> separa grupos independientes; como mucho una coma.</li>
 * </ul>
 * Los constituyentes atómicos se obtienen partiendo por "+".
 */
public final class SpeciesAlgebra {

    public static final String SUM = "+";
    public static final String LIST = ",";

    private SpeciesAlgebra() {
    }

    /**
     * Normaliza las especies de una llamada a una lista ordenada.
     * <p>
     * Una única entrada con "+" se parte en sus constituyentes. Varias entradas
     * se ordenan tal cual. Es idempotente: conformar una salida ya conformada
     * devuelve lo mismo.
     *
     * @throws SchemaViolationException si hay nulos, vacíos, comas, o "+" mezclado con varias entradas.
     */
    public static List<String> conform(String... species) {
        Objects.requireNonNull(species, "La lista de especies no puede ser nula.");
        if (species.length == 0) {
            throw new SchemaViolationException("Hay que indicar al menos una especie.");
        }
        for (String s : species) {
            if (s == null || s.isBlank()) {
                throw new SchemaViolationException("Especie inválida: " + Arrays.toString(species));
            }
            if (s.contains(LIST)) {
                throw new SchemaViolationException("Especie inválida: " + Arrays.toString(species));
            }
        }
        boolean composite = Arrays.stream(species).anyMatch(s -> s.contains(SUM));
        if (composite && species.length > 1) {
            throw new SchemaViolationException("Especie inválida: " + Arrays.toString(species)
                    + "\n\nUna lista de varias especies en la que alguna incluye '+' no se puede "
                    + "aplicar de forma uniforme en todos los métodos.");
        }
        List<String> out = species.length == 1
                ? new ArrayList<>(Arrays.asList(species[0].split("\\" + SUM, -1)))
                : new ArrayList<>(Arrays.asList(species));
        if (out.stream().anyMatch(String::isBlank)) {
            throw new SchemaViolationException("Especie compuesta mal formada: " + Arrays.toString(species));
        }
        out.sort(null);
        return List.copyOf(out);
    }

    /**
     * Constituyentes atómicos únicos y ordenados de una lista ya conformada.
     */
    public static List<String> atomic(Collection<String> conformed) {
        TreeSet<String> out = new TreeSet<>();
        for (String s : conformed) {
            out.addAll(Arrays.asList(s.split("\\" + SUM)));
        }
        return List.copyOf(out);
    }

    /**
     * Especies con las que se construye un plasma: sin "+", ordenadas y sin
     * duplicados. Una única entrada separada por comas se interpreta como lista.
     */
    public static List<String> cleanForSetting(String owner, String... species) {
        Objects.requireNonNull(species, "La lista de especies no puede ser nula.");
        if (species.length == 0) {
            throw new SchemaViolationException("Hay que indicar una especie para instanciar un " + owner + ".");
        }
        List<String> raw = species.length == 1
                ? Arrays.asList(species[0].split(LIST))
                : Arrays.asList(species);
        TreeSet<String> out = new TreeSet<>();
        for (String s : raw) {
            if (s == null || s.isBlank()) {
                throw new SchemaViolationException("Especie vacía o nula en " + owner + ": " + Arrays.toString(species));
            }
            if (s.contains(SUM)) {
                throw new SchemaViolationException(owner + ".species no puede contener '+': " + s);
            }
            out.add(s.trim());
        }
        return List.copyOf(out);
    }

    public static String join(Collection<String> species) {
        return String.join(SUM, species);
    }

    /**
     * Etiqueta canónica de la especie de una turbulencia alfvénica: como mucho
     * una coma, y los constituyentes de cada parte ordenados.
     * <p>
     * Ej: {@code "p1+a,p2"} pasa a {@code "a+p1,p2"}.
     */
    public static String normalizeTwoPartLabel(String owner, String species) {
        Objects.requireNonNull(species, owner + ".species debe ser una única especie con un '+' o ',' opcional.");
        long commas = species.chars().filter(ch -> ch == ',').count();
        if (commas > 1) {
            throw new SchemaViolationException(owner + ".species puede contener como mucho una ','\nspecies: " + species);
        }
        return Arrays.stream(species.split(LIST, -1))
                .map(part -> Arrays.stream(part.split("\\" + SUM, -1)).sorted().collect(Collectors.joining(SUM)))
                .collect(Collectors.joining(LIST));
    }
}
