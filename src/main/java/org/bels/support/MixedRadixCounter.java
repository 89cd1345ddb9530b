package org.bels.support;

/**
 * CONTATORE A BASE MISTA - Enumerazione iterativa di prodotti cartesiani
 *
 * Ogni posizione ha la propria base (dimensione del dominio); l'ultima posizione
 * varia più velocemente, come nel layout row-major delle CPT. Sostituisce la
 * ricorsione annidata: la profondità dello stack non dipende dalla dimensione
 * dello scope.
 *
 * UTILIZZO TIPICO:
 * <pre>
 * MixedRadixCounter counter = new MixedRadixCounter(radices);
 * do {
 *     int[] digits = counter.digits();
 *     ...
 * } while (counter.next());
 * </pre>
 *
 * Con zero posizioni esiste una sola combinazione (quella vuota).
 */
public final class MixedRadixCounter {

    private final int[] radices;
    private final int[] digits;

    /**
     * @param radices base di ogni posizione (ognuna ≥ 1)
     * @throws IllegalArgumentException se una base è minore di 1
     */
    public MixedRadixCounter(int[] radices) {
        for (int radix : radices) {
            if (radix < 1) {
                throw new IllegalArgumentException("Base non valida: " + radix);
            }
        }
        this.radices = radices.clone();
        this.digits = new int[radices.length];
    }

    /**
     * Avanza alla combinazione successiva.
     *
     * @return false se tutte le combinazioni sono state enumerate (il contatore torna a zero)
     */
    public boolean next() {
        for (int position = digits.length - 1; position >= 0; position--) {
            digits[position]++;
            if (digits[position] < radices[position]) {
                return true;
            }
            digits[position] = 0;
        }
        return false;
    }

    /**
     * @return cifre correnti; l'array è condiviso e cambia ad ogni next()
     */
    public int[] digits() {
        return digits;
    }

    public int digit(int position) {
        return digits[position];
    }

    public int size() {
        return digits.length;
    }

    /**
     * @param radices basi delle posizioni
     * @return numero totale di combinazioni
     * @throws ArithmeticException in caso di overflow
     */
    public static int combinations(int[] radices) {
        int total = 1;
        for (int radix : radices) {
            total = Math.multiplyExact(total, radix);
        }
        return total;
    }
}
