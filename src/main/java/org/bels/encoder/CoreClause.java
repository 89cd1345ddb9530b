package org.bels.encoder;

import java.util.Arrays;

/**
 * Clausola core canonica: letterali negativi, uno per variabile non esclusa dello
 * scope, ordinati per indice di variabile crescente.
 *
 * L'ordinamento canonico rende la clausola utilizzabile come chiave di tabelle e
 * cache e rende deterministico l'output. Uguaglianza e hash sono strutturali.
 */
public final class CoreClause {

    private final int[] literals;
    private final int hash;

    /**
     * @param variableIndices indici (positivi) delle variabili della clausola, in qualsiasi ordine
     * @throws EncodingConsistencyException se la clausola è vuota o un indice non è positivo
     */
    CoreClause(int[] variableIndices) {
        if (variableIndices.length == 0) {
            throw new EncodingConsistencyException("Una clausola core deve contenere almeno un letterale");
        }

        int[] sorted = variableIndices.clone();
        Arrays.sort(sorted);
        this.literals = new int[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] <= 0) {
                throw new EncodingConsistencyException("Indice di variabile non valido: " + sorted[i]);
            }
            literals[i] = -sorted[i];
        }
        this.hash = Arrays.hashCode(literals);
    }

    /**
     * @return copia dei letterali (negativi) in ordine canonico
     */
    public int[] literals() {
        return literals.clone();
    }

    public int size() {
        return literals.length;
    }

    public int literal(int position) {
        return literals[position];
    }

    /**
     * @return letterali separati da spazio, senza terminatore
     */
    public String toDimacs() {
        StringBuilder builder = new StringBuilder();
        for (int literal : literals) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(literal);
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoreClause)) return false;
        return Arrays.equals(literals, ((CoreClause) o).literals);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "[" + toDimacs() + "]";
    }
}
