package org.bels.encoder;

import java.util.Set;

/**
 * Costruisce la clausola core canonica di un'assegnazione sullo scope di una CPT.
 */
public class ClauseCanonicalizer {

    /**
     * Clausola core sull'intero scope.
     *
     * @param assignment stato assegnato a ogni posizione dello scope
     * @param scope      scope della CPT
     * @return clausola con un letterale negativo per ogni variabile dello scope
     */
    public CoreClause buildCoreClause(int[] assignment, CptScope scope) {
        return buildCoreClause(assignment, scope, Set.of());
    }

    /**
     * Clausola core escludendo alcune posizioni dello scope.
     *
     * @param assignment stato assegnato a ogni posizione dello scope
     * @param scope      scope della CPT
     * @param excluded   posizioni da escludere (devono essere meno delle posizioni dello scope)
     * @return clausola con un letterale negativo per ogni posizione non esclusa
     * @throws EncodingConsistencyException se l'assegnazione o le esclusioni non sono coerenti con lo scope
     */
    public CoreClause buildCoreClause(int[] assignment, CptScope scope, Set<Integer> excluded) {
        if (assignment.length != scope.size()) {
            throw new EncodingConsistencyException("Assegnazione di lunghezza " + assignment.length
                    + " per uno scope di " + scope.size() + " variabili");
        }
        if (excluded.size() >= scope.size()) {
            throw new EncodingConsistencyException("Impossibile escludere tutte le variabili dello scope di " + scope.getVariable());
        }
        for (int position : excluded) {
            if (position < 0 || position >= scope.size()) {
                throw new EncodingConsistencyException("Posizione esclusa fuori dallo scope: " + position);
            }
        }

        int[] variableIndices = new int[scope.size() - excluded.size()];
        int next = 0;
        for (int position = 0; position < scope.size(); position++) {
            if (excluded.contains(position)) {
                continue;
            }
            int state = assignment[position];
            if (state < 0 || state >= scope.domainSize(position)) {
                throw new EncodingConsistencyException("Stato " + state + " fuori dal dominio di " + scope.variableAt(position));
            }
            variableIndices[next++] = scope.indicator(position, state);
        }

        return new CoreClause(variableIndices);
    }
}
