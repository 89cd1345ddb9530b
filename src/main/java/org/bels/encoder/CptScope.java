package org.bels.encoder;

import org.bels.network.BayesianNetwork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scope di una CPT: genitori nell'ordine dichiarato seguiti dalla variabile stessa.
 *
 * Risolve una volta per tutte domini e indici degli indicatori, così la costruzione
 * delle clausole lavora su posizioni e interi senza consultare mappe per stringa.
 */
public final class CptScope {

    private final String variable;
    private final List<String> variables;
    private final int[] domainSizes;

    /** [posizione][stato] → indice dell'indicatore */
    private final int[][] indicators;

    private CptScope(String variable, List<String> variables, int[] domainSizes, int[][] indicators) {
        this.variable = variable;
        this.variables = Collections.unmodifiableList(variables);
        this.domainSizes = domainSizes;
        this.indicators = indicators;
    }

    /**
     * Costruisce lo scope della CPT di una variabile.
     *
     * @param network  rete bayesiana
     * @param variable variabile della CPT
     * @param indexer  indicizzatore con gli indicatori già allocati
     * @return scope (genitori..., variabile)
     * @throws UnknownVariableStateException se un indicatore non è stato allocato
     */
    public static CptScope of(BayesianNetwork network, String variable, VariableIndexer indexer) {
        List<String> variables = new ArrayList<>(network.getParents(variable));
        variables.add(variable);

        int[] domainSizes = new int[variables.size()];
        int[][] indicators = new int[variables.size()][];
        for (int position = 0; position < variables.size(); position++) {
            String scopeVariable = variables.get(position);
            List<String> states = network.getStates(scopeVariable);
            if (states.size() < 2) {
                throw new EncodingConsistencyException("La variabile " + scopeVariable + " ha meno di due stati");
            }
            domainSizes[position] = states.size();
            indicators[position] = new int[states.size()];
            for (int state = 0; state < states.size(); state++) {
                indicators[position][state] = indexer.indexOf(scopeVariable, states.get(state));
            }
        }

        return new CptScope(variable, variables, domainSizes, indicators);
    }

    /**
     * @return variabile di cui lo scope descrive la CPT
     */
    public String getVariable() {
        return variable;
    }

    public int size() {
        return variables.size();
    }

    /**
     * @return posizione della variabile stessa (sempre l'ultima)
     */
    public int selfPosition() {
        return variables.size() - 1;
    }

    public String variableAt(int position) {
        return variables.get(position);
    }

    public List<String> getVariables() {
        return variables;
    }

    public int domainSize(int position) {
        return domainSizes[position];
    }

    public int[] domainSizes() {
        return domainSizes.clone();
    }

    /**
     * @return indice dell'indicatore della variabile in posizione {@code position} allo stato {@code state}
     */
    public int indicator(int position, int state) {
        return indicators[position][state];
    }
}
