package org.bels.encoder;

import java.util.HashMap;
import java.util.Map;

/**
 * Tabella di probabilità di una CPT: clausola core sull'intero scope → probabilità.
 *
 * Ricostruita da zero per ogni CPT dal ProbabilityTableBuilder.
 */
public class ProbabilityTable {

    private final CptScope scope;
    private final Map<CoreClause, Double> probabilities = new HashMap<>();

    ProbabilityTable(CptScope scope) {
        this.scope = scope;
    }

    /**
     * @throws EncodingConsistencyException se la chiave è già presente
     */
    void put(CoreClause key, double probability) {
        if (probabilities.putIfAbsent(key, probability) != null) {
            throw new EncodingConsistencyException("Chiave duplicata " + key + " nella CPT di " + scope.getVariable());
        }
    }

    /**
     * @param key clausola core sull'intero scope
     * @return probabilità della riga
     * @throws EncodingConsistencyException se la riga non esiste
     */
    public double get(CoreClause key) {
        Double probability = probabilities.get(key);
        if (probability == null) {
            throw new EncodingConsistencyException("Riga " + key + " assente dalla CPT di " + scope.getVariable());
        }
        return probability;
    }

    public CptScope getScope() {
        return scope;
    }

    public int size() {
        return probabilities.size();
    }
}
