package org.bels.encoder;

import org.bels.network.BayesianNetwork;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * INDICIZZATORE VARIABILI - Allocazione densa degli indici DIMACS
 *
 * Assegna un indice intero ≥ 1 a ogni coppia (variabile, stato) della rete e alle
 * variabili ausiliarie (selettori e parametri), che condividono lo stesso contatore.
 *
 * INVARIANTI MANTENUTE:
 * - Indici strettamente crescenti, mai riutilizzati all'interno di una codifica
 * - Mapping (variabile, stato) → indice iniettivo
 * - Tutti gli indicatori sono allocati prima di qualsiasi variabile ausiliaria,
 *   nell'ordine di dichiarazione di variabili e stati
 */
public class VariableIndexer {

    private static final Logger LOGGER = Logger.getLogger(VariableIndexer.class.getName());

    private final EncodingStatistics statistics;

    /** Prossimo indice da assegnare */
    private int nextIndex = 1;

    /** Variabile → (stato → indice), in ordine di dichiarazione */
    private final Map<String, Map<String, Integer>> indicators = new LinkedHashMap<>();

    public VariableIndexer(EncodingStatistics statistics) {
        this.statistics = statistics;
    }

    //region ALLOCAZIONE

    /**
     * Alloca un nuovo indice.
     *
     * @return indice appena allocato
     */
    public int allocate() {
        statistics.incrementVariables();
        return nextIndex++;
    }

    /**
     * Alloca gli indicatori di tutte le coppie (variabile, stato) della rete.
     *
     * @param network rete da indicizzare
     * @throws EncodingConsistencyException se sono già stati allocati indici
     */
    public void registerIndicators(BayesianNetwork network) {
        if (nextIndex != 1) {
            throw new EncodingConsistencyException("Gli indicatori devono essere allocati prima di ogni altra variabile");
        }

        for (String variable : network.getVariables()) {
            Map<String, Integer> stateIndices = new LinkedHashMap<>();
            for (String state : network.getStates(variable)) {
                stateIndices.put(state, allocate());
            }
            indicators.put(variable, stateIndices);
        }

        LOGGER.fine("Indicatori allocati: " + (nextIndex - 1));
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @param variable variabile della rete
     * @param state    stato della variabile
     * @return indice dell'indicatore (variabile, stato)
     * @throws UnknownVariableStateException se la coppia non è mai stata allocata
     */
    public int indexOf(String variable, String state) {
        Map<String, Integer> stateIndices = indicators.get(variable);
        Integer index = stateIndices != null ? stateIndices.get(state) : null;
        if (index == null) {
            throw new UnknownVariableStateException(variable, state);
        }
        return index;
    }

    /**
     * @return indice che verrà restituito dalla prossima allocazione
     */
    public int peekNextIndex() {
        return nextIndex;
    }

    /**
     * @return legenda variabile → (stato → indice) in ordine di dichiarazione
     */
    public Map<String, Map<String, Integer>> getLegend() {
        return Collections.unmodifiableMap(indicators);
    }

    //endregion

    /**
     * Riporta l'indicizzatore allo stato iniziale.
     */
    public void reset() {
        nextIndex = 1;
        indicators.clear();
    }
}
