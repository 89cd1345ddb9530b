package org.bels.encoder;

import org.bels.support.MixedRadixCounter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ANALIZZATORE DI INDIPENDENZA CONTESTUALE - Riduzione delle clausole parametro
 *
 * Per un'assegnazione fissata dello scope S = genitori ∪ {variabile}, cerca un insieme
 * I ⊆ S \ {variabile} tale che, lasciando variare liberamente qualsiasi combinazione
 * delle variabili di I sui loro domini (il resto fermo), la probabilità resti quella
 * dell'assegnazione originale.
 *
 * ALGORITMO GREEDY (approssimazione, non ottimo globale):
 * 1. Test di indipendenza singola per ogni genitore: varia solo lui, il resto fermo
 * 2. Candidati ordinati per dominio decrescente, poi per nome crescente
 * 3. Il primo candidato è accettato; ogni successivo è accettato solo se resta
 *    indipendente per ogni combinazione congiunta dei candidati già accettati
 *
 * La variabile della CPT non è mai candidata: la clausola deve sempre conservare il
 * letterale del suo stato, su cui si condiziona la variabile parametro.
 *
 * Il costo è combinatorio nei domini dello scope; l'analisi avviene una volta per
 * riga di CPT durante la codifica.
 */
public class IndependenceAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(IndependenceAnalyzer.class.getName());

    private final ClauseCanonicalizer canonicalizer;

    public IndependenceAnalyzer(ClauseCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    //region TEST DI INDIPENDENZA

    /**
     * Verifica che la probabilità non cambi facendo variare solo la posizione indicata.
     *
     * @param position    posizione dello scope da far variare
     * @param assignment  assegnazione di riferimento
     * @param table       tabella di probabilità della CPT
     * @param probability probabilità dell'assegnazione di riferimento
     * @return true se ogni stato della posizione dà la stessa probabilità
     */
    public boolean isVariableIndependent(int position, int[] assignment, ProbabilityTable table, double probability) {
        CptScope scope = table.getScope();
        int[] varied = assignment.clone();

        for (int state = 0; state < scope.domainSize(position); state++) {
            varied[position] = state;
            if (table.get(canonicalizer.buildCoreClause(varied, scope)) != probability) {
                return false;
            }
        }
        return true;
    }

    /**
     * Verifica l'indipendenza della posizione per ogni combinazione congiunta degli
     * stati delle posizioni già accettate.
     *
     * @param position    posizione candidata
     * @param accepted    posizioni già accettate (non contiene {@code position})
     * @param assignment  assegnazione di riferimento
     * @param table       tabella di probabilità della CPT
     * @param probability probabilità dell'assegnazione di riferimento
     * @return true se la candidata è indipendente in tutte le combinazioni
     */
    public boolean isJointlyIndependent(int position, List<Integer> accepted, int[] assignment,
                                        ProbabilityTable table, double probability) {
        if (accepted.contains(position)) {
            throw new EncodingConsistencyException("La posizione " + position + " è già tra le indipendenti");
        }

        CptScope scope = table.getScope();
        int[] radices = new int[accepted.size()];
        for (int i = 0; i < radices.length; i++) {
            radices[i] = scope.domainSize(accepted.get(i));
        }

        int[] varied = assignment.clone();
        MixedRadixCounter counter = new MixedRadixCounter(radices);
        do {
            for (int i = 0; i < radices.length; i++) {
                varied[accepted.get(i)] = counter.digit(i);
            }
            if (!isVariableIndependent(position, varied, table, probability)) {
                return false;
            }
        } while (counter.next());

        return true;
    }

    //endregion

    //region RICERCA GREEDY

    /**
     * Cerca l'insieme di posizioni indipendenti per l'assegnazione data.
     *
     * @param assignment  assegnazione completa dello scope
     * @param table       tabella di probabilità della CPT
     * @param probability probabilità dell'assegnazione
     * @return posizioni indipendenti in ordine di accettazione (eventualmente vuoto)
     * @throws EncodingConsistencyException se l'insieme non è strettamente più piccolo dello scope
     */
    public Set<Integer> findIndependentVariables(int[] assignment, ProbabilityTable table, double probability) {
        CptScope scope = table.getScope();
        Set<Integer> accepted = new LinkedHashSet<>();

        if (scope.size() == 1) {
            return accepted;
        }

        // Fase 1: candidati singolarmente indipendenti, esclusa la variabile stessa
        List<Integer> candidates = new ArrayList<>();
        for (int position = 0; position < scope.selfPosition(); position++) {
            if (isVariableIndependent(position, assignment, table, probability)) {
                candidates.add(position);
            }
        }

        if (candidates.isEmpty()) {
            return accepted;
        }

        // Fase 2: domini più grandi prima, a parità nome crescente
        candidates.sort(Comparator.<Integer>comparingInt(scope::domainSize).reversed()
                .thenComparing(scope::variableAt));

        // Fase 3: accettazione greedy con verifica congiunta
        List<Integer> acceptedList = new ArrayList<>();
        acceptedList.add(candidates.get(0));
        for (int i = 1; i < candidates.size(); i++) {
            int candidate = candidates.get(i);
            if (isJointlyIndependent(candidate, acceptedList, assignment, table, probability)) {
                acceptedList.add(candidate);
            }
        }
        accepted.addAll(acceptedList);

        if (accepted.size() >= scope.size() || accepted.contains(scope.selfPosition())) {
            throw new EncodingConsistencyException("Insieme indipendente non valido per la CPT di " + scope.getVariable()
                    + ": " + accepted.size() + " variabili su " + scope.size());
        }

        LOGGER.finest(() -> "Indipendenti per " + scope.getVariable() + ": " + accepted);
        return accepted;
    }

    //endregion
}
