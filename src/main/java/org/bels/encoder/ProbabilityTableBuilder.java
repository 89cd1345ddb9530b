package org.bels.encoder;

import org.bels.support.MixedRadixCounter;

import java.util.logging.Logger;

/**
 * COSTRUTTORE TABELLE DI PROBABILITÀ - Espansione di una CPT appiattita
 *
 * Percorre il prodotto cartesiano dei domini dello scope (variabile più veloce) e
 * associa a ogni assegnazione completa il valore all'offset row-major corrispondente.
 *
 * SCOMPOSIZIONE ROW-MAJOR:
 * - La dimensione combinata delle posizioni non ancora fissate deve dividersi
 *   esattamente per il dominio della posizione corrente
 * - Il passo di ogni posizione è il quoziente residuo dopo la divisione
 * - La tabella finale contiene esattamente Π(domini) righe
 */
public class ProbabilityTableBuilder {

    private static final Logger LOGGER = Logger.getLogger(ProbabilityTableBuilder.class.getName());

    private final ClauseCanonicalizer canonicalizer;

    public ProbabilityTableBuilder(ClauseCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /**
     * @param scope  scope della CPT (genitori..., variabile)
     * @param values valori appiattiti della CPT
     * @return tabella con una probabilità per ogni assegnazione dello scope
     * @throws MalformedTableException      se il numero di valori o la scomposizione non sono coerenti
     * @throws EncodingConsistencyException se due assegnazioni producono la stessa chiave
     */
    public ProbabilityTable build(CptScope scope, double[] values) {
        int[] domainSizes = scope.domainSizes();
        int expected = MixedRadixCounter.combinations(domainSizes);

        if (values.length != expected) {
            throw new MalformedTableException("La CPT di " + scope.getVariable() + " contiene " + values.length
                    + " valori, attesi " + expected);
        }

        int[] strides = computeStrides(scope, domainSizes, values.length);

        ProbabilityTable table = new ProbabilityTable(scope);
        MixedRadixCounter counter = new MixedRadixCounter(domainSizes);
        do {
            int[] assignment = counter.digits();
            int offset = 0;
            for (int position = 0; position < assignment.length; position++) {
                offset += assignment[position] * strides[position];
            }
            table.put(canonicalizer.buildCoreClause(assignment, scope), values[offset]);
        } while (counter.next());

        if (table.size() != expected) {
            throw new MalformedTableException("La tabella di " + scope.getVariable() + " contiene " + table.size()
                    + " righe, attese " + expected);
        }

        LOGGER.fine("Tabella di probabilità di " + scope.getVariable() + ": " + table.size() + " righe");
        return table;
    }

    private static int[] computeStrides(CptScope scope, int[] domainSizes, int dimension) {
        int[] strides = new int[domainSizes.length];
        int remaining = dimension;
        for (int position = 0; position < domainSizes.length; position++) {
            if (remaining % domainSizes[position] != 0) {
                throw new MalformedTableException("Dimensione " + remaining + " non divisibile per il dominio di "
                        + scope.variableAt(position) + " (" + domainSizes[position] + ")");
            }
            remaining /= domainSizes[position];
            strides[position] = remaining;
        }
        return strides;
    }
}
