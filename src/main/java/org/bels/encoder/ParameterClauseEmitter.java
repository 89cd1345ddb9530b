package org.bels.encoder;

import org.bels.support.MixedRadixCounter;

import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * EMETTITORE CLAUSOLE PARAMETRO - Codifica delle righe di una CPT
 *
 * Per ogni assegnazione completa dello scope (variabile più veloce):
 * 1. Legge la probabilità p della riga
 * 2. Determinismo con p == 1: riga tautologica, nessuna clausola
 * 3. Indipendenza contestuale: esclude dalla clausola le variabili indipendenti
 * 4. Se la clausola ridotta è già nella cache della CPT la riga è saltata
 * 5. Scrive il commento con p e i letterali della clausola
 * 6. Testa della clausola: selettore hard se determinismo e p == 0, altrimenti
 *    una nuova variabile parametro ("questa riga è attiva")
 * 7. Clausole minori: per ogni letterale, la coppia (variabile, ¬parametro)
 *
 * La cache non riverifica la probabilità della riga già emessa: due righe ridotte
 * alla stessa clausola hanno la stessa probabilità per costruzione dell'analisi
 * di indipendenza.
 */
public class ParameterClauseEmitter {

    private static final Logger LOGGER = Logger.getLogger(ParameterClauseEmitter.class.getName());

    private final EncodingSession session;
    private final EncoderOptions options;
    private final CnfBodyWriter writer;
    private final ClauseCanonicalizer canonicalizer;
    private final IndependenceAnalyzer independenceAnalyzer;

    public ParameterClauseEmitter(EncodingSession session, EncoderOptions options, CnfBodyWriter writer,
                                  ClauseCanonicalizer canonicalizer) {
        this.session = session;
        this.options = options;
        this.writer = writer;
        this.canonicalizer = canonicalizer;
        this.independenceAnalyzer = new IndependenceAnalyzer(canonicalizer);
    }

    /**
     * Emette le clausole parametro di una CPT.
     *
     * @param table tabella di probabilità della CPT
     */
    public void emit(ProbabilityTable table) {
        CptScope scope = table.getScope();
        EncodingStatistics statistics = session.getStatistics();

        // Cache delle clausole già emesse per questa CPT
        Set<CoreClause> clauseCache = new HashSet<>();

        MixedRadixCounter rows = new MixedRadixCounter(scope.domainSizes());
        do {
            int[] assignment = rows.digits();
            CoreClause fullClause = canonicalizer.buildCoreClause(assignment, scope);
            double probability = table.get(fullClause);

            if (options.determinism() && probability == 1.0) {
                statistics.incrementOnes();
                continue;
            }

            CoreClause clause = fullClause;
            if (options.contextSpecificIndependence() && scope.size() > 1) {
                Set<Integer> independent = independenceAnalyzer.findIndependentVariables(assignment, table, probability);
                if (!independent.isEmpty()) {
                    statistics.recordShrink(independent.size());
                    clause = canonicalizer.buildCoreClause(assignment, scope, independent);
                }
            }

            if (!clauseCache.add(clause)) {
                continue;
            }

            writer.writeComment(Double.toString(probability));

            int parameter = 0;
            if (options.determinism() && probability == 0.0) {
                statistics.incrementZeros();
                writer.writeClauseWithHead(clause.literals(), options.selectorType().selectorFor(session));
            } else {
                parameter = session.getIndexer().allocate();
                writer.writeClauseWithHead(clause.literals(), parameter);
            }

            // Le righe impossibili non hanno variabile parametro da scomporre
            if (options.minorClauses() && parameter != 0) {
                for (int i = 0; i < clause.size(); i++) {
                    writer.writeClause(-clause.literal(i), -parameter);
                }
            }
        } while (rows.next());

        LOGGER.fine("Clausole distinte per " + scope.getVariable() + ": " + clauseCache.size());
    }
}
