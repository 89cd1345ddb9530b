package org.bels.encoder;

import org.bels.network.BayesianNetwork;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * EMETTITORE VINCOLI SUGLI INDICATORI - Codifica delle variabili multivalore
 *
 * Per ogni variabile non foglia (o per tutte, se richiesto dal tipo di circuito):
 * - una clausola "almeno uno stato": disgiunzione di tutti gli indicatori
 * - se le clausole indicatore sono attive, per ogni coppia di stati distinti una
 *   clausola binaria "al più uno stato" che vieta entrambi veri
 *
 * Tutte le clausole sono hard e terminate secondo la strategia dei selettori.
 */
public class IndicatorConstraintEmitter {

    private static final Logger LOGGER = Logger.getLogger(IndicatorConstraintEmitter.class.getName());

    private final EncodingSession session;
    private final EncoderOptions options;
    private final CnfBodyWriter writer;

    public IndicatorConstraintEmitter(EncodingSession session, EncoderOptions options, CnfBodyWriter writer) {
        this.session = session;
        this.options = options;
        this.writer = writer;
    }

    /**
     * Emette i vincoli di tutte le variabili della rete.
     *
     * @param network rete con indicatori già indicizzati
     * @return variabili foglia escluse dai vincoli (vuota se i vincoli sulle foglie sono attivi)
     */
    public List<String> emit(BayesianNetwork network) {
        List<String> skippedLeaves = new ArrayList<>();
        VariableIndexer indexer = session.getIndexer();

        for (String variable : network.getVariables()) {
            if (!options.leafConstraints() && network.isLeaf(variable)) {
                skippedLeaves.add(variable);
                continue;
            }

            List<String> states = network.getStates(variable);
            if (states.size() < 2) {
                throw new EncodingConsistencyException("La variabile " + variable + " ha meno di due stati");
            }

            int[] indicators = new int[states.size()];
            for (int i = 0; i < indicators.length; i++) {
                indicators[i] = indexer.indexOf(variable, states.get(i));
            }

            // Almeno uno stato
            writer.writeClauseWithHead(indicators, options.selectorType().selectorFor(session));

            // Al più uno stato
            if (options.indicatorClauses()) {
                for (int i = 0; i < indicators.length - 1; i++) {
                    for (int j = i + 1; j < indicators.length; j++) {
                        writer.writeClauseWithHead(new int[]{-indicators[i], -indicators[j]},
                                options.selectorType().selectorFor(session));
                    }
                }
            }
        }

        LOGGER.fine("Vincoli sugli indicatori emessi, foglie escluse: " + skippedLeaves.size());
        return skippedLeaves;
    }
}
