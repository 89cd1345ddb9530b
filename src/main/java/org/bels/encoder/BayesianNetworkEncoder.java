package org.bels.encoder;

import org.bels.network.BayesianNetwork;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CODIFICATORE RETE BAYESIANA - Traduzione di una rete discreta in formula CNF pesata
 *
 * Coordina i componenti della codifica secondo il flusso:
 * 1. Indicizzazione di tutte le coppie (variabile, stato)
 * 2. Apertura del blocco selettori (selettore condiviso se strategia ONE)
 * 3. Vincoli sugli indicatori delle variabili multivalore
 * 4. Per ogni CPT: tabella di probabilità, poi clausole parametro
 * 5. Commit del file finale con header DIMACS e legenda
 *
 * Ogni errore è fatale per la rete in elaborazione: il file finale non viene
 * scritto e lo staging viene rimosso.
 */
public class BayesianNetworkEncoder {

    private static final Logger LOGGER = Logger.getLogger(BayesianNetworkEncoder.class.getName());

    private final EncoderOptions options;
    private final EncodingSession session = new EncodingSession();
    private final ClauseCanonicalizer canonicalizer = new ClauseCanonicalizer();
    private final ProbabilityTableBuilder tableBuilder = new ProbabilityTableBuilder(canonicalizer);

    public BayesianNetworkEncoder(EncoderOptions options) {
        this.options = options;
    }

    /**
     * Codifica la rete nel file CNF indicato.
     *
     * @param network    rete bayesiana da codificare
     * @param outputPath file CNF da creare (non deve esistere)
     * @return riepilogo della codifica
     * @throws IOException       se staging o file finale non possono essere scritti
     * @throws EncodingException se la rete viola un invariante della codifica
     */
    public EncodingResult encode(BayesianNetwork network, Path outputPath) throws IOException {
        LOGGER.info("=== AVVIO CODIFICA RETE " + network.getName() + " ===");
        session.reset();

        List<String> leafVariables;
        try (CnfAssembler assembler = new CnfAssembler(outputPath, session.getStatistics())) {
            CnfBodyWriter body = assembler.getBodyWriter();

            session.getIndexer().registerIndicators(network);
            session.openSelectorBlock(options.selectorType());

            leafVariables = new IndicatorConstraintEmitter(session, options, body).emit(network);

            ParameterClauseEmitter parameterEmitter = new ParameterClauseEmitter(session, options, body, canonicalizer);
            List<String> variables = network.getVariables();
            for (int i = 0; i < variables.size(); i++) {
                String variable = variables.get(i);
                CptScope scope = CptScope.of(network, variable, session.getIndexer());
                ProbabilityTable table = tableBuilder.build(scope, network.getValues(variable));
                parameterEmitter.emit(table);

                LOGGER.fine("CPT " + variable + " codificata (" + (i + 1) + "/" + variables.size() + ")");
            }

            assembler.commit(network, options, session);
        } catch (EncodingException e) {
            LOGGER.log(Level.SEVERE, "Codifica della rete " + network.getName() + " interrotta", e);
            throw e;
        }

        session.getStatistics().stopTimer();
        EncodingResult result = EncodingResult.of(outputPath, session.getStatistics(), leafVariables);

        LOGGER.info("=== CODIFICA COMPLETATA: " + session.getStatistics() + " ===");
        return result;
    }

    public EncoderOptions getOptions() {
        return options;
    }
}
