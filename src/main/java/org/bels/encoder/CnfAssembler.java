package org.bels.encoder;

import org.bels.network.BayesianNetwork;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ASSEMBLATORE CNF - Emissione in due fasi del file DIMACS
 *
 * L'header "p cnf" deve precedere il corpo ma i totali sono noti solo a fine codifica:
 *
 * FASE 1: gli emettitori scrivono il corpo (con i commenti di probabilità) su un file
 *         temporaneo di staging accanto al file di output
 * FASE 2: commit() scrive nome della rete, opzioni attive, legenda degli indicatori,
 *         inizio del blocco selettori, header con i totali e infine il corpo
 *
 * Il file di staging è cancellato in close() su ogni percorso, anche in caso di errore;
 * un file di output scritto parzialmente da un commit fallito viene rimosso.
 */
public class CnfAssembler implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(CnfAssembler.class.getName());

    private static final String STAGING_PREFIX = "bels-";
    private static final String STAGING_SUFFIX = ".tmp";

    private final Path outputPath;
    private final EncodingStatistics statistics;
    private final Path stagingPath;
    private final BufferedWriter stagingWriter;
    private final CnfBodyWriter bodyWriter;

    private boolean committed = false;

    /**
     * Apre lo staging per il corpo del file di output.
     *
     * @param outputPath percorso del file CNF finale (non deve esistere)
     * @param statistics contatori della sessione
     * @throws IOException se il file di staging non può essere creato
     */
    public CnfAssembler(Path outputPath, EncodingStatistics statistics) throws IOException {
        this.outputPath = outputPath;
        this.statistics = statistics;

        Path directory = outputPath.toAbsolutePath().getParent();
        this.stagingPath = Files.createTempFile(directory, STAGING_PREFIX, STAGING_SUFFIX);
        this.stagingWriter = Files.newBufferedWriter(stagingPath, StandardCharsets.UTF_8);
        this.bodyWriter = new CnfBodyWriter(stagingWriter, statistics);

        LOGGER.fine("Staging aperto: " + stagingPath);
    }

    public CnfBodyWriter getBodyWriter() {
        return bodyWriter;
    }

    //region FASE 2

    /**
     * Scrive il file finale: intestazione documentale, header con i totali, corpo.
     *
     * @param network rete codificata
     * @param options opzioni della codifica
     * @param session sessione con legenda e contatori finali
     * @throws IOException se la scrittura fallisce (il file parziale viene rimosso)
     */
    public void commit(BayesianNetwork network, EncoderOptions options, EncodingSession session) throws IOException {
        if (committed) {
            throw new IllegalStateException("File CNF già scritto: " + outputPath);
        }
        bodyWriter.flush();

        // CREATE_NEW: un file esistente non viene mai sovrascritto né rimosso
        BufferedWriter output = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try (output; BufferedReader body = Files.newBufferedReader(stagingPath, StandardCharsets.UTF_8)) {
            writeHeader(output, network, options, session);
            body.transferTo(output);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Scrittura del file CNF fallita: " + outputPath, e);
            Files.deleteIfExists(outputPath);
            throw e;
        }

        committed = true;
        LOGGER.info("File CNF scritto: " + outputPath + " (" + statistics.getVariables() + " variabili, "
                + statistics.getClauses() + " clausole)");
    }

    private void writeHeader(BufferedWriter output, BayesianNetwork network, EncoderOptions options,
                             EncodingSession session) throws IOException {
        output.write("c " + network.getName() + "\n");
        output.write("c\n");

        output.write("c Parameters:\n");
        for (String line : options.describe()) {
            output.write("c \t" + line + "\n");
        }
        output.write("c\n");

        for (Map.Entry<String, Map<String, Integer>> variable : session.getIndexer().getLegend().entrySet()) {
            output.write("c " + variable.getKey() + "\n");
            for (Map.Entry<String, Integer> state : variable.getValue().entrySet()) {
                output.write("c \t" + state.getKey() + ": " + state.getValue() + "\n");
            }
        }

        output.write("c selector variables: " + session.getFirstSelectorVariable() + ", ...\n");
        output.write("c\n");

        output.write("p cnf " + statistics.getVariables() + " " + statistics.getClauses() + "\n");
    }

    //endregion

    public boolean isCommitted() {
        return committed;
    }

    /**
     * Chiude e cancella il file di staging.
     */
    @Override
    public void close() {
        try {
            stagingWriter.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Errore durante la chiusura dello staging " + stagingPath, e);
        }
        try {
            Files.deleteIfExists(stagingPath);
            LOGGER.fine("Staging rimosso: " + stagingPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Impossibile rimuovere il file di staging " + stagingPath, e);
        }
    }
}
