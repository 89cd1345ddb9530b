package org.bels.network;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.bels.antlr.BifLexer;
import org.bels.antlr.BifParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * LETTORE BIF - Pipeline ANTLR dal testo BIF alla rete bayesiana in memoria
 *
 * Lexing -> Parsing -> Visitor. Qualsiasi errore sintattico interrompe la lettura
 * con BifFormatException invece del recupero automatico di ANTLR, perché una rete
 * parzialmente letta produrrebbe una codifica CNF silenziosamente errata.
 */
public class BifReader {

    private static final Logger LOGGER = Logger.getLogger(BifReader.class.getName());

    /** Estensione richiesta per i file di input */
    public static final String BIF_EXTENSION = ".bif";

    /**
     * Legge una rete da file BIF. Il nome del file (senza estensione) è usato
     * come nome della rete se manca il blocco network.
     *
     * @param path percorso del file .bif
     * @return rete bayesiana letta
     * @throws IOException        se il file non è leggibile
     * @throws BifFormatException se il contenuto non è BIF valido
     */
    public BayesianNetwork readFile(Path path) throws IOException {
        LOGGER.info("Lettura rete BIF: " + path);

        String fileName = path.getFileName().toString();
        String fallbackName = fileName.endsWith(BIF_EXTENSION)
                ? fileName.substring(0, fileName.length() - BIF_EXTENSION.length())
                : fileName;

        CharStream input = CharStreams.fromPath(path, StandardCharsets.UTF_8);
        return parse(input, fallbackName);
    }

    /**
     * Legge una rete da testo BIF.
     *
     * @param content      testo BIF completo
     * @param fallbackName nome della rete se manca il blocco network
     * @return rete bayesiana letta
     * @throws BifFormatException se il contenuto non è BIF valido
     */
    public BayesianNetwork readString(String content, String fallbackName) {
        return parse(CharStreams.fromString(content), fallbackName);
    }

    private BayesianNetwork parse(CharStream input, String fallbackName) {
        BifLexer lexer = new BifLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        BifParser parser = new BifParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        BifParser.CompilationUnitContext tree = parser.compilationUnit();
        BayesianNetwork network = new BifNetworkVisitor(fallbackName).buildNetwork(tree);

        LOGGER.info("Rete BIF letta: " + network);
        return network;
    }

    /**
     * Converte gli errori di lexer e parser in BifFormatException con posizione.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new BifFormatException("Errore sintattico BIF alla riga " + line + ":" + charPositionInLine + " - " + msg, e);
        }
    }
}
