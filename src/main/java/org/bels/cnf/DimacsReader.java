package org.bels.cnf;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LETTORE DIMACS - Rilettura e verifica dei file CNF prodotti dal codificatore
 *
 * Interpreta un file in formato DIMACS con commenti: righe "c" conservate in ordine,
 * header "p cnf variabili clausole", una clausola per riga terminata da 0.
 *
 * VERIFICHE ESEGUITE:
 * - Esattamente un header, prima di qualsiasi clausola
 * - Ogni clausola terminata da 0 e senza letterali dopo il terminatore
 * - Numero di clausole uguale a quello dichiarato
 * - Nessun letterale oltre il numero di variabili dichiarato
 */
public class DimacsReader {

    private static final Logger LOGGER = Logger.getLogger(DimacsReader.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Terminatore clausola nel formato DIMACS */
    private static final int CLAUSE_TERMINATOR = 0;

    /** Carattere commento nel formato DIMACS */
    private static final char COMMENT_CHAR = 'c';

    /** Prefisso header problema nel formato DIMACS */
    private static final String PROBLEM_PREFIX = "p cnf";

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Legge e verifica un file CNF.
     *
     * @param path file CNF
     * @return formula letta
     * @throws IOException              se il file non è leggibile
     * @throws IllegalArgumentException se il file non rispetta il formato o i totali dell'header
     */
    public DimacsFormula read(Path path) throws IOException {
        LOGGER.fine("Lettura file CNF: " + path);
        try {
            return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "File CNF non valido: " + path, e);
            throw e;
        }
    }

    /**
     * Legge e verifica un testo CNF.
     *
     * @param content contenuto del file
     * @return formula letta
     * @throws IllegalArgumentException se il testo non rispetta il formato o i totali dell'header
     */
    public DimacsFormula readString(String content) {
        return parse(content.lines().toList());
    }

    //endregion

    //region PARSING

    private DimacsFormula parse(List<String> lines) {
        List<String> comments = new ArrayList<>();
        List<int[]> clauses = new ArrayList<>();
        int declaredVariables = -1;
        int declaredClauses = -1;

        for (int lineNumber = 1; lineNumber <= lines.size(); lineNumber++) {
            String line = lines.get(lineNumber - 1).trim();

            if (line.isEmpty()) {
                continue;
            }

            if (line.charAt(0) == COMMENT_CHAR) {
                comments.add(line.length() > 1 ? line.substring(1).trim() : "");
                continue;
            }

            if (line.startsWith(PROBLEM_PREFIX)) {
                if (declaredVariables >= 0) {
                    throw new IllegalArgumentException("Riga " + lineNumber + ": header duplicato");
                }
                if (!clauses.isEmpty()) {
                    throw new IllegalArgumentException("Riga " + lineNumber + ": header dopo le clausole");
                }
                int[] header = parseHeader(line, lineNumber);
                declaredVariables = header[0];
                declaredClauses = header[1];
                continue;
            }

            if (declaredVariables < 0) {
                throw new IllegalArgumentException("Riga " + lineNumber + ": clausola prima dell'header");
            }
            clauses.add(parseClause(line, lineNumber, declaredVariables));
        }

        if (declaredVariables < 0) {
            throw new IllegalArgumentException("Header \"p cnf\" mancante");
        }
        if (clauses.size() != declaredClauses) {
            throw new IllegalArgumentException("L'header dichiara " + declaredClauses + " clausole, trovate " + clauses.size());
        }

        LOGGER.fine("File CNF letto: " + declaredVariables + " variabili, " + clauses.size() + " clausole");
        return new DimacsFormula(declaredVariables, clauses, comments);
    }

    private static int[] parseHeader(String line, int lineNumber) {
        String[] tokens = line.substring(PROBLEM_PREFIX.length()).trim().split("\\s+");
        if (tokens.length != 2) {
            throw new IllegalArgumentException("Riga " + lineNumber + ": header non valido: " + line);
        }
        try {
            int variables = Integer.parseInt(tokens[0]);
            int clauses = Integer.parseInt(tokens[1]);
            if (variables < 0 || clauses < 0) {
                throw new IllegalArgumentException("Riga " + lineNumber + ": totali negativi nell'header");
            }
            return new int[]{variables, clauses};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Riga " + lineNumber + ": header non numerico: " + line, e);
        }
    }

    private static int[] parseClause(String line, int lineNumber, int declaredVariables) {
        String[] tokens = line.split("\\s+");
        int[] clause = new int[tokens.length - 1];

        for (int i = 0; i < tokens.length; i++) {
            int literal;
            try {
                literal = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Riga " + lineNumber + ": letterale non valido " + tokens[i], e);
            }

            if (literal == CLAUSE_TERMINATOR) {
                if (i != tokens.length - 1) {
                    throw new IllegalArgumentException("Riga " + lineNumber + ": letterali dopo il terminatore");
                }
                return clause;
            }
            if (i == tokens.length - 1) {
                break;
            }
            if (Math.abs(literal) > declaredVariables) {
                throw new IllegalArgumentException("Riga " + lineNumber + ": variabile " + Math.abs(literal)
                        + " oltre le " + declaredVariables + " dichiarate");
            }
            clause[i] = literal;
        }

        throw new IllegalArgumentException("Riga " + lineNumber + ": clausola senza terminatore 0");
    }

    //endregion
}
