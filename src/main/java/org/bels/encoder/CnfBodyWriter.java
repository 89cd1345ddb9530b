package org.bels.encoder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Scrittore del corpo CNF: una clausola per riga terminata da 0, commenti con prefisso "c".
 *
 * Ogni clausola scritta incrementa il contatore delle clausole della sessione.
 */
public class CnfBodyWriter {

    private final Writer writer;
    private final EncodingStatistics statistics;

    public CnfBodyWriter(Writer writer, EncodingStatistics statistics) {
        this.writer = writer;
        this.statistics = statistics;
    }

    /**
     * Scrive una clausola con i letterali nell'ordine dato.
     */
    public void writeClause(int... literals) {
        StringBuilder line = new StringBuilder();
        for (int literal : literals) {
            line.append(literal).append(' ');
        }
        line.append("0\n");
        write(line.toString());
        statistics.incrementClauses();
    }

    /**
     * Scrive una clausola con un letterale di testa in coda (parametro o selettore).
     * Con testa 0 la clausola è scritta senza letterale aggiuntivo.
     */
    public void writeClauseWithHead(int[] literals, int head) {
        if (head == 0) {
            writeClause(literals);
            return;
        }
        int[] withHead = new int[literals.length + 1];
        System.arraycopy(literals, 0, withHead, 0, literals.length);
        withHead[literals.length] = head;
        writeClause(withHead);
    }

    /**
     * Scrive una riga di commento.
     */
    public void writeComment(String comment) {
        write("c " + comment + "\n");
    }

    public void flush() {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Errore durante lo svuotamento del corpo CNF", e);
        }
    }

    private void write(String text) {
        try {
            writer.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Errore di scrittura del corpo CNF", e);
        }
    }
}
