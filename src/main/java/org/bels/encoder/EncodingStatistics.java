package org.bels.encoder;

/**
 * STATISTICHE DI CODIFICA - Contatori di una sessione di codifica CNF
 *
 * Raccoglie i totali incrementati dagli emettitori durante la fase 1 e letti
 * dall'assemblatore in fase 2 per l'header DIMACS. I contatori sono solo
 * incrementali: nessun emettitore li decrementa o li sovrascrive.
 *
 * CONTATORI:
 * - variabili allocate (indicatori, selettori, parametri)
 * - clausole emesse (indicatori, parametri, clausole minori)
 * - righe con probabilità 1 eliminate (determinismo)
 * - righe con probabilità 0 trasformate in clausole hard (determinismo)
 * - righe ridotte per indipendenza contestuale e variabili rimosse in totale
 */
public class EncodingStatistics {

    //region CONTATORI

    private int variables = 0;

    private int clauses = 0;

    /** Righe CPT con probabilità 1 non emesse */
    private int ones = 0;

    /** Righe CPT con probabilità 0 emesse come clausole hard */
    private int zeros = 0;

    /** Righe CPT la cui clausola è stata ridotta per indipendenza contestuale */
    private int shrinks = 0;

    /** Somma delle variabili rimosse da tutte le riduzioni */
    private int independentVariables = 0;

    //endregion

    //region TIMING

    private long startTime = 0;
    private long executionTimeMs = 0;
    private boolean timerStopped = true;

    //endregion

    //region CICLO DI VITA

    /**
     * Azzera tutti i contatori e riavvia il timer.
     * Necessario tra codifiche indipendenti della stessa sessione.
     */
    public void reset() {
        variables = 0;
        clauses = 0;
        ones = 0;
        zeros = 0;
        shrinks = 0;
        independentVariables = 0;
        startTime = System.currentTimeMillis();
        executionTimeMs = 0;
        timerStopped = false;
    }

    /**
     * Ferma il timer. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region INCREMENTI

    void incrementVariables() {
        variables++;
    }

    void incrementClauses() {
        clauses++;
    }

    void incrementOnes() {
        ones++;
    }

    void incrementZeros() {
        zeros++;
    }

    /**
     * Registra una riduzione di clausola.
     *
     * @param removedVariables numero di variabili escluse dalla clausola
     */
    void recordShrink(int removedVariables) {
        shrinks++;
        independentVariables += removedVariables;
    }

    //endregion

    //region ACCESSO

    public int getVariables() {
        return variables;
    }

    public int getClauses() {
        return clauses;
    }

    public int getOnes() {
        return ones;
    }

    public int getZeros() {
        return zeros;
    }

    public int getShrinks() {
        return shrinks;
    }

    public int getIndependentVariables() {
        return independentVariables;
    }

    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    @Override
    public String toString() {
        return String.format("Variabili: %d, Clausole: %d, Uni: %d, Zeri: %d, Riduzioni: %d, Variabili indipendenti: %d, Tempo: %d ms",
                variables, clauses, ones, zeros, shrinks, independentVariables, getExecutionTimeMs());
    }

    //endregion
}
