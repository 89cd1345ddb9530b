package org.bels.encoder;

/**
 * SESSIONE DI CODIFICA - Stato mutabile condiviso da tutti gli emettitori
 *
 * Raccoglie contatori, indicizzatore e selettore condiviso di una codifica. Viene
 * passata per riferimento a ogni componente e azzerata con reset() prima di ogni
 * codifica indipendente, così contatori e indici non trapelano tra esecuzioni.
 */
public final class EncodingSession {

    private final EncodingStatistics statistics = new EncodingStatistics();
    private final VariableIndexer indexer = new VariableIndexer(statistics);

    /** Primo indice dopo il blocco indicatori, riportato nella legenda */
    private int firstSelectorVariable = 0;

    /** Selettore condiviso per la strategia ONE, 0 altrimenti */
    private int sharedSelector = 0;

    /**
     * Apre il blocco dei selettori subito dopo gli indicatori. Con strategia ONE
     * alloca il selettore condiviso.
     *
     * @param selectorType strategia dei selettori della codifica
     */
    public void openSelectorBlock(SelectorVariableType selectorType) {
        firstSelectorVariable = indexer.peekNextIndex();
        if (selectorType == SelectorVariableType.ONE) {
            sharedSelector = indexer.allocate();
        }
    }

    /**
     * Azzera contatori, indici e selettori.
     */
    public void reset() {
        statistics.reset();
        indexer.reset();
        firstSelectorVariable = 0;
        sharedSelector = 0;
    }

    public EncodingStatistics getStatistics() {
        return statistics;
    }

    public VariableIndexer getIndexer() {
        return indexer;
    }

    public int getFirstSelectorVariable() {
        return firstSelectorVariable;
    }

    int getSharedSelector() {
        if (sharedSelector == 0) {
            throw new EncodingConsistencyException("Selettore condiviso non allocato");
        }
        return sharedSelector;
    }
}
