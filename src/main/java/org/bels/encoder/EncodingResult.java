package org.bels.encoder;

import java.nio.file.Path;
import java.util.List;

/**
 * Riepilogo immutabile di una codifica completata.
 *
 * @param outputPath           file CNF scritto
 * @param variables            variabili dichiarate nell'header
 * @param clauses              clausole dichiarate nell'header
 * @param ones                 righe con probabilità 1 eliminate
 * @param zeros                righe con probabilità 0 emesse come clausole hard
 * @param shrinks              righe ridotte per indipendenza contestuale
 * @param independentVariables variabili rimosse in totale dalle riduzioni
 * @param leafVariables        variabili foglia escluse dai vincoli sugli indicatori
 * @param executionTimeMs      durata della codifica
 */
public record EncodingResult(Path outputPath,
                             int variables,
                             int clauses,
                             int ones,
                             int zeros,
                             int shrinks,
                             int independentVariables,
                             List<String> leafVariables,
                             long executionTimeMs) {

    public EncodingResult {
        leafVariables = List.copyOf(leafVariables);
    }

    static EncodingResult of(Path outputPath, EncodingStatistics statistics, List<String> leafVariables) {
        return new EncodingResult(outputPath, statistics.getVariables(), statistics.getClauses(),
                statistics.getOnes(), statistics.getZeros(), statistics.getShrinks(),
                statistics.getIndependentVariables(), leafVariables, statistics.getExecutionTimeMs());
    }
}
