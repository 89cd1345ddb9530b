package org.bels.cnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Formula CNF riletta da file: totali dichiarati, clausole e commenti nell'ordine del file.
 */
public final class DimacsFormula {

    private final int variableCount;
    private final List<int[]> clauses;
    private final List<String> comments;

    DimacsFormula(int variableCount, List<int[]> clauses, List<String> comments) {
        this.variableCount = variableCount;
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getClauseCount() {
        return clauses.size();
    }

    /**
     * @return clausole senza terminatore; gli array non vanno modificati
     */
    public List<int[]> getClauses() {
        return clauses;
    }

    /**
     * @return testo dei commenti senza il prefisso "c"
     */
    public List<String> getComments() {
        return comments;
    }

    /**
     * @return indice di variabile più alto usato dalle clausole
     */
    public int getHighestVariable() {
        int highest = 0;
        for (int[] clause : clauses) {
            for (int literal : clause) {
                highest = Math.max(highest, Math.abs(literal));
            }
        }
        return highest;
    }
}
