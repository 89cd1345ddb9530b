package org.bels.encoder;

/**
 * Tipo di circuito prodotto dal knowledge compiler a valle.
 *
 * Ogni tipo fissa due interruttori della codifica:
 * <pre>
 * tipo     vincoli variabili foglia   clausole minori
 * nwDNNF   no                         no
 * dDNNF    sì                         no
 * sdDNNF   sì                         sì
 * </pre>
 */
public enum CircuitType {

    NW_DNNF("nwDNNF", false, false),
    D_DNNF("dDNNF", true, false),
    SD_DNNF("sdDNNF", true, true);

    private final String label;
    private final boolean leafConstraints;
    private final boolean minorClauses;

    CircuitType(String label, boolean leafConstraints, boolean minorClauses) {
        this.label = label;
        this.leafConstraints = leafConstraints;
        this.minorClauses = minorClauses;
    }

    public String getLabel() {
        return label;
    }

    public boolean requiresLeafConstraints() {
        return leafConstraints;
    }

    public boolean requiresMinorClauses() {
        return minorClauses;
    }

    /**
     * @param label etichetta del circuito (nwDNNF, dDNNF, sdDNNF)
     * @return tipo corrispondente
     * @throws IllegalArgumentException se l'etichetta non è valida
     */
    public static CircuitType fromLabel(String label) {
        for (CircuitType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Tipo di circuito non supportato: " + label + ". Supportati: nwDNNF, dDNNF, sdDNNF");
    }
}
