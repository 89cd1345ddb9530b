package org.bels.encoder;

/**
 * Coppia (variabile, stato) mai registrata nell'indicizzatore.
 */
public class UnknownVariableStateException extends EncodingException {

    private final String variable;
    private final String state;

    public UnknownVariableStateException(String variable, String state) {
        super("Coppia variabile/stato non indicizzata: " + variable + " = " + state);
        this.variable = variable;
        this.state = state;
    }

    public String getVariable() {
        return variable;
    }

    public String getState() {
        return state;
    }
}
