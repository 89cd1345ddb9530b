package org.bels.encoder;

/**
 * Violazione di un invariante interno: chiave duplicata nella tabella di probabilità,
 * insieme indipendente grande quanto lo scope, opzioni incompatibili.
 */
public class EncodingConsistencyException extends EncodingException {

    public EncodingConsistencyException(String message) {
        super(message);
    }
}
