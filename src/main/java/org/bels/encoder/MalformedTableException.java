package org.bels.encoder;

/**
 * CPT malformata: numero di valori diverso dal prodotto dei domini dello scope,
 * oppure dimensione non divisibile durante la scomposizione row-major.
 */
public class MalformedTableException extends EncodingException {

    public MalformedTableException(String message) {
        super(message);
    }
}
