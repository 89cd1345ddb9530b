package org.bels.encoder;

/**
 * Radice degli errori fatali della codifica. Ogni violazione indica input
 * malformato o un difetto del codificatore: la codifica viene interrotta
 * senza produrre il file finale.
 */
public class EncodingException extends RuntimeException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
