package org.bels.network;

/**
 * Errore sintattico o semantico nel contenuto di un file BIF.
 */
public class BifFormatException extends RuntimeException {

    public BifFormatException(String message) {
        super(message);
    }

    public BifFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
