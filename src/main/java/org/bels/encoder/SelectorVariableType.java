package org.bels.encoder;

/**
 * Strategia dei selettori per le clausole hard.
 *
 * Il selettore è un letterale positivo aggiunto in coda alla clausola hard: un
 * solutore esterno può disattivare la clausola assegnando vero al selettore.
 */
public enum SelectorVariableType {

    /** Nessun selettore: la clausola resta permanentemente hard */
    NONE {
        @Override
        int selectorFor(EncodingSession session) {
            return 0;
        }
    },

    /** Un unico selettore condiviso da tutta la codifica */
    ONE {
        @Override
        int selectorFor(EncodingSession session) {
            return session.getSharedSelector();
        }
    },

    /** Un selettore nuovo per ogni clausola hard */
    NEW {
        @Override
        int selectorFor(EncodingSession session) {
            return session.getIndexer().allocate();
        }
    };

    /**
     * @param session sessione di codifica corrente
     * @return selettore da aggiungere alla clausola hard, 0 se nessuno
     */
    abstract int selectorFor(EncodingSession session);

    /**
     * @param name nome della strategia, senza distinzione tra maiuscole e minuscole
     * @return strategia corrispondente
     * @throws IllegalArgumentException se il nome non è valido
     */
    public static SelectorVariableType fromName(String name) {
        for (SelectorVariableType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Tipo di selettore non supportato: " + name + ". Supportati: NONE, ONE, NEW");
    }
}
