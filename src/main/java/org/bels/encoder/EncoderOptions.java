package org.bels.encoder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Opzioni immutabili di una codifica, scelte una volta all'avvio e iniettate negli emettitori.
 *
 * @param determinism                  righe con probabilità 1 eliminate, righe con probabilità 0 come clausole hard
 * @param indicatorClauses             clausole "al più uno stato" per ogni coppia di stati
 * @param contextSpecificIndependence  riduzione delle clausole per indipendenza contestuale
 * @param leafConstraints              vincoli sugli indicatori anche per le variabili foglia
 * @param minorClauses                 scomposizione di ogni clausola parametro in clausole binarie
 * @param selectorType                 strategia dei selettori per le clausole hard
 */
public record EncoderOptions(boolean determinism,
                             boolean indicatorClauses,
                             boolean contextSpecificIndependence,
                             boolean leafConstraints,
                             boolean minorClauses,
                             SelectorVariableType selectorType) {

    public EncoderOptions {
        Objects.requireNonNull(selectorType, "selectorType");

        // Le clausole minori richiedono vincoli completi e clausole hard senza selettore
        if (minorClauses) {
            if (!indicatorClauses) {
                throw new EncodingConsistencyException("Le clausole minori richiedono le clausole indicatore");
            }
            if (!leafConstraints) {
                throw new EncodingConsistencyException("Le clausole minori richiedono i vincoli sulle variabili foglia");
            }
            if (selectorType != SelectorVariableType.NONE) {
                throw new EncodingConsistencyException("Le clausole minori non sono compatibili con il selettore " + selectorType);
            }
        }
    }

    /**
     * Opzioni predefinite per un tipo di circuito: indicatori attivi, determinismo e
     * indipendenza contestuale disattivati, nessun selettore.
     *
     * @param circuitType tipo di circuito di destinazione
     * @return opzioni corrispondenti
     */
    public static EncoderOptions forCircuitType(CircuitType circuitType) {
        return new EncoderOptions(false, true, false,
                circuitType.requiresLeafConstraints(), circuitType.requiresMinorClauses(),
                SelectorVariableType.NONE);
    }

    public EncoderOptions withDeterminism(boolean enabled) {
        return new EncoderOptions(enabled, indicatorClauses, contextSpecificIndependence, leafConstraints, minorClauses, selectorType);
    }

    public EncoderOptions withIndicatorClauses(boolean enabled) {
        return new EncoderOptions(determinism, enabled, contextSpecificIndependence, leafConstraints, minorClauses, selectorType);
    }

    public EncoderOptions withContextSpecificIndependence(boolean enabled) {
        return new EncoderOptions(determinism, indicatorClauses, enabled, leafConstraints, minorClauses, selectorType);
    }

    public EncoderOptions withSelectorType(SelectorVariableType type) {
        return new EncoderOptions(determinism, indicatorClauses, contextSpecificIndependence, leafConstraints, minorClauses, type);
    }

    /**
     * Descrizione delle opzioni attive, una per riga, nell'ordine dell'intestazione CNF.
     *
     * @return righe descrittive (l'ultima riporta sempre il tipo di selettore)
     */
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        if (determinism) lines.add("determinism");
        if (minorClauses) lines.add("minor clauses");
        if (indicatorClauses) lines.add("indicator clauses");
        if (contextSpecificIndependence) lines.add("context-specific independence");
        if (leafConstraints) lines.add("constraint clauses for leaf variables");
        lines.add("selector variable type: " + selectorType.name());
        return lines;
    }
}
