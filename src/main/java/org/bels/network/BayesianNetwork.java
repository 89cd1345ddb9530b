package org.bels.network;

import java.util.*;
import java.util.logging.Logger;

/**
 * RETE BAYESIANA DISCRETA - Modello immutabile in sola lettura per il codificatore CNF
 *
 * Rappresenta la rete prodotta dal parser BIF: variabili ordinate, domini ordinati,
 * mappa dei genitori (che definisce lo scope di ogni CPT), lista degli archi e valori
 * delle CPT appiattiti.
 *
 * LAYOUT DEI VALORI CPT:
 * - Prodotto cartesiano (genitori..., variabile) in ordine row-major
 * - La variabile stessa varia più velocemente
 * - Lunghezza attesa = Π(|dominio genitore|) × |dominio variabile|
 *
 * INVARIANTI MANTENUTE:
 * - Ogni variabile ha dominio di dimensione ≥ 2 senza stati duplicati
 * - Ogni genitore è una variabile dichiarata della rete
 * - L'ordine di dichiarazione di variabili e stati è preservato
 *
 * La coerenza numerica delle CPT NON è verificata qui: è responsabilità
 * del costruttore delle tabelle di probabilità durante la codifica.
 */
public final class BayesianNetwork {

    private static final Logger LOGGER = Logger.getLogger(BayesianNetwork.class.getName());

    //region STRUTTURE DATI

    private final String name;

    /** Variabile → stati, in ordine di dichiarazione */
    private final Map<String, List<String>> states;

    /** Variabile → genitori ordinati (scope della CPT senza la variabile stessa) */
    private final Map<String, List<String>> parents;

    /** Variabile → valori CPT appiattiti */
    private final Map<String, double[]> values;

    /** Archi genitore → figlio nell'ordine di dichiarazione delle CPT */
    private final List<Edge> edges;

    //endregion

    //region COSTRUZIONE

    private BayesianNetwork(Builder builder) {
        this.name = builder.name;
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(builder.states));
        this.parents = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parents));
        this.values = new LinkedHashMap<>(builder.values);

        List<Edge> edgeList = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : parents.entrySet()) {
            for (String parent : entry.getValue()) {
                edgeList.add(new Edge(parent, entry.getKey()));
            }
        }
        this.edges = Collections.unmodifiableList(edgeList);

        LOGGER.fine("Rete " + name + " costruita: " + states.size() + " variabili, " + edges.size() + " archi");
    }

    /**
     * Crea un builder per una rete con il nome specificato.
     *
     * @param name nome della rete, riportato nell'intestazione del file CNF
     * @return builder vuoto
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    public String getName() {
        return name;
    }

    /**
     * @return variabili nell'ordine di dichiarazione
     */
    public List<String> getVariables() {
        return List.copyOf(states.keySet());
    }

    /**
     * @param variable variabile della rete
     * @return stati della variabile nell'ordine di dichiarazione
     * @throws IllegalArgumentException se la variabile non esiste
     */
    public List<String> getStates(String variable) {
        List<String> variableStates = states.get(variable);
        if (variableStates == null) {
            throw new IllegalArgumentException("Variabile sconosciuta: " + variable);
        }
        return variableStates;
    }

    public int getDomainSize(String variable) {
        return getStates(variable).size();
    }

    /**
     * @param variable variabile della rete
     * @return genitori ordinati della variabile (lista vuota per le radici)
     */
    public List<String> getParents(String variable) {
        getStates(variable);
        return parents.getOrDefault(variable, List.of());
    }

    /**
     * Restituisce una copia dei valori CPT appiattiti della variabile.
     *
     * @param variable variabile della rete
     * @return valori in ordine row-major (genitori..., variabile)
     * @throws IllegalArgumentException se la variabile non ha CPT
     */
    public double[] getValues(String variable) {
        double[] cpt = values.get(variable);
        if (cpt == null) {
            throw new IllegalArgumentException("CPT mancante per la variabile: " + variable);
        }
        return cpt.clone();
    }

    public List<Edge> getEdges() {
        return edges;
    }

    /**
     * Una variabile è foglia se non ha archi uscenti.
     *
     * @param variable variabile della rete
     * @return true se nessuna altra variabile dipende da questa
     */
    public boolean isLeaf(String variable) {
        getStates(variable);
        for (Edge edge : edges) {
            if (edge.from().equals(variable)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return variabili foglia nell'ordine di dichiarazione
     */
    public List<String> getLeafVariables() {
        List<String> leaves = new ArrayList<>();
        for (String variable : states.keySet()) {
            if (isLeaf(variable)) {
                leaves.add(variable);
            }
        }
        return leaves;
    }

    @Override
    public String toString() {
        return "BayesianNetwork{" + name + ", variabili=" + states.size() + ", archi=" + edges.size() + "}";
    }

    //endregion

    //region CLASSI DI SUPPORTO

    /**
     * Arco orientato di dipendenza genitore → figlio.
     */
    public record Edge(String from, String to) {}

    /**
     * Builder incrementale della rete, usato dal lettore BIF e dal generatore.
     */
    public static final class Builder {
        private final String name;
        private final Map<String, List<String>> states = new LinkedHashMap<>();
        private final Map<String, List<String>> parents = new LinkedHashMap<>();
        private final Map<String, double[]> values = new LinkedHashMap<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Il nome della rete non può essere vuoto");
            }
            this.name = name;
        }

        /**
         * Dichiara una variabile con il suo dominio ordinato.
         *
         * @throws IllegalArgumentException se la variabile è duplicata, il dominio ha meno
         *                                  di due stati o contiene stati ripetuti
         */
        public Builder addVariable(String variable, List<String> variableStates) {
            if (states.containsKey(variable)) {
                throw new IllegalArgumentException("Variabile dichiarata due volte: " + variable);
            }
            if (variableStates == null || variableStates.size() < 2) {
                throw new IllegalArgumentException("La variabile " + variable + " deve avere almeno due stati");
            }
            if (new HashSet<>(variableStates).size() != variableStates.size()) {
                throw new IllegalArgumentException("Stati duplicati nella variabile " + variable);
            }
            states.put(variable, List.copyOf(variableStates));
            return this;
        }

        /**
         * @return stati di una variabile già dichiarata
         * @throws IllegalArgumentException se la variabile non è dichiarata
         */
        public List<String> getStates(String variable) {
            List<String> variableStates = states.get(variable);
            if (variableStates == null) {
                throw new IllegalArgumentException("Variabile non dichiarata: " + variable);
            }
            return variableStates;
        }

        /**
         * Registra la CPT di una variabile già dichiarata.
         *
         * @param variable      variabile della CPT
         * @param variableParents genitori ordinati (definiscono lo scope)
         * @param cptValues     valori appiattiti row-major, variabile più veloce
         * @throws IllegalArgumentException se la variabile o un genitore non sono dichiarati
         */
        public Builder setCpt(String variable, List<String> variableParents, double[] cptValues) {
            if (!states.containsKey(variable)) {
                throw new IllegalArgumentException("CPT per variabile non dichiarata: " + variable);
            }
            if (values.containsKey(variable)) {
                throw new IllegalArgumentException("CPT definita due volte per la variabile: " + variable);
            }
            for (String parent : variableParents) {
                if (!states.containsKey(parent)) {
                    throw new IllegalArgumentException("Genitore non dichiarato " + parent + " per la variabile " + variable);
                }
                if (parent.equals(variable)) {
                    throw new IllegalArgumentException("La variabile " + variable + " non può essere genitore di se stessa");
                }
            }
            parents.put(variable, List.copyOf(variableParents));
            values.put(variable, cptValues.clone());
            return this;
        }

        /**
         * @return rete immutabile
         * @throws IllegalStateException se la rete è vuota o una variabile non ha CPT
         */
        public BayesianNetwork build() {
            if (states.isEmpty()) {
                throw new IllegalStateException("La rete " + name + " non contiene variabili");
            }
            for (String variable : states.keySet()) {
                if (!values.containsKey(variable)) {
                    throw new IllegalStateException("CPT mancante per la variabile: " + variable);
                }
            }
            return new BayesianNetwork(this);
        }
    }

    //endregion
}
