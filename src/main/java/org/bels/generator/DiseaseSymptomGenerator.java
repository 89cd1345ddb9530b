package org.bels.generator;

import org.bels.network.BifReader;
import org.bels.support.MixedRadixCounter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * GENERATORE RETI MALATTIE/SINTOMI - Istanze sintetiche per il benchmark del codificatore
 *
 * Produce una rete bayesiana a due livelli in formato BIF:
 * - livello superiore: malattie Disease_i senza genitori, stati value_d_i_j
 * - livello inferiore: sintomi Symptom_i, stati value_s_i_j, ciascuno figlio di
 *   un sottoinsieme casuale delle malattie
 *
 * PARAMETRI:
 * - dimensione dei due livelli (≥ 2) e dimensione comune dei domini (≥ 2)
 * - densità percentuale (1-100): ogni sintomo ha ⌊malattie × densità / 100⌋ genitori
 * - seme del generatore pseudo-casuale, rilevante solo se la densità è < 100
 *
 * Tutte le CPT sono deterministiche (1.0 sul primo stato, 0.0 sugli altri): le istanze
 * misurano l'effetto di determinismo e indipendenza contestuale sulla dimensione della CNF.
 */
public class DiseaseSymptomGenerator {

    private static final Logger LOGGER = Logger.getLogger(DiseaseSymptomGenerator.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    public static final int DEFAULT_LAYER_SIZE = 5;
    public static final int DEFAULT_DOMAIN_SIZE = 2;
    public static final int DEFAULT_DENSITY = 100;

    private static final String DISEASE_PREFIX = "Disease_";
    private static final String SYMPTOM_PREFIX = "Symptom_";
    private static final String DISEASE_STATE_PREFIX = "value_d_";
    private static final String SYMPTOM_STATE_PREFIX = "value_s_";

    private final int topLayerSize;
    private final int bottomLayerSize;
    private final int domainSize;
    private final int density;
    private final long seed;
    private final int edgesPerSymptom;

    //endregion

    //region INIZIALIZZAZIONE

    /**
     * @param topLayerSize    numero di malattie (≥ 2)
     * @param bottomLayerSize numero di sintomi (≥ 2)
     * @param domainSize      stati di ogni variabile (≥ 2)
     * @param density         percentuale di malattie collegate a ogni sintomo (1-100)
     * @param seed            seme positivo, oppure null per generarne uno casuale
     * @throws IllegalArgumentException se i parametri non producono una rete valida
     */
    public DiseaseSymptomGenerator(int topLayerSize, int bottomLayerSize, int domainSize, int density, Long seed) {
        requireAtLeastTwo(topLayerSize, "dimensione del livello superiore");
        requireAtLeastTwo(bottomLayerSize, "dimensione del livello inferiore");
        requireAtLeastTwo(domainSize, "dimensione del dominio");
        if (density < 1 || density > 100) {
            throw new IllegalArgumentException("La densità deve essere compresa tra 1 e 100: " + density);
        }
        if (seed != null && seed <= 0) {
            throw new IllegalArgumentException("Il seme deve essere positivo: " + seed);
        }

        this.topLayerSize = topLayerSize;
        this.bottomLayerSize = bottomLayerSize;
        this.domainSize = domainSize;
        this.density = density;
        this.seed = seed != null ? seed : randomSeed();
        this.edgesPerSymptom = topLayerSize * density / 100;

        if (edgesPerSymptom < 2) {
            throw new IllegalArgumentException("Densità troppo bassa: " + edgesPerSymptom
                    + " archi per sintomo, almeno 2 richiesti");
        }
        if ((long) bottomLayerSize * edgesPerSymptom <= topLayerSize) {
            throw new IllegalArgumentException("Archi insufficienti: " + bottomLayerSize + " sintomi × "
                    + edgesPerSymptom + " archi non coprono " + topLayerSize + " malattie");
        }

        LOGGER.fine("Generatore configurato: " + getNetworkName() + ", " + edgesPerSymptom + " archi per sintomo");
    }

    private static void requireAtLeastTwo(int value, String description) {
        if (value < 2) {
            throw new IllegalArgumentException("La " + description + " deve essere almeno 2: " + value);
        }
    }

    private static long randomSeed() {
        long generated;
        do {
            generated = new SecureRandom().nextLong() & Long.MAX_VALUE;
        } while (generated == 0);
        return generated;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Nome della rete: top[_bottom]_dominio_densità[_seme]. La dimensione del livello
     * inferiore compare solo se diversa dal superiore, il seme solo se la densità è < 100.
     */
    public String getNetworkName() {
        StringBuilder name = new StringBuilder().append(topLayerSize);
        if (bottomLayerSize != topLayerSize) {
            name.append('_').append(bottomLayerSize);
        }
        name.append('_').append(domainSize).append('_').append(density);
        if (isRandomized()) {
            name.append('_').append(seed);
        }
        return name.toString();
    }

    /**
     * @return true se i genitori dei sintomi sono estratti casualmente
     */
    public boolean isRandomized() {
        return density != 100;
    }

    /**
     * Scrive la rete su un nuovo file BIF.
     *
     * @param outputPath file da creare, con estensione .bif
     * @return percorso del file scritto
     * @throws IllegalArgumentException se l'estensione non è .bif o il file esiste già
     * @throws IOException              se la scrittura fallisce
     */
    public Path generate(Path outputPath) throws IOException {
        if (!outputPath.getFileName().toString().endsWith(BifReader.BIF_EXTENSION)) {
            throw new IllegalArgumentException("Il file di output deve avere estensione " + BifReader.BIF_EXTENSION
                    + ": " + outputPath);
        }
        if (Files.exists(outputPath)) {
            throw new IllegalArgumentException("Il file di output esiste già: " + outputPath);
        }

        try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            writer.write(toBif());
        }

        LOGGER.info("Rete " + getNetworkName() + " generata: " + outputPath);
        return outputPath;
    }

    /**
     * Testo BIF completo della rete. A parità di parametri e seme il testo è identico.
     */
    public String toBif() {
        StringBuilder bif = new StringBuilder();
        bif.append("network ").append(getNetworkName()).append(" {}\n");

        for (int disease = 1; disease <= topLayerSize; disease++) {
            appendVariable(bif, DISEASE_PREFIX + disease, DISEASE_STATE_PREFIX + disease + "_");
        }
        for (int symptom = 1; symptom <= bottomLayerSize; symptom++) {
            appendVariable(bif, SYMPTOM_PREFIX + symptom, SYMPTOM_STATE_PREFIX + symptom + "_");
        }

        for (int disease = 1; disease <= topLayerSize; disease++) {
            bif.append("probability ( ").append(DISEASE_PREFIX).append(disease).append(" ) {\n");
            bif.append("  table ").append(deterministicRow()).append(";\n");
            bif.append("}\n");
        }

        Random random = new Random(seed);
        for (int symptom = 1; symptom <= bottomLayerSize; symptom++) {
            appendSymptomProbability(bif, symptom, sampleParents(random));
        }

        return bif.toString();
    }

    //endregion

    //region COSTRUZIONE BLOCCHI BIF

    private void appendVariable(StringBuilder bif, String variable, String statePrefix) {
        bif.append("variable ").append(variable).append(" {\n");
        bif.append("  type discrete [ ").append(domainSize).append(" ] { ");
        for (int state = 1; state <= domainSize; state++) {
            bif.append(statePrefix).append(state);
            bif.append(state < domainSize ? ", " : " ");
        }
        bif.append("};\n");
        bif.append("}\n");
    }

    /**
     * Una riga condizionata per ogni combinazione degli stati dei genitori,
     * primo genitore più lento.
     */
    private void appendSymptomProbability(StringBuilder bif, int symptom, List<Integer> parents) {
        bif.append("probability ( ").append(SYMPTOM_PREFIX).append(symptom).append(" | ");
        for (int i = 0; i < parents.size(); i++) {
            if (i > 0) {
                bif.append(", ");
            }
            bif.append(DISEASE_PREFIX).append(parents.get(i));
        }
        bif.append(" ) {\n");

        int[] radices = new int[parents.size()];
        Arrays.fill(radices, domainSize);
        MixedRadixCounter counter = new MixedRadixCounter(radices);
        do {
            bif.append("  (");
            for (int i = 0; i < parents.size(); i++) {
                if (i > 0) {
                    bif.append(", ");
                }
                bif.append(DISEASE_STATE_PREFIX).append(parents.get(i)).append('_').append(counter.digit(i) + 1);
            }
            bif.append(") ").append(deterministicRow()).append(";\n");
        } while (counter.next());

        bif.append("}\n");
    }

    private String deterministicRow() {
        StringBuilder row = new StringBuilder("1.0");
        for (int state = 1; state < domainSize; state++) {
            row.append(", 0.0");
        }
        return row.toString();
    }

    /**
     * Estrae senza ripetizione i genitori di un sintomo e li ordina.
     *
     * @return numeri delle malattie (da 1) in ordine crescente
     */
    private List<Integer> sampleParents(Random random) {
        List<Integer> diseases = new ArrayList<>();
        for (int disease = 1; disease <= topLayerSize; disease++) {
            diseases.add(disease);
        }
        if (isRandomized()) {
            Collections.shuffle(diseases, random);
        }

        List<Integer> parents = new ArrayList<>(diseases.subList(0, edgesPerSymptom));
        Collections.sort(parents);
        return parents;
    }

    //endregion

    public int getEdgesPerSymptom() {
        return edgesPerSymptom;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return String.format("DiseaseSymptomGenerator[%s, archi per sintomo=%d]", getNetworkName(), edgesPerSymptom);
    }
}
