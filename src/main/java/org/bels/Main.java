package org.bels;

import org.bels.cnf.DimacsFormula;
import org.bels.cnf.DimacsReader;
import org.bels.encoder.BayesianNetworkEncoder;
import org.bels.encoder.CircuitType;
import org.bels.encoder.EncoderOptions;
import org.bels.encoder.EncodingException;
import org.bels.encoder.EncodingResult;
import org.bels.encoder.SelectorVariableType;
import org.bels.generator.DiseaseSymptomGenerator;
import org.bels.network.BayesianNetwork;
import org.bels.network.BifFormatException;
import org.bels.network.BifReader;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * BELS - Codificatore di reti bayesiane in formule CNF pesate
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: rete bayesiana discreta in formato BIF
 * 2. PARSING: grammatica ANTLR -> BayesianNetwork immutabile
 * 3. CODIFICA: indicatori, vincoli, clausole parametro secondo il tipo di circuito
 * 4. OPZIONI FACOLTATIVE:
 *    - Determinismo: righe con probabilità 0/1 eliminate o rese clausole hard
 *    - Indipendenza contestuale: riduzione delle clausole parametro
 *    - Selettori per le clausole hard (NONE, ONE, NEW)
 * 5. VERIFICA: rilettura del file DIMACS prodotto e controllo dei totali dell'header
 * 6. OUTPUT: file .cnf con legenda degli indicatori e riepilogo a console
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): codifica di un file .bif
 * - Directory batch (-d): codifica di tutti i file .bif non nascosti di una cartella
 * - Generazione (-gen=network): rete sintetica malattie/sintomi in formato BIF
 *
 * Il file di output ha lo stesso nome dell'input con estensione .cnf e non deve esistere.
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String CIRCUIT_PARAM = "-ct=";
    private static final String OPT_PARAM = "-opt=";
    private static final String SELECTOR_PARAM = "-sel=";
    private static final String GEN_PARAM = "-gen=";

    /**
     * Parametri del generatore
     * */
    private static final String TOP_LAYER_PARAM = "-tls";
    private static final String BOTTOM_LAYER_PARAM = "-bls";
    private static final String DOMAIN_PARAM = "-ds";
    private static final String DENSITY_PARAM = "-den";
    private static final String SEED_PARAM = "-seed";

    /**
     * Flag opzioni di codifica disponibili
     * */
    private static final String OPT_DETERMINISM = "d";
    private static final String OPT_CSI = "c";
    private static final String OPT_ALL = "all";

    /**
     * Flag generazione disponibili
     * */
    private static final String GEN_NETWORK = "network";

    private static final String CNF_EXTENSION = ".cnf";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del codificatore.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO CODIFICATORE BELS <---");

        try {
            run(args);
        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE CODIFICATORE <---");
        }
    }

    /**
     * Analizza i parametri ed esegue la modalità richiesta.
     *
     * @param args parametri linea di comando
     * @return true se l'elaborazione è stata eseguita, false se help o parametri non validi
     * @throws IOException se un file di input o di output non è accessibile
     */
    static boolean run(String[] args) throws IOException {
        if (args.length == 0) {
            System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return false;
        }

        EncoderConfiguration config = parseAndValidateArguments(args);
        if (config == null) return false;

        displayConfigurationSummary(config);
        executeMainPipeline(config);
        return true;
    }

    private static void executeMainPipeline(EncoderConfiguration config) throws IOException {
        if (config.isGenerationMode) {
            System.out.println("[I] Modalità: Generazione rete " + config.generationType);
            processNetworkGeneration(config);
        } else if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            processSingleFile(config, Paths.get(config.inputPath));
        } else {
            System.out.println("[I] Modalità: Elaborazione della directory");
            processDirectoryBatch(config);
        }
    }

    /**
     * Gestisce errori critici dell'applicazione e termina con codice di errore.
     *
     * @param e eccezione critica che ha causato il fallimento
     */
    private static void handleGlobalError(Exception e) {
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static EncoderConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(EncoderConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE CODIFICATORE <<--");

        if (config.isGenerationMode) {
            System.out.println("Modalità: Generazione rete " + config.generationType);
            System.out.println("File: " + config.generationTarget);
            System.out.println("Livelli: " + config.topLayerSize + " malattie, " + config.bottomLayerSize + " sintomi");
            System.out.println("Dominio: " + config.domainSize);
            System.out.println("Densità: " + config.density + "%");
        } else {
            System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
            System.out.println("Input: " + config.inputPath);
            System.out.println("Circuito: " + config.circuitType.getLabel());
            System.out.println("Parametri:");
            for (String line : config.options.describe()) {
                System.out.println("\t" + line);
            }
            System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        }
        System.out.println("====================================\n");
    }

    //endregion

    //region GENERAZIONE RETI

    private static void processNetworkGeneration(EncoderConfiguration config) throws IOException {
        System.out.println("-->> GENERAZIONE RETE <<--");

        DiseaseSymptomGenerator generator = new DiseaseSymptomGenerator(config.topLayerSize, config.bottomLayerSize,
                config.domainSize, config.density, config.seed);

        System.out.println("Rete: " + generator.getNetworkName());
        System.out.println("Archi per sintomo: " + generator.getEdgesPerSymptom());
        if (generator.isRandomized()) {
            System.out.println("Seme: " + generator.getSeed());
        }

        Path written = generator.generate(Paths.get(config.generationTarget));
        System.out.println("[I] Rete generata: " + written);
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Codifica un file BIF e verifica il file CNF prodotto.
     *
     * @param config    configurazione con opzioni e directory di output
     * @param inputFile file .bif da codificare
     * @return riepilogo della codifica
     * @throws IOException se input o output non sono accessibili
     */
    private static EncodingResult processSingleFile(EncoderConfiguration config, Path inputFile) throws IOException {
        System.out.println("-->> ELABORAZIONE FILE BIF <<--");
        System.out.println("File: " + inputFile.getFileName());
        System.out.println("==============================\n");

        Path outputFile = resolveOutputFile(config, inputFile);
        if (Files.exists(outputFile)) {
            throw new IllegalArgumentException("Il file di output esiste già: " + outputFile
                    + ". Eliminarlo o scegliere un'altra directory di output");
        }

        // FASE 1: lettura della rete
        BayesianNetwork network = new BifReader().readFile(inputFile);
        System.out.println("[I] Rete letta: " + network.getVariables().size() + " variabili, "
                + network.getEdges().size() + " archi");

        // FASE 2: codifica
        BayesianNetworkEncoder encoder = new BayesianNetworkEncoder(config.options);
        EncodingResult result = encoder.encode(network, outputFile);

        // FASE 3: verifica del file prodotto
        DimacsFormula formula = new DimacsReader().read(outputFile);
        if (formula.getVariableCount() != result.variables() || formula.getClauseCount() != result.clauses()) {
            throw new IllegalStateException("Il file " + outputFile + " non corrisponde al riepilogo della codifica");
        }

        displayEncodingSummary(result);
        return result;
    }

    private static void displayEncodingSummary(EncodingResult result) {
        System.out.println();
        System.out.println("Number of ones: " + result.ones());
        System.out.println("Number of zeros: " + result.zeros());
        System.out.println("Number of shrinks: " + result.shrinks());
        System.out.println("Number of independent variables: " + result.independentVariables());
        System.out.println();
        System.out.println("Leaf variables: " + String.join(" ", result.leafVariables()));
        System.out.println();
        System.out.println("[I] File CNF: " + result.outputPath());
        System.out.println("[I] Variabili: " + result.variables() + ", clausole: " + result.clauses()
                + ", tempo: " + result.executionTimeMs() + " ms");
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static void processDirectoryBatch(EncoderConfiguration config) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<Path> bifFiles = findAllBifFiles(config.inputPath);
        if (bifFiles.isEmpty()) {
            System.out.println("[W] Nessun file .bif trovato nella directory specificata.");
            return;
        }

        BatchResult result = new BatchResult(bifFiles.size());
        for (Path file : bifFiles) {
            try {
                System.out.println("Elaborazione: " + file.getFileName());
                processSingleFile(config, file);
                result.incrementSuccess();
            } catch (IOException | EncodingException | BifFormatException | IllegalArgumentException | IllegalStateException e) {
                System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                result.incrementError();
            }
            System.out.println();
        }

        displayBatchSummary(result);
    }

    /**
     * @return file .bif non nascosti della directory, in ordine di nome
     */
    private static List<Path> findAllBifFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .bif nella directory...");

        List<Path> bifFiles;
        try (Stream<Path> entries = Files.list(Paths.get(dirPath))) {
            bifFiles = entries
                    .filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().startsWith("."))
                    .filter(path -> path.getFileName().toString().endsWith(BifReader.BIF_EXTENSION))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }

        System.out.println("Trovati " + bifFiles.size() + " file .bif da elaborare.");
        return bifFiles;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File trovati: " + result.totalFiles);
        System.out.println("File codificati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%\n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DEI PERCORSI

    private static Path resolveOutputFile(EncoderConfiguration config, Path inputFile) {
        String fileName = getBaseFileName(inputFile) + CNF_EXTENSION;
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(fileName);
        }
        Path parentDir = inputFile.toAbsolutePath().getParent();
        return parentDir != null ? parentDir.resolve(fileName) : Paths.get(fileName);
    }

    private static String getBaseFileName(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> BELS - CODIFICATORE DI RETI BAYESIANE <<::");
        System.out.println("Traduce reti bayesiane discrete (BIF) in formule CNF pesate");
        System.out.println("per knowledge compiler (d-DNNF, sd-DNNF)\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar bels-encoder.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. CODIFICA:");
        System.out.println("     -f <file.bif>        Codifica un singolo file .bif");
        System.out.println("     -d <directory>       Codifica tutti i file .bif di una directory");
        System.out.println("     -o <directory>       Directory di output (default: stessa di input)");
        System.out.println("     -ct=<tipo>           Tipo di circuito: nwDNNF, dDNNF, sdDNNF (default: nwDNNF)");
        System.out.println("     -opt=<flags>         Opzioni (d=determinismo, c=indipendenza contestuale, all=tutte)");
        System.out.println("     -sel=<tipo>          Selettori per le clausole hard: NONE, ONE, NEW (default: NONE)");
        System.out.println();
        System.out.println("  2. GENERAZIONE RETE:");
        System.out.println("     -gen=network <file.bif>  Genera una rete malattie/sintomi");
        System.out.println("     -tls <n>             Dimensione livello superiore (min: 2, default: 5)");
        System.out.println("     -bls <n>             Dimensione livello inferiore (min: 2, default: 5)");
        System.out.println("     -ds <n>              Dimensione dei domini (min: 2, default: 2)");
        System.out.println("     -den <n>             Densità percentuale (1-100, default: 100)");
        System.out.println("     -seed <n>            Seme positivo (default: casuale, ignorato con densità 100)");
        System.out.println();
        System.out.println("  3. AIUTO:");
        System.out.println("     -h                   Mostra questa guida\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar bels-encoder.jar -f asia.bif");
        System.out.println("  java -jar bels-encoder.jar -f asia.bif -ct=sdDNNF -opt=all");
        System.out.println("  java -jar bels-encoder.jar -d ./reti/ -o ./cnf/ -opt=d -sel=ONE");
        System.out.println("  java -jar bels-encoder.jar -gen=network rete.bif -tls 10 -bls 20 -den 30 -seed 42\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Il file di output .cnf non deve esistere");
        System.out.println("  - sdDNNF richiede -sel=NONE");
        System.out.println("  - Le modalità codifica e generazione sono mutualmente esclusive\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione, immutabile durante l'elaborazione.
     */
    private static class EncoderConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final CircuitType circuitType;
        final EncoderOptions options;
        final boolean isGenerationMode;
        final String generationType;
        final String generationTarget;
        final int topLayerSize;
        final int bottomLayerSize;
        final int domainSize;
        final int density;
        final Long seed;

        EncoderConfiguration(String inputPath, String outputPath, boolean isFileMode,
                             CircuitType circuitType, EncoderOptions options,
                             boolean isGenerationMode, String generationType, String generationTarget,
                             int topLayerSize, int bottomLayerSize, int domainSize, int density, Long seed) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.circuitType = circuitType;
            this.options = options;
            this.isGenerationMode = isGenerationMode;
            this.generationType = generationType;
            this.generationTarget = generationTarget;
            this.topLayerSize = topLayerSize;
            this.bottomLayerSize = bottomLayerSize;
            this.domainSize = domainSize;
            this.density = density;
            this.seed = seed;
        }
    }

    /**
     * Parser dei parametri da linea di comando con messaggi di errore per l'utente.
     */
    private static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -f <file>: Input file singolo (esclusivo con -d e -gen)
         * -d <dir>: Input directory per batch (esclusivo con -f e -gen)
         * -gen=network <file.bif>: Generazione rete (esclusivo con -f e -d)
         * -o <dir>: Directory output personalizzata
         * -ct=, -opt=, -sel=: Opzioni di codifica
         * -tls, -bls, -ds, -den, -seed: Parametri del generatore
         *
         * @param args parametri da linea comando forniti dall'utente
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        public EncoderConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean isGenerationMode = false;
            String generationType = null;
            String generationTarget = null;
            CircuitType circuitType = CircuitType.NW_DNNF;
            OptionFlags flags = new OptionFlags(false, false);
            SelectorVariableType selectorType = SelectorVariableType.NONE;
            int topLayerSize = DiseaseSymptomGenerator.DEFAULT_LAYER_SIZE;
            int bottomLayerSize = DiseaseSymptomGenerator.DEFAULT_LAYER_SIZE;
            int domainSize = DiseaseSymptomGenerator.DEFAULT_DOMAIN_SIZE;
            int density = DiseaseSymptomGenerator.DEFAULT_DENSITY;
            Long seed = null;
            List<String> generatorParameters = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, isGenerationMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, isGenerationMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }

                    case TOP_LAYER_PARAM -> {
                        topLayerSize = parsePositiveInt(args, ++i, "dimensione livello superiore");
                        generatorParameters.add(TOP_LAYER_PARAM);
                    }
                    case BOTTOM_LAYER_PARAM -> {
                        bottomLayerSize = parsePositiveInt(args, ++i, "dimensione livello inferiore");
                        generatorParameters.add(BOTTOM_LAYER_PARAM);
                    }
                    case DOMAIN_PARAM -> {
                        domainSize = parsePositiveInt(args, ++i, "dimensione dominio");
                        generatorParameters.add(DOMAIN_PARAM);
                    }
                    case DENSITY_PARAM -> {
                        density = parsePositiveInt(args, ++i, "densità");
                        generatorParameters.add(DENSITY_PARAM);
                    }
                    case SEED_PARAM -> {
                        seed = parseSeed(args, ++i);
                        generatorParameters.add(SEED_PARAM);
                    }

                    default -> {
                        if (args[i].startsWith(CIRCUIT_PARAM)) {
                            circuitType = CircuitType.fromLabel(args[i].substring(CIRCUIT_PARAM.length()));
                        } else if (args[i].startsWith(OPT_PARAM)) {
                            flags = parseOptionFlags(args[i].substring(OPT_PARAM.length()));
                        } else if (args[i].startsWith(SELECTOR_PARAM)) {
                            selectorType = SelectorVariableType.fromName(args[i].substring(SELECTOR_PARAM.length()));
                        } else if (args[i].startsWith(GEN_PARAM)) {
                            validateExclusiveMode(isFileMode, isDirectoryMode, "generazione");
                            generationType = args[i].substring(GEN_PARAM.length());
                            if (!GEN_NETWORK.equals(generationType)) {
                                throw new IllegalArgumentException("Tipo generazione non supportato: " + generationType
                                        + ". Supportati: " + GEN_NETWORK);
                            }
                            generationTarget = getNextArgument(args, ++i, "file .bif di output");
                            isGenerationMode = true;
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (isGenerationMode) {
                if (!generationTarget.endsWith(BifReader.BIF_EXTENSION)) {
                    throw new IllegalArgumentException("Il file generato deve avere estensione .bif: " + generationTarget);
                }
                if (new File(generationTarget).exists()) {
                    throw new IllegalArgumentException("Il file di output esiste già: " + generationTarget);
                }
                return new EncoderConfiguration(null, null, false, null, null,
                        true, generationType, generationTarget,
                        topLayerSize, bottomLayerSize, domainSize, density, seed);
            }

            if (!generatorParameters.isEmpty()) {
                throw new IllegalArgumentException("Parametri " + String.join(", ", generatorParameters)
                        + " validi solo con " + GEN_PARAM + GEN_NETWORK);
            }
            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            if (isFileMode && !inputPath.endsWith(BifReader.BIF_EXTENSION)) {
                throw new IllegalArgumentException("Il file di input deve avere estensione .bif: " + inputPath);
            }

            EncoderOptions options = buildOptions(circuitType, flags, selectorType);
            return new EncoderConfiguration(inputPath, outputPath, isFileMode, circuitType, options,
                    false, null, null, 0, 0, 0, 0, null);
        }

        private EncoderOptions buildOptions(CircuitType circuitType, OptionFlags flags, SelectorVariableType selectorType) {
            try {
                return EncoderOptions.forCircuitType(circuitType)
                        .withDeterminism(flags.determinism)
                        .withContextSpecificIndependence(flags.contextSpecificIndependence)
                        .withSelectorType(selectorType);
            } catch (EncodingException e) {
                throw new IllegalArgumentException("Combinazione di opzioni non valida per " + circuitType.getLabel()
                        + ": " + e.getMessage(), e);
            }
        }

        private void validateExclusiveMode(boolean mode1, boolean mode2, String currentMode) {
            if (mode1 || mode2) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con altre modalità (file/directory/generazione sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parsePositiveInt(String[] args, int currentIndex, String argumentType) {
            String value = getNextArgument(args, currentIndex, argumentType);
            try {
                int parsed = Integer.parseInt(value);
                if (parsed <= 0) {
                    throw new IllegalArgumentException("Il valore di " + argumentType + " deve essere positivo: " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + argumentType + ": " + value);
            }
        }

        private Long parseSeed(String[] args, int currentIndex) {
            String value = getNextArgument(args, currentIndex, "seme");
            try {
                long parsed = Long.parseLong(value);
                if (parsed <= 0) {
                    throw new IllegalArgumentException("Il seme deve essere positivo: " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Seme non valido: " + value);
            }
        }

        /**
         * Converte i flag di -opt: d = determinismo, c = indipendenza contestuale, all = tutte.
         */
        private OptionFlags parseOptionFlags(String flagsStr) {
            if (flagsStr == null || flagsStr.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }

            if (flagsStr.equals(OPT_ALL)) {
                return new OptionFlags(true, true);
            }

            for (char flag : flagsStr.toCharArray()) {
                if (!OPT_DETERMINISM.equals(String.valueOf(flag)) && !OPT_CSI.equals(String.valueOf(flag))) {
                    throw new IllegalArgumentException("Flag -opt sconosciuto: " + flag);
                }
            }

            return new OptionFlags(flagsStr.contains(OPT_DETERMINISM), flagsStr.contains(OPT_CSI));
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
            if (!dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    /**
     * Flag di -opt letti dalla linea di comando.
     */
    private record OptionFlags(boolean determinism, boolean contextSpecificIndependence) {}

    /**
     * Risultato elaborazione batch con statistiche.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
