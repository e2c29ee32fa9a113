package org.logic;

import org.logic.WorkbenchConfiguration.Mode;
import org.logic.parser.GrammarMode;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * BANCO LOGICO - Driver da linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file di testo con formule, formule di Horn, casi di regola o prove
 * 2. SUDDIVISIONE: un elemento per riga, per blocco o per file a seconda della modalità
 * 3. ELABORAZIONE: {@link Workbench} con timeout per file
 * 4. OUTPUT: una riga di risultato per elemento su console, e opzionalmente su file
 *
 * MODALITÀ OPERATIVE (-m):
 * - wff: verifica di ben formazione
 * - cnf: conversione in Forma Normale Congiuntiva
 * - horn: soddisfacibilità del frammento di Horn
 * - rule: applicazione di regole singole di deduzione naturale
 * - proof: validazione di prove di deduzione naturale
 *
 * ORGANIZZAZIONE DEGLI OUTPUT (-o):
 * - RESULT/: un file .result per ogni file di input
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    static final String HELP_PARAM = "-h";
    static final String MODE_PARAM = "-m";
    static final String FILE_PARAM = "-f";
    static final String DIR_PARAM = "-d";
    static final String GRAMMAR_PARAM = "-g";
    static final String OUTPUT_PARAM = "-o";
    static final String TIMEOUT_PARAM = "-t";

    private static final String RESULT_DIR = "RESULT";
    private static final String RESULT_EXTENSION = ".result";
    private static final String LOGGING_CONFIG = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del banco logico.
     *
     * FLUSSO ESECUZIONE:
     * 1. Configurazione del logging da classpath
     * 2. Parsing e validazione parametri
     * 3. Elaborazione del file singolo o della directory
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO BANCO LOGICO <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            WorkbenchConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            if (config.isFileMode()) {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(config);
            } else {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }

        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            System.exit(1);
        } finally {
            System.out.println("---> FINE ESECUZIONE BANCO LOGICO <---");
        }
    }

    /**
     * Carica la configurazione di java.util.logging dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @return configurazione validata o null se help/errore
     */
    private static WorkbenchConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(WorkbenchConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE BANCO LOGICO <<--");
        System.out.println("Operazione: " + config.getMode().name().toLowerCase());
        System.out.println("Input: " + config.getInputPath() + (config.isFileMode() ? " (file)" : " (directory)"));
        System.out.println("Grammatica: " + config.getGrammarMode().name().toLowerCase());
        System.out.println("Timeout: " + config.getTimeoutSeconds() + " secondi");
        System.out.println("Output: " + (config.getOutputPath() != null ? config.getOutputPath() : "Solo console"));
        System.out.println("====================================\n");
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Elabora un file: lettura, elaborazione con timeout, stampa e salvataggio dei risultati.
     *
     * @return true se il file è stato elaborato entro il timeout
     */
    private static boolean processSingleFile(WorkbenchConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + config.getInputPath().getFileName());
        System.out.println("=========================\n");

        try {
            String content = Files.readString(config.getInputPath(), StandardCharsets.UTF_8);
            List<String> results = executeWithTimeout(content, config);

            if (results == null) {
                System.out.println("[W] Superato il timeout con limite di " + config.getTimeoutSeconds() + " secondi");
                return false;
            }

            results.forEach(System.out::println);
            if (config.getOutputPath() != null) {
                saveResults(results, config);
            }
            return true;

        } catch (IOException e) {
            System.out.println("[E] Errore elaborazione del file '" + config.getInputPath() + "': " + e.getMessage());
            return false;
        }
    }

    /**
     * Esegue l'elaborazione su un thread dedicato, interrotto allo scadere del timeout.
     *
     * @return righe di risultato o null se timeout
     */
    private static List<String> executeWithTimeout(String content, WorkbenchConfiguration config) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Workbench workbench = new Workbench(config.getGrammarMode());

        try {
            Callable<List<String>> task = () -> workbench.process(config.getMode(), content);
            Future<List<String>> future = executor.submit(task);
            return future.get(config.getTimeoutSeconds(), TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            LOGGER.warning("Timeout dopo " + config.getTimeoutSeconds() + " secondi su " + config.getInputPath());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Elaborazione interrotta", e);
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Errore durante l'elaborazione di " + config.getInputPath(), e);
            throw new IllegalStateException("Errore nell'elaborazione del file", e);
        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static void processDirectoryBatch(WorkbenchConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.getInputPath());

        try {
            List<Path> txtFiles = findAllTxtFiles(config.getInputPath());
            if (txtFiles.isEmpty()) {
                System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
                return;
            }

            BatchResult batchResult = new BatchResult(txtFiles.size());
            for (Path file : txtFiles) {
                try {
                    System.out.println("Elaborazione: " + file.getFileName());
                    if (processSingleFile(config.forFile(file))) {
                        batchResult.incrementSuccess();
                    } else {
                        batchResult.incrementError();
                    }
                } catch (IllegalStateException e) {
                    System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                    batchResult.incrementError();
                }
                System.out.println();
            }
            displayBatchSummary(batchResult);

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    /**
     * @return file .txt della directory, in ordine di nome
     */
    static List<Path> findAllTxtFiles(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase().endsWith(".txt"))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File elaborati trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%\n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT

    /**
     * Scrive i risultati in &lt;output&gt;/RESULT/&lt;nome&gt;.result, una riga per elemento.
     */
    private static void saveResults(List<String> results, WorkbenchConfiguration config) throws IOException {
        Path resultDir = config.getOutputPath().resolve(RESULT_DIR);
        Files.createDirectories(resultDir);

        Path resultFile = resultDir.resolve(getBaseFileName(config.getInputPath()) + RESULT_EXTENSION);
        try (FileWriter writer = new FileWriter(resultFile.toFile(), StandardCharsets.UTF_8)) {
            for (String line : results) {
                writer.write(line);
                writer.write(System.lineSeparator());
            }
        }

        System.out.println("[I] Risultati salvati: " + resultFile);
    }

    static String getBaseFileName(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> BANCO LOGICO <<::");
        System.out.println("Formule proposizionali, CNF, Horn-SAT e deduzione naturale\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar banco-logico.jar -m <modalità> (-f <file> | -d <directory>) [opzioni]\n");

        System.out.println("PARAMETRI:");
        System.out.println("  -m <modalità>    wff | cnf | horn | rule | proof (obbligatorio)");
        System.out.println("  -f <file>        Elabora un singolo file");
        System.out.println("  -d <directory>   Elabora tutti i file .txt in una directory");
        System.out.println("  -g <grammatica>  precedence (default) | strict");
        System.out.println("  -t <secondi>     Timeout per file (default: " +
                WorkbenchConfiguration.DEFAULT_TIMEOUT_SECONDS + ", minimo: " +
                WorkbenchConfiguration.MIN_TIMEOUT_SECONDS + ")");
        System.out.println("  -o <directory>   Salva i risultati in <directory>/RESULT");
        System.out.println("  -h               Mostra questo help\n");

        System.out.println("FORMATO INPUT:");
        System.out.println("  wff, cnf, horn   Una formula per riga");
        System.out.println("  rule             Casi separati da righe vuote: righe 'N    formula', poi 'Regola, n, m'");
        System.out.println("  proof            Una prova per file: 'N  formula  Regola, ref', BeginScope, EndScope\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO

    /**
     * Parser dei parametri linea di comando.
     */
    static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -m <modalità>: Operazione da eseguire
         * -f <file>: Input file singolo (esclusivo con -d)
         * -d <dir>: Input directory per batch (esclusivo con -f)
         * -g <grammatica>: Modalità grammaticale del parser
         * -o <dir>: Directory output
         * -t <sec>: Timeout in secondi per file
         *
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        WorkbenchConfiguration parse(String[] args) {
            Mode mode = null;
            Path inputPath = null;
            Path outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            GrammarMode grammarMode = GrammarMode.PRECEDENCE;
            int timeoutSeconds = WorkbenchConfiguration.DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case MODE_PARAM -> mode = Mode.fromName(getNextArgument(args, ++i, "modalità"));
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = Paths.get(getNextArgument(args, ++i, "file"));
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = Paths.get(getNextArgument(args, ++i, "directory"));
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case GRAMMAR_PARAM -> grammarMode = GrammarMode.fromName(getNextArgument(args, ++i, "grammatica"));
                    case OUTPUT_PARAM -> {
                        outputPath = Paths.get(getNextArgument(args, ++i, "directory output"));
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare la modalità con -m (wff, cnf, horn, rule, proof)");
            }
            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new WorkbenchConfiguration(mode, inputPath, outputPath, isFileMode, grammarMode, timeoutSeconds);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con l'altra (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            int timeout;
            try {
                timeout = Integer.parseInt(timeoutStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
            if (timeout < WorkbenchConfiguration.MIN_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Timeout minimo: " +
                        WorkbenchConfiguration.MIN_TIMEOUT_SECONDS + " secondi");
            }
            return timeout;
        }

        private void validateFileExists(Path filePath) {
            File file = filePath.toFile();
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

        private void validateDirectoryExists(Path dirPath) {
            File dir = dirPath.toFile();
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

        private void validateOrCreateOutputDirectory(Path dirPath) {
            File dir = dirPath.toFile();
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

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
