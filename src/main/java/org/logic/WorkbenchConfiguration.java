package org.logic;

import org.logic.parser.GrammarMode;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Configurazione validata di un'esecuzione da linea di comando, in forma immutabile.
 */
public final class WorkbenchConfiguration {

    public static final int DEFAULT_TIMEOUT_SECONDS = 10;
    public static final int MIN_TIMEOUT_SECONDS = 1;

    /**
     * Operazione eseguita su ogni elemento dell'input.
     */
    public enum Mode {
        WFF, CNF, HORN, RULE, PROOF;

        /**
         * @throws IllegalArgumentException se il nome non corrisponde a nessuna modalità
         */
        public static Mode fromName(String name) {
            if (name == null) {
                throw new IllegalArgumentException("Modalità mancante");
            }
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Modalità non supportata: " + name +
                        ". Supportate: wff, cnf, horn, rule, proof", e);
            }
        }
    }

    private final Mode mode;
    private final Path inputPath;
    private final Path outputPath;
    private final boolean fileMode;
    private final GrammarMode grammarMode;
    private final int timeoutSeconds;

    public WorkbenchConfiguration(Mode mode, Path inputPath, Path outputPath, boolean fileMode,
                                  GrammarMode grammarMode, int timeoutSeconds) {
        if (mode == null || inputPath == null || grammarMode == null) {
            throw new IllegalArgumentException("Modalità, input e grammatica sono obbligatori");
        }
        if (timeoutSeconds < MIN_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
        }
        this.mode = mode;
        this.inputPath = inputPath;
        this.outputPath = outputPath;
        this.fileMode = fileMode;
        this.grammarMode = grammarMode;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Configurazione di un singolo file di un batch, con gli stessi parametri.
     */
    public WorkbenchConfiguration forFile(Path file) {
        return new WorkbenchConfiguration(mode, file, outputPath, true, grammarMode, timeoutSeconds);
    }

    public Mode getMode() {
        return mode;
    }

    public Path getInputPath() {
        return inputPath;
    }

    /**
     * @return directory di output, null se i risultati vanno solo su console
     */
    public Path getOutputPath() {
        return outputPath;
    }

    public boolean isFileMode() {
        return fileMode;
    }

    public GrammarMode getGrammarMode() {
        return grammarMode;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    @Override
    public String toString() {
        return "WorkbenchConfiguration{" + mode + ", " + (fileMode ? "file " : "directory ") + inputPath +
                ", grammatica=" + grammarMode + ", timeout=" + timeoutSeconds + "s" +
                (outputPath != null ? ", output=" + outputPath : "") + "}";
    }
}
