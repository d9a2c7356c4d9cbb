package com.nana.iep.app;

import com.nana.iep.repository.MasterTableRepository;
import com.nana.iep.repository.MasterTableRepository.RepositoryException;
import com.nana.iep.repository.SqliteMasterTableRepository;
import com.nana.iep.service.AuditPipeline;
import com.nana.iep.service.AuditRunService;
import com.nana.iep.service.AuditRunServiceImpl;
import com.nana.iep.service.ChangeSummary;
import com.nana.iep.service.ReconciliationException;
import com.nana.iep.util.AppLogger;
import com.nana.iep.util.AuditConfig;
import com.nana.iep.util.AuditReportWriter;
import com.nana.iep.util.CsvExtractReader;
import com.nana.iep.util.CsvExtractReader.ExtractReadResult;
import com.nana.iep.util.DatabaseManager;
import com.nana.iep.util.DatabaseManager.DatabaseInitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;

/**
 * IepAuditApp - Command-line entry point and composition root.
 *
 * <pre>
 *     iep-audit &lt;extract.csv&gt; [database-file]
 * </pre>
 *
 * <p>Runs one batch: read the extract, reconcile it into the stored master
 * table, save, and write {@code <extract>_audit_report.txt} next to the
 * extract. An exclusive lock on {@code <database>.lock} is held for the
 * whole run so two scheduled runs never interleave.
 *
 * <p>Exit codes: {@value #EXIT_OK} success, {@value #EXIT_FATAL} fatal
 * reconciliation or storage error, {@value #EXIT_USAGE} usage or I/O error,
 * {@value #EXIT_LOCKED} another run holds the lock.
 */
public class IepAuditApp {

    private static final Logger log = LoggerFactory.getLogger(IepAuditApp.class);

    public static final int EXIT_OK     = 0;
    public static final int EXIT_FATAL  = 1;
    public static final int EXIT_USAGE  = 2;
    public static final int EXIT_LOCKED = 3;

    private static final String USAGE = "Usage: iep-audit <extract.csv> [database-file]";

    private final AuditConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public IepAuditApp(AuditConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out    = out;
        this.err    = err;
    }

    // -----------------------------------------------------------------------
    // RUN
    // -----------------------------------------------------------------------

    /**
     * Runs one audit batch.
     *
     * @param args {@code <extract.csv> [database-file]}
     * @return the process exit code
     */
    public int run(String[] args) {
        if (args == null || args.length < 1 || args.length > 2 || args[0].isBlank()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path extract  = Paths.get(args[0]);
        Path database = args.length == 2 ? Paths.get(args[1]) : config.getDatabasePath();
        Path lockFile = database.resolveSibling(database.getFileName() + ".lock");

        try {
            Path lockDir = lockFile.toAbsolutePath().getParent();
            if (lockDir != null) {
                Files.createDirectories(lockDir);
            }
        } catch (IOException ex) {
            log.error("Cannot create directory for {}.", lockFile, ex);
            err.println("Cannot create store directory: " + ex.getMessage());
            return EXIT_USAGE;
        }

        try (FileChannel channel = FileChannel.open(lockFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {

            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException ex) {
                lock = null;
            }
            if (lock == null) {
                AppLogger.logWarningEvent("AUDIT_LOCK_HELD", "lock=" + lockFile);
                err.println("Another audit run holds " + lockFile + "; exiting.");
                return EXIT_LOCKED;
            }
            try {
                return runLocked(extract, database);
            } finally {
                lock.release();
            }

        } catch (IOException ex) {
            log.error("Failed to acquire lock file {}.", lockFile, ex);
            err.println("Cannot open lock file: " + ex.getMessage());
            return EXIT_USAGE;
        }
    }

    private int runLocked(Path extract, Path database) {
        ExtractReadResult read;
        try {
            read = CsvExtractReader.fromConfig(config).read(extract);
        } catch (IOException ex) {
            err.println("Cannot read extract: " + ex.getMessage());
            return EXIT_USAGE;
        }

        try (DatabaseManager db = new DatabaseManager(database)) {
            MasterTableRepository repository = new SqliteMasterTableRepository(db);
            AuditRunService service = new AuditRunServiceImpl(repository,
                    new AuditPipeline(config.toExtractFormat(), config.toReconcilePolicy()));

            ChangeSummary changes = service.runBatch(read.getRows(), read.getErrors());

            Path report = new AuditReportWriter(config.getTrackedGoals())
                    .write(extract, changes, service.currentTable());
            out.println(changes.getSummary());
            out.println("Report: " + report);
            return EXIT_OK;

        } catch (ReconciliationException ex) {
            AppLogger.logErrorEvent("AUDIT_RUN_FAILED", "extract=" + extract, ex);
            err.println("Reconciliation failed; nothing saved: " + ex.getMessage());
            return EXIT_FATAL;
        } catch (RepositoryException | DatabaseInitException ex) {
            AppLogger.logErrorEvent("AUDIT_STORE_FAILED", "database=" + database, ex);
            err.println("Store error: " + ex.getMessage());
            return EXIT_FATAL;
        } catch (IllegalArgumentException ex) {
            log.error("Invalid configuration.", ex);
            err.println("Invalid configuration: " + ex.getMessage());
            return EXIT_USAGE;
        } catch (IOException ex) {
            log.error("Failed to write the audit report.", ex);
            err.println("Cannot write report: " + ex.getMessage());
            return EXIT_USAGE;
        }
    }

    // -----------------------------------------------------------------------
    // MAIN METHOD
    // -----------------------------------------------------------------------

    public static void main(String[] args) {
        LocalDateTime startTime = LocalDateTime.now();
        AppLogger.setRunContext(AppLogger.generateRunId());
        AppLogger.logStartup();

        int exitCode;
        try {
            AuditConfig config = AuditConfig.load(AuditConfig.defaultUserFile());
            exitCode = new IepAuditApp(config, System.out, System.err).run(args);
        } finally {
            AppLogger.logShutdown(startTime);
            AppLogger.clearAllContext();
        }
        if (exitCode != EXIT_OK) {
            System.err.println("See log file: " + AppLogger.getLogFilePath());
        }
        System.exit(exitCode);
    }
}
