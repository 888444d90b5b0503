package com.eyelevel.labmigrator.config;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app.migration" prefix. Every value can be overridden on the
 * command line, e.g. {@code --app.migration.cache.use-cache=true}.
 */
@Data
@ConfigurationProperties(prefix = "app.migration")
public class MigrationConfig {

    /**
     * First names or full names of the Labfolder authors to migrate. Empty means everyone.
     */
    private List<String> authors = new ArrayList<>();

    /**
     * Optional CSV with the columns {@code Project ID} and {@code ISA ID}.
     */
    private Path isaIdsFile;

    /**
     * Optional CSV with the columns {@code First Name}, {@code Last Name} and {@code User ID}.
     */
    private Path namelistFile;

    private Cache cache = new Cache();
    private Transform transform = new Transform();
    private Export export = new Export();

    /**
     * Bound to {@code app.migration.import}; {@code import} cannot be a field name.
     */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Import importing = new Import();

    public Import getImport() {
        return importing;
    }

    public void setImport(Import importSettings) {
        this.importing = importSettings;
    }

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Cache {
        /**
         * Cache file; no cache is written when unset.
         */
        private Path path;
        private CacheFormat format = CacheFormat.AUTO;
        /**
         * Read entries from {@link #path} instead of fetching them from Labfolder.
         */
        private boolean useCache;
    }

    public enum CacheFormat {
        AUTO, JSONL, CSV
    }

    @Data
    public static class Transform {
        /**
         * Rows of the first sheet rendered inline below a table or well plate link.
         */
        private int previewRows = 10;
    }

    @Data
    public static class Import {
        /**
         * eLabFTW experiment category id set on every created experiment; left unchanged when unset.
         */
        private Integer category;
        private int maxConcurrentGroups = 1;
        /**
         * Import ledger that remembers migrated projects across runs; disabled when unset.
         */
        private Path ledgerPath;
        private RetryConfig uploadRetry = new RetryConfig();
    }

    /**
     * Labfolder's server-side PDF and XHTML exports, attached to the experiments next to the migrated body.
     */
    @Data
    public static class Export {
        private Pdf pdf = new Pdf();
        private Xhtml xhtml = new Xhtml();
        /**
         * How often a running export is checked.
         */
        private long pollIntervalMs = 3000;
        /**
         * How long to wait for one export to finish.
         */
        private long timeoutMs = 1_800_000;
    }

    @Data
    public static class Pdf {
        /**
         * Attach a PDF export of every project to its experiment.
         */
        private boolean enabled;
        /**
         * Where project PDFs are kept as {@code <projectId>_<title>.pdf} and reused on the next run.
         */
        private Path cacheDir = Path.of("exports/pdf");
    }

    @Data
    public static class Xhtml {
        /**
         * Attach the project's {@code index.html} and spreadsheets from an XHTML export already present in
         * {@link #cacheDir}. No export is requested from Labfolder for this alone.
         */
        private boolean attachArtifacts;
        /**
         * Only import projects that the XHTML export contains; requests a new export when none is cached.
         */
        private boolean onlyProjectsFromXhtml;
        /**
         * Holds extracted exports ({@code labfolder_xhtml_<id>/}) and downloaded zips
         * ({@code labfolder_xhtml_<id>.zip}).
         */
        private Path cacheDir = Path.of("exports/xhtml");
    }
}
