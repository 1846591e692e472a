package org.tablesmith.options;

/**
 * Defines configuration option constants used throughout Tablesmith.
 * The CLI and the configuration loader share these keys so values resolve the same way everywhere.
 */
public final class TablesmithOptions {

    private TablesmithOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "TABLESMITH_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "tablesmith.yaml";
    }

    /**
     * Naming-related settings.
     */
    public static final class Naming {
        private Naming() {}

        /**
         * Maximum length for generated constraint/trigger names.
         * Default: 30 (Oracle 12.1 identifier limit)
         */
        public static final String MAX_LENGTH_KEY = "tablesmith.naming.maxLength";
        public static final int MAX_LENGTH_DEFAULT = 30;
    }

    /**
     * Script layout settings.
     */
    public static final class Format {
        private Format() {}

        public static final String INDENT_SIZE_KEY = "tablesmith.format.indentSize";
        public static final int INDENT_SIZE_DEFAULT = 4;

        public static final String INCLUDE_TIMESTAMPS_KEY = "tablesmith.format.includeTimestamps";
        public static final boolean INCLUDE_TIMESTAMPS_DEFAULT = true;

        /**
         * Width column names are padded to inside CREATE TABLE.
         */
        public static final int COLUMN_PAD_WIDTH = 30;
    }

    /**
     * Output layout settings.
     */
    public static final class Output {
        private Output() {}

        public static final String DIRECTORY_KEY = "tablesmith.output.directory";
        public static final String DIRECTORY_DEFAULT = "build/tablesmith";

        /**
         * Folder placed between the project folder and the artifact category.
         */
        public static final String DATABASE_FOLDER = "database";
    }

    /**
     * Header metadata settings.
     */
    public static final class Metadata {
        private Metadata() {}

        public static final String AUTHOR_KEY = "tablesmith.metadata.author";
        public static final String LICENSE_KEY = "tablesmith.metadata.license";
    }

    /**
     * Seed data settings.
     */
    public static final class Data {
        private Data() {}

        /**
         * Rows emitted per table. Foreign key values wrap around this count.
         */
        public static final int ROW_COUNT = 22;
    }
}
