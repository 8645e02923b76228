package org.arcx.options;

/**
 * Defines configuration option constants used throughout arcx.
 * The CLI and the configuration loader share the same keys.
 */
public final class ArcxOptions {

    private ArcxOptions() {
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
        public static final String ENV_VAR = "ARCX_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "arcx.yaml";
    }

    /**
     * Naming-related settings.
     */
    public static final class Naming {
        private Naming() {}

        /**
         * Maximum length for generated constraint/index/trigger names.
         * Default: 30
         */
        public static final String MAX_LENGTH_KEY = "arcx.naming.maxLength";
        public static final int MAX_LENGTH_DEFAULT = 30;
    }

    public static final class Database {
        private Database() {}

        public static final String DIALECT_KEY = "arcx.database.dialect";
        public static final String DIALECT_DEFAULT = "mysql";
    }

    public static final class Output {
        private Output() {}

        public static final String DIRECTORY_KEY = "arcx.output.directory";
        public static final String DIRECTORY_DEFAULT = "build/arcx";
    }
}
