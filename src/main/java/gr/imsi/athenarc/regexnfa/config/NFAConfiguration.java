package gr.imsi.athenarc.regexnfa.config;

import java.util.Properties;

import gr.imsi.athenarc.regexnfa.describe.NFADescriber;

/**
 * Settings read from {@code application.properties}. Missing keys fall back to the builder defaults.
 */
public class NFAConfiguration {
    public static final String STORE_FILE_KEY = "nfa.store.file";
    public static final String SUITE_PARALLEL_KEY = "nfa.suite.parallel";
    public static final String EPSILON_LABEL_KEY = "nfa.describe.epsilonLabel";

    private final String storeFile;
    private final boolean parallelSuite;
    private final String epsilonLabel;

    private NFAConfiguration(Builder builder) {
        this.storeFile = builder.storeFile;
        this.parallelSuite = builder.parallelSuite;
        this.epsilonLabel = builder.epsilonLabel;
    }

    public String getStoreFile() {
        return storeFile;
    }

    public boolean isParallelSuite() {
        return parallelSuite;
    }

    public String getEpsilonLabel() {
        return epsilonLabel;
    }

    public static NFAConfiguration defaults() {
        return new Builder().build();
    }

    public static NFAConfiguration fromProperties(Properties properties) {
        Builder builder = new Builder();
        if (properties == null) {
            return builder.build();
        }
        if (properties.getProperty(STORE_FILE_KEY) != null) {
            builder.storeFile(properties.getProperty(STORE_FILE_KEY).trim());
        }
        if (properties.getProperty(SUITE_PARALLEL_KEY) != null) {
            builder.parallelSuite(Boolean.parseBoolean(properties.getProperty(SUITE_PARALLEL_KEY).trim()));
        }
        if (properties.getProperty(EPSILON_LABEL_KEY) != null) {
            builder.epsilonLabel(properties.getProperty(EPSILON_LABEL_KEY).trim());
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "NFAConfiguration{storeFile='" + storeFile + "', parallelSuite=" + parallelSuite
            + ", epsilonLabel='" + epsilonLabel + "'}";
    }

    public static class Builder {
        private String storeFile = "nfa_data.json";
        private boolean parallelSuite = false;
        private String epsilonLabel = NFADescriber.DEFAULT_EPSILON_LABEL;

        public Builder storeFile(String storeFile) {
            this.storeFile = storeFile;
            return this;
        }

        public Builder parallelSuite(boolean parallelSuite) {
            this.parallelSuite = parallelSuite;
            return this;
        }

        public Builder epsilonLabel(String epsilonLabel) {
            this.epsilonLabel = epsilonLabel;
            return this;
        }

        public NFAConfiguration build() {
            if (storeFile == null || storeFile.isEmpty()) {
                throw new IllegalArgumentException("Store file must be set");
            }
            if (epsilonLabel == null || epsilonLabel.isEmpty()) {
                throw new IllegalArgumentException("Epsilon label must be set");
            }
            return new NFAConfiguration(this);
        }
    }
}
