package com.logq.config;

import com.logq.query.OperandPresence;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for a {@link com.logq.LogDatabase}.
 * <p>
 * Each value is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dlogq.logFile=/path/data.log})</li>
 *   <li>Environment variables (e.g., {@code LOGQ_LOG_FILE})</li>
 *   <li>Properties file ({@code logq.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>logFile</td><td>logq.logFile</td><td>LOGQ_LOG_FILE</td><td>data.log</td></tr>
 *   <tr><td>textSearchFields</td><td>logq.textSearchFields</td><td>LOGQ_TEXT_SEARCH_FIELDS</td><td>(none)</td></tr>
 *   <tr><td>operandPresence</td><td>logq.operandPresence</td><td>LOGQ_OPERAND_PRESENCE</td><td>TRUTHY</td></tr>
 * </table>
 * <p>
 * {@code textSearchFields} is a comma separated list of field names.
 */
public final class LogQConfig {
    private static final Logger LOG = LoggerFactory.getLogger(LogQConfig.class);

    private static final String PROPERTIES_FILE = "logq.properties";

    private static final String PROP_LOG_FILE = "logq.logFile";
    private static final String PROP_TEXT_SEARCH_FIELDS = "logq.textSearchFields";
    private static final String PROP_OPERAND_PRESENCE = "logq.operandPresence";

    private static final String ENV_LOG_FILE = "LOGQ_LOG_FILE";
    private static final String ENV_TEXT_SEARCH_FIELDS = "LOGQ_TEXT_SEARCH_FIELDS";
    private static final String ENV_OPERAND_PRESENCE = "LOGQ_OPERAND_PRESENCE";

    private static final Path DEFAULT_LOG_FILE = Path.of("data.log");
    private static final OperandPresence DEFAULT_OPERAND_PRESENCE = OperandPresence.TRUTHY;

    private final Path logFile;
    private final ImmutableList<String> textSearchFields;
    private final OperandPresence operandPresence;

    private LogQConfig(Builder builder) {
        this.logFile = builder.logFile;
        this.textSearchFields = builder.textSearchFields;
        this.operandPresence = builder.operandPresence;
    }

    /** The document log queried by every call. */
    public Path logFile() {
        return logFile;
    }

    /** Fields searched by {@code $text} filters. */
    public ImmutableList<String> textSearchFields() {
        return textSearchFields;
    }

    public OperandPresence operandPresence() {
        return operandPresence;
    }

    @Override
    public String toString() {
        return "LogQConfig{" +
                "logFile=" + logFile +
                ", textSearchFields=" + textSearchFields +
                ", operandPresence=" + operandPresence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for {@code LogQConfig.builder().build()}. */
    public static LogQConfig load() {
        return builder().build();
    }

    public static final class Builder {
        private Path logFile;
        private ImmutableList<String> textSearchFields;
        private OperandPresence operandPresence;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder logFile(Path logFile) {
            this.logFile = logFile;
            return this;
        }

        public Builder logFile(String logFile) {
            this.logFile = Path.of(logFile);
            return this;
        }

        public Builder textSearchFields(Iterable<String> fields) {
            this.textSearchFields = Lists.immutable.ofAll(fields);
            return this;
        }

        public Builder textSearchFields(String... fields) {
            this.textSearchFields = Lists.immutable.of(fields);
            return this;
        }

        public Builder operandPresence(OperandPresence operandPresence) {
            this.operandPresence = operandPresence;
            return this;
        }

        public LogQConfig build() {
            if (logFile == null) {
                String value = resolve(PROP_LOG_FILE, ENV_LOG_FILE);
                logFile = value != null ? Path.of(value) : DEFAULT_LOG_FILE;
            }
            if (textSearchFields == null) {
                textSearchFields = parseFieldList(resolve(PROP_TEXT_SEARCH_FIELDS, ENV_TEXT_SEARCH_FIELDS));
            }
            if (operandPresence == null) {
                operandPresence = parseOperandPresence(resolve(PROP_OPERAND_PRESENCE, ENV_OPERAND_PRESENCE));
            }
            return new LogQConfig(this);
        }

        // system property, then environment variable, then properties file
        private String resolve(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return null;
        }

        private static ImmutableList<String> parseFieldList(String value) {
            if (value == null) {
                return Lists.immutable.empty();
            }
            return Lists.immutable.of(value.split(","))
                    .collect(String::trim)
                    .reject(String::isEmpty);
        }

        private static OperandPresence parseOperandPresence(String value) {
            if (value == null) {
                return DEFAULT_OPERAND_PRESENCE;
            }
            try {
                return OperandPresence.valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring unknown operandPresence '{}', using {}", value, DEFAULT_OPERAND_PRESENCE);
                return DEFAULT_OPERAND_PRESENCE;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            try (InputStream is = LogQConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
