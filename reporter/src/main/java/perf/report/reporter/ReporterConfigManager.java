package perf.report.reporter;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import perf.report.common.exception.ConfigurationException;

import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Map configuration to {@link Configuration} and encapsulate default settings inside it.
 */
public class ReporterConfigManager {

    private static Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private static final ObjectMapper mapper = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static final String DEFAULT_CONFIG_RESOURCE = "reporter-config.json";

    public static Configuration loadConfig(String configFilePath) throws IOException {
        Preconditions.checkNotNull(configFilePath);
        return loadConfig(Files.asCharSource(new File(configFilePath), StandardCharsets.UTF_8).read(), configFilePath);
    }

    /**
     * Loads the configuration bundled with the reporter.
     */
    public static Configuration loadDefaultConfig() throws IOException {
        try (InputStream in = ReporterConfigManager.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                return validateConfig(new Configuration());
            }
            return loadConfig(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_CONFIG_RESOURCE);
        }
    }

    public static Configuration loadConfig(String json, String sourceName) {
        Preconditions.checkNotNull(json);
        Configuration config;
        try {
            config = mapper.readValue(json, Configuration.class);
        } catch (IOException e) {
            throw new ConfigurationException("Configuration " + sourceName + " is not valid json for the reporter: " + e.getMessage(), e);
        }
        return validateConfig(config);
    }

    public static <T> T validateConfig(T config) {
        Set<ConstraintViolation<T>> violations = validator.validate(config);
        if (violations.size() > 0) {
            String message = "Configuration is invalid:\n" +
                String.join("\n",
                    violations.stream().map(v -> v.getPropertyPath().toString() + " " + v.getMessage()).sorted().collect(Collectors.toList()));
            throw new ConfigurationException(message);
        }
        return config;
    }
}
