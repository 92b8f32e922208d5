package com.hyperunmix.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class UnmixConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(UnmixConfigLoader.class);

    public static final String CONFIG_PROPERTY = "unmix.config";
    public static final String DEFAULT_RESOURCE = "/unmix_config.json";

    /**
     * Loads the configuration from the file named by the {@code unmix.config} system property, else from
     * the classpath resource, else returns defaults.
     */
    public static UnmixConfig.ConfigRoot load() {
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            File file = new File(sysProp);
            try {
                return fillDefaults(mapper().readValue(file, UnmixConfig.ConfigRoot.class));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read unmixing config from " + file.getAbsolutePath(), e);
            }
        }

        try (InputStream is = UnmixConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is != null) {
                return load(is);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }

        logger.warn("No {} on classpath, using built-in defaults", DEFAULT_RESOURCE);
        return new UnmixConfig.ConfigRoot();
    }

    public static UnmixConfig.ConfigRoot load(InputStream jsonStream) throws IOException {
        return fillDefaults(mapper().readValue(jsonStream, UnmixConfig.ConfigRoot.class));
    }

    private static ObjectMapper mapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // Sections explicitly set to null in the file
    private static UnmixConfig.ConfigRoot fillDefaults(UnmixConfig.ConfigRoot config) {
        if (config.mnf == null)
            config.mnf = new UnmixConfig.MnfConfig();
        if (config.ppi == null)
            config.ppi = new UnmixConfig.PpiConfig();
        if (config.endmembers == null)
            config.endmembers = new UnmixConfig.EndmemberConfig();
        if (config.abundance == null)
            config.abundance = new UnmixConfig.AbundanceConfig();
        if (config.worker == null)
            config.worker = new UnmixConfig.WorkerConfig();
        logger.info("Unmixing config loaded: backend={}, ppi.iterations={}, endmembers.count={}", config.backend,
                config.ppi.iterationsOrDefault(), config.endmembers.countOrDefault());
        return config;
    }
}
