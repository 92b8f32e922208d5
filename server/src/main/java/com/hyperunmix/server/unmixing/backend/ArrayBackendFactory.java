package com.hyperunmix.server.unmixing.backend;

import com.hyperunmix.server.config.UnmixConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ArrayBackendFactory {

    private static final Logger logger = LoggerFactory.getLogger(ArrayBackendFactory.class);

    public static ArrayBackend create(UnmixConfig.ConfigRoot config) {
        String name = (config != null) ? config.backend : null;
        return create(name);
    }

    public static ArrayBackend create(String name) {
        if (name == null || name.trim().isEmpty()) {
            return new CpuArrayBackend();
        }

        switch (name.trim().toLowerCase()) {
            case CpuArrayBackend.NAME:
                return new CpuArrayBackend();
            case ParallelArrayBackend.NAME:
                return new ParallelArrayBackend();
            default:
                logger.warn("Unknown array backend '{}', defaulting to '{}'", name, CpuArrayBackend.NAME);
                return new CpuArrayBackend();
        }
    }
}
