package org.flowcanvas.interchange.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.flowcanvas.interchange.bpmn.IdAllocator;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Random;

public class CodecConfigHelper {
    public static final String DEFAULT_CONFIG_RESOURCE = "bpmn-codec.json";

    public static CodecConfig loadConfig(String configFilePath) throws IOException {
        ObjectMapper mapper = new ObjectMapper();

        return mapper.readValue(new File(configFilePath), CodecConfig.class);
    }

    /**
     * Loads the defaults bundled on the classpath, or built-in defaults when the resource is absent.
     */
    public static CodecConfig loadDefaults() {
        try (InputStream in = CodecConfigHelper.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                return new CodecConfig();
            }
            return new ObjectMapper().readValue(in, CodecConfig.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    /**
     * Allocator for one editing session, seeded as configured.
     */
    public static IdAllocator newIdAllocator(CodecConfig config) {
        return config.idSeed == null ? new IdAllocator() : new IdAllocator(new Random(config.idSeed));
    }
}
