package com.libragraph.registry.core.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Parses asset definition files. {@code .yaml} and {@code .yml} are read as YAML,
 * everything else as JSON.
 */
@ApplicationScoped
public class AssetFileReader {

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public AssetDocument read(Path file) throws IOException {
        JsonNode payload = mapperFor(file).readTree(file.toFile());
        if (payload == null || payload.isMissingNode() || !payload.isObject()) {
            throw new IOException("Asset file does not contain an object: " + file);
        }
        return new AssetDocument(file, payload);
    }

    private ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper : jsonMapper;
    }
}
