package com.jreinhal.cafefinder.corpus;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.cafefinder.exception.CorpusLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads a JSON array of records from a Spring resource location on every call.
 *
 * A missing file is an empty corpus; a file that cannot be read or parsed is an error.
 */
public class JsonCorpusProvider<T> implements CorpusProvider<T> {
    private static final Logger log = LoggerFactory.getLogger(JsonCorpusProvider.class);

    private final ResourceLoader resourceLoader;
    private final String location;
    private final ObjectMapper objectMapper;
    private final JavaType listType;

    public JsonCorpusProvider(ResourceLoader resourceLoader, String location, ObjectMapper objectMapper, Class<T> elementType) {
        this.resourceLoader = resourceLoader;
        this.location = location;
        this.objectMapper = objectMapper;
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    @Override
    public List<T> listCurrent() {
        Resource resource = this.resourceLoader.getResource(this.location);
        if (!resource.exists()) {
            log.warn("Corpus file {} not found, treating category as empty", this.location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<T> records = this.objectMapper.readValue(in, this.listType);
            if (records == null) {
                return List.of();
            }
            List<T> loaded = records.stream().filter(Objects::nonNull).toList();
            if (log.isDebugEnabled()) {
                log.debug("Loaded {} records from {}", loaded.size(), this.location);
            }
            return loaded;
        }
        catch (IOException e) {
            throw new CorpusLoadException("Failed to load corpus file " + this.location, e);
        }
    }

    public String location() {
        return this.location;
    }
}
