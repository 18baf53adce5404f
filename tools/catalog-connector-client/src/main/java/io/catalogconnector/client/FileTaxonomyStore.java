package io.catalogconnector.client;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;

/**
 * Loads taxonomy files from the file system, falling back to the classpath, and compiles
 * the referenced definitions as draft-07 schemas. Compiled schemas are thread-safe and are
 * cached per reference.
 */
public class FileTaxonomyStore implements TaxonomyStore {

    private final ObjectMapper mapper;
    private final Logger log;
    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final Map<TaxonomyReference, JsonSchema> schemas = new ConcurrentHashMap<>();

    public FileTaxonomyStore() {
        this(new ObjectMapper());
    }

    public FileTaxonomyStore(ObjectMapper mapper) {
        this(mapper, LoggerFactory.getLogger(FileTaxonomyStore.class));
    }

    public FileTaxonomyStore(ObjectMapper mapper, Logger log) {
        this.mapper = mapper;
        this.log = log;
    }

    public JsonSchema resolve(TaxonomyReference reference) throws ConformanceException {
        JsonSchema schema = schemas.get(reference);
        if (schema == null) {
            schema = compile(reference);
            schemas.putIfAbsent(reference, schema);
        }
        return schema;
    }

    private JsonSchema compile(TaxonomyReference reference) throws ConformanceException {
        JsonNode taxonomy = load(reference);
        if (!taxonomy.isObject()) {
            throw new ConformanceException(ErrorKind.SCHEMA_RESOLUTION,
                "taxonomy " + reference.getFile() + " is not a JSON object");
        }
        if (taxonomy.at(reference.getPointer()).isMissingNode()) {
            throw new ConformanceException(ErrorKind.SCHEMA_RESOLUTION,
                "definition " + reference.getPointer() + " not found in " + reference.getFile());
        }
        // Keep the whole document so that local $refs between definitions still resolve.
        ObjectNode root = ((ObjectNode) taxonomy).deepCopy();
        root.remove("$id");
        root.remove("$schema");
        root.put("$ref", "#" + reference.getPointer());
        try {
            JsonSchema schema = factory.getSchema(root);
            // Validators, and with them $ref targets, are otherwise only built on first use.
            schema.initializeValidators();
            return schema;
        }
        catch (RuntimeException e) {
            throw new ConformanceException(ErrorKind.SCHEMA_RESOLUTION, "unable to compile " + reference, e);
        }
    }

    private JsonNode load(TaxonomyReference reference) throws ConformanceException {
        String file = reference.getFile();
        try {
            Path path = Paths.get(file);
            if (Files.isRegularFile(path)) {
                log.debug("Loading taxonomy {} from file system", file);
                return mapper.readTree(path.toFile());
            }
            try (InputStream in = classpathResource(file)) {
                if (in == null) {
                    throw new ConformanceException(ErrorKind.SCHEMA_RESOLUTION, "taxonomy " + file + " not found");
                }
                log.debug("Loading taxonomy {} from classpath", file);
                return mapper.readTree(in);
            }
        }
        catch (IOException e) {
            throw new ConformanceException(ErrorKind.SCHEMA_RESOLUTION, "unable to read taxonomy " + file, e);
        }
    }

    private static @Nullable InputStream classpathResource(String file) {
        String name = file.startsWith("/") ? file.substring(1) : file;
        return Thread.currentThread().getContextClassLoader().getResourceAsStream(name);
    }
}
