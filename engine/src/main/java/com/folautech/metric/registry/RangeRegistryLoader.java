package com.folautech.metric.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.folautech.metric.exception.RegistryIntegrityException;
import com.folautech.metric.model.MetricKind;
import com.folautech.metric.model.Range;
import com.folautech.metric.model.ReferenceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds a {@link RangeRegistry} from a JSON array of {@link RangeRecord} rows.
 */
public class RangeRegistryLoader {

    private static final Logger logger = LoggerFactory.getLogger(RangeRegistryLoader.class);

    private static final TypeReference<List<RangeRecord>> RECORDS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RangeRegistryLoader() {
        this(new ObjectMapper());
    }

    public RangeRegistryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public RangeRegistry loadClasspath(String resource) {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = RangeRegistryLoader.class.getClassLoader();
        }
        InputStream in = classLoader.getResourceAsStream(name);
        if (in == null) {
            throw new RegistryIntegrityException("Reference range table not found on classpath: " + resource);
        }
        return load(in, "classpath:" + name);
    }

    public RangeRegistry loadFile(Path path) {
        try {
            return load(Files.newInputStream(path), path.toString());
        } catch (IOException e) {
            throw new RegistryIntegrityException("Cannot open reference range table " + path, e);
        }
    }

    /**
     * Read and validate a reference range table. The stream is closed.
     * @param in JSON array of range records
     * @param source description of the table used in log and error messages
     * @return validated registry
     */
    public RangeRegistry load(InputStream in, String source) {
        List<RangeRecord> records;
        try (InputStream input = in) {
            records = objectMapper.readValue(input, RECORDS);
        } catch (JsonProcessingException e) {
            throw new RegistryIntegrityException("Malformed reference range table " + source + ": "
                + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RegistryIntegrityException("Cannot read reference range table " + source, e);
        }
        if (records == null) {
            throw new RegistryIntegrityException("Reference range table " + source + " is empty");
        }
        logger.info("Loading {} reference ranges from {}", records.size(), source);
        return fromRecords(records);
    }

    public RangeRegistry fromRecords(List<RangeRecord> records) {
        RangeRegistry.Builder builder = RangeRegistry.builder();
        for (int i = 0; i < records.size(); i++) {
            RangeRecord record = records.get(i);
            if (record == null) {
                throw new RegistryIntegrityException("Reference range row " + i + " is null");
            }
            builder.put(toKind(record, i), toReferenceRange(record));
        }
        return builder.build();
    }

    private MetricKind toKind(RangeRecord record, int row) {
        return MetricKind.fromName(record.getKind())
            .orElseThrow(() -> new RegistryIntegrityException(
                "Unknown metric kind '" + record.getKind() + "' in reference range row " + row));
    }

    private ReferenceRange toReferenceRange(RangeRecord record) {
        if (record.getNormalMin() == null || record.getNormalMax() == null) {
            throw new RegistryIntegrityException("normalMin and normalMax are required for " + record.getKind());
        }
        Range normal = Range.of(record.getNormalMin(), record.getNormalMax());

        boolean hasCriticalMin = record.getCriticalMin() != null;
        boolean hasCriticalMax = record.getCriticalMax() != null;
        if (hasCriticalMin != hasCriticalMax) {
            throw new RegistryIntegrityException(
                "criticalMin and criticalMax must be given together for " + record.getKind());
        }
        if (!hasCriticalMin) {
            return ReferenceRange.of(normal);
        }
        return ReferenceRange.of(normal, Range.of(record.getCriticalMin(), record.getCriticalMax()));
    }
}
