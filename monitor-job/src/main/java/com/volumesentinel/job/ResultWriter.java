package com.volumesentinel.job;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.volumesentinel.core.model.MonitoringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link MonitoringResult} as one pretty-printed JSON document with
 * ISO-8601 dates.
 */
public class ResultWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);

    private final ObjectMapper mapper;

    public ResultWriter() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * @param result the run output
     * @param path   destination file; parent directories are created
     * @throws IOException if the file cannot be written
     */
    public void write(MonitoringResult result, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(path.toFile(), result);
        LOG.info("Wrote {} alert(s) and {} threshold record(s) to {}",
                result.getAlertCount(), result.getThresholds().size(), path);
    }

    /**
     * Write to a stream the caller owns; the stream is left open.
     */
    public void write(MonitoringResult result, OutputStream out) throws IOException {
        mapper.writer()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, result);
        out.flush();
    }

    public String toJson(MonitoringResult result) throws IOException {
        return mapper.writeValueAsString(result);
    }
}
