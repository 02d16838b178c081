package com.volumesentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.volumesentinel.core.model.VolumeObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads weekly observations from a JSON array of
 * {@code {systemId, messageType, weekStartDate, volume}} objects.
 *
 * <p>
 * Malformed rows (missing keys, negative volume, week not starting on the
 * canonical weekday) are logged and dropped, so a single bad row never fails
 * the run and never reaches the detection engine.
 * </p>
 */
public class ObservationReader {

    private static final Logger LOG = LoggerFactory.getLogger(ObservationReader.class);

    private static final List<String> REQUIRED_FIELDS = List.of("systemId", "messageType", "weekStartDate", "volume");

    private final ObjectMapper mapper;

    public ObservationReader() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param path JSON file holding the observation array
     * @return the accepted rows, in file order
     * @throws IOException if the file cannot be read or is not a JSON array
     */
    public List<VolumeObservation> read(Path path) throws IOException {
        LOG.info("Reading observations from {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    public List<VolumeObservation> read(InputStream is) throws IOException {
        JsonNode root = mapper.readTree(is);
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of observations");
        }

        List<VolumeObservation> accepted = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            parse(node, index++).ifPresent(accepted::add);
        }
        int rejected = root.size() - accepted.size();
        if (rejected > 0) {
            LOG.warn("Rejected {} of {} observation row(s)", rejected, root.size());
        }
        LOG.info("Accepted {} observation(s)", accepted.size());
        return accepted;
    }

    private Optional<VolumeObservation> parse(JsonNode node, int index) {
        for (String field : REQUIRED_FIELDS) {
            if (!node.hasNonNull(field)) {
                LOG.warn("Row {} missing '{}' - skipping", index, field);
                return Optional.empty();
            }
        }
        try {
            VolumeObservation observation = mapper.treeToValue(node, VolumeObservation.class);
            if (!observation.isCanonicalWeek()) {
                LOG.warn("Row {} week {} does not start on {} - skipping", index,
                        observation.getWeekStartDate(), VolumeObservation.CANONICAL_WEEKDAY);
                return Optional.empty();
            }
            return Optional.of(observation);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warn("Row {} is malformed - skipping: {}", index, e.getMessage());
            return Optional.empty();
        }
    }
}
