package controlmap.domain.registry.impl;

import controlmap.domain.config.DataPaths;
import controlmap.domain.evidenceprocessing.EvidenceProcessingResult;
import controlmap.domain.exceptions.InternalFailure;
import controlmap.domain.json.JsonDeserializer;
import controlmap.domain.registry.EvidenceArtifactStore;
import controlmap.domain.registry.EvidenceRegistry;
import controlmap.domain.registry.EvidenceRegistryEntry;
import controlmap.domain.registry.EvidenceSummary;
import controlmap.domain.registry.StoredArtifact;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Stores one JSON document per line. Entries are only ever appended. Evidence that was processed
 * successfully is copied into the artifact store first, so the entry does not depend on the submitted file.
 */
@ApplicationScoped
public class JsonLinesEvidenceRegistry implements EvidenceRegistry {
    @Inject
    private DataPaths dataPaths;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private EvidenceArtifactStore artifactStore;

    @Inject
    private Logger logger;

    @Override
    public EvidenceRegistryEntry register(final EvidenceProcessingResult result, final double threshold) {
        final Instant timestamp = Instant.now();
        final Path source = Path.of(result.filePath());
        final StoredArtifact artifact = result.success() && Files.isRegularFile(source)
                ? artifactStore.store(source, timestamp)
                : artifactStore.reference(source);

        final EvidenceRegistryEntry entry = EvidenceRegistryEntry.fromResult(result, threshold, timestamp, artifact);
        final Path path = dataPaths.getEvidenceRegistry();

        Try.run(() -> {
                    if (path.toAbsolutePath().getParent() != null) {
                        Files.createDirectories(path.toAbsolutePath().getParent());
                    }
                    Files.writeString(
                            path,
                            jsonDeserializer.serialize(entry) + System.lineSeparator(),
                            StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE,
                            StandardOpenOption.APPEND);
                })
                .getOrElseThrow(ex -> new InternalFailure("Failed to append to evidence registry " + path, ex));

        logger.info("Registered evidence " + entry.fileName() + " for control " + entry.controlId());
        return entry;
    }

    @Override
    public List<EvidenceRegistryEntry> load() {
        final Path path = dataPaths.getEvidenceRegistry();
        if (!Files.isRegularFile(path)) {
            return List.of();
        }

        return Try.of(() -> Files.readAllLines(path, StandardCharsets.UTF_8))
                .getOrElseThrow(ex -> new InternalFailure("Failed to read evidence registry " + path, ex))
                .stream()
                .filter(StringUtils::isNotBlank)
                .map(line -> jsonDeserializer.deserialize(line, EvidenceRegistryEntry.class))
                .toList();
    }

    @Override
    public List<EvidenceRegistryEntry> findByControlId(final String controlId) {
        return load().stream()
                .filter(entry -> entry.controlId().equals(controlId))
                .toList();
    }

    @Override
    public EvidenceSummary summary() {
        final List<EvidenceRegistryEntry> entries = load();

        final int valid = (int) entries.stream().filter(EvidenceRegistryEntry::valid).count();
        final Map<String, Long> countPerControl = entries.stream()
                .collect(Collectors.groupingBy(EvidenceRegistryEntry::controlId, TreeMap::new, Collectors.counting()));
        final double averageConfidence = entries.stream()
                .mapToDouble(EvidenceRegistryEntry::confidence)
                .average()
                .orElse(0.0);

        return new EvidenceSummary(
                entries.size(),
                valid,
                entries.size() - valid,
                countPerControl.size(),
                averageConfidence,
                countPerControl);
    }
}
