package controlmap.domain.persist;

import controlmap.domain.exceptionhandling.LoggingExceptionHandler;
import controlmap.domain.exceptions.VectorStoreFailure;
import controlmap.domain.logger.Loggers;
import controlmap.domain.vector.Vector;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(FileVectorStore.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
class FileVectorStoreTest {

    @Inject
    private VectorStore vectorStore;

    @TempDir
    Path tempDir;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of(),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    void testWriteAndRead() {
        final Path store = tempDir.resolve("embeddings/controls.vec");
        final List<Vector> vectors = List.of(new Vector(1f, 2f, 3f), new Vector(-1f, 0.5f, 0f));

        vectorStore.write(store, vectors);

        assertEquals(Optional.of(2), vectorStore.rowCount(store));
        assertEquals(vectors, vectorStore.read(store));
    }

    @Test
    void testOverwriteLeavesNoTemporaryFiles() throws Exception {
        final Path store = tempDir.resolve("controls.vec");

        vectorStore.write(store, List.of(new Vector(1f), new Vector(2f)));
        vectorStore.write(store, List.of(new Vector(3f)));

        assertEquals(List.of(new Vector(3f)), vectorStore.read(store));
        try (var files = Files.list(tempDir)) {
            assertEquals(List.of(store), files.toList());
        }
    }

    @Test
    void testFailedMoveLeavesNoTemporaryFiles() throws Exception {
        // a non-empty directory at the target path cannot be replaced by a file
        final Path store = tempDir.resolve("controls.vec");
        Files.createDirectories(store);
        Files.writeString(store.resolve("keep.txt"), "keep");

        assertThrows(VectorStoreFailure.class, () -> vectorStore.write(store, List.of(new Vector(1f))));

        try (var files = Files.list(tempDir)) {
            assertEquals(List.of(store), files.toList());
        }
        assertTrue(Files.isRegularFile(store.resolve("keep.txt")));
    }

    @Test
    void testEmptyStore() {
        final Path store = tempDir.resolve("empty.vec");

        vectorStore.write(store, List.of());

        assertEquals(Optional.of(0), vectorStore.rowCount(store));
        assertTrue(vectorStore.read(store).isEmpty());
    }

    @Test
    void testMissingStore() {
        assertEquals(Optional.empty(), vectorStore.rowCount(tempDir.resolve("missing.vec")));
    }

    @Test
    void testTruncatedStore() throws Exception {
        final Path store = tempDir.resolve("truncated.vec");
        vectorStore.write(store, List.of(new Vector(1f, 2f), new Vector(3f, 4f)));
        final byte[] contents = Files.readAllBytes(store);
        Files.write(store, Arrays.copyOf(contents, contents.length - 4));

        assertThrows(VectorStoreFailure.class, () -> vectorStore.read(store));
    }

    @Test
    void testMixedDimensions() {
        assertThrows(VectorStoreFailure.class,
                () -> vectorStore.write(tempDir.resolve("mixed.vec"), List.of(new Vector(1f), new Vector(1f, 2f))));
    }
}
