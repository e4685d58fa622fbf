package controlmap.domain.alignment;

import controlmap.domain.config.EmbeddingConfig;
import controlmap.domain.corpus.AlignedCorpus;
import controlmap.domain.corpus.CorpusRecord;
import controlmap.domain.corpus.EmbeddingText;
import controlmap.domain.embedding.FakeEmbeddingModel;
import controlmap.domain.exceptionhandling.LoggingExceptionHandler;
import controlmap.domain.exceptions.EmbeddingGenerationFailed;
import controlmap.domain.logger.Loggers;
import controlmap.domain.persist.FileVectorStore;
import controlmap.domain.persist.VectorStore;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(EmbeddingAlignmentManagerImpl.class)
@AddBeanClasses(FileVectorStore.class)
@AddBeanClasses(FakeEmbeddingModel.class)
@AddBeanClasses(EmbeddingConfig.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
class EmbeddingAlignmentManagerImplTest {

    @Inject
    private EmbeddingAlignmentManager alignmentManager;

    @Inject
    private VectorStore vectorStore;

    @Inject
    private FakeEmbeddingModel embeddingModel;

    @TempDir
    Path tempDir;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("cm.embedding.batchsize", "4"),
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

    private static List<CorpusRecord> records(final int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new CorpusRecord("CTL-" + i, "Domain", "Title " + i, "Control text " + i, null))
                .toList();
    }

    private static List<Vector> vectors(final int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Vector(1f, i, 0f, 0f))
                .toList();
    }

    @Test
    void testStaleStoreIsRegenerated() {
        final Path store = tempDir.resolve("controls.vec");
        vectorStore.write(store, vectors(5));

        final AlignedCorpus corpus = alignmentManager.align(records(6), store, EmbeddingText.BODY);

        assertEquals(6, corpus.size());
        assertEquals(6, corpus.vectors().size());
        assertEquals(6, embeddingModel.getEmbeddedTexts().size());
        assertEquals(Optional.of(6), vectorStore.rowCount(store));
        assertEquals(corpus.vectors(), vectorStore.read(store));
    }

    @Test
    void testMatchingStoreIsTrusted() {
        final Path store = tempDir.resolve("controls.vec");
        vectorStore.write(store, vectors(6));

        final AlignedCorpus corpus = alignmentManager.align(records(6), store, EmbeddingText.BODY);

        assertEquals(vectors(6), corpus.vectors());
        assertTrue(embeddingModel.getEmbeddedTexts().isEmpty());
    }

    @Test
    void testMissingStoreIsCreatedInRecordOrder() {
        final Path store = tempDir.resolve("nested/requirements.vec");

        final AlignedCorpus corpus = alignmentManager.align(records(10), store, EmbeddingText.TITLE_AND_BODY);

        assertEquals(10, corpus.size());
        assertEquals("Title 0 Control text 0", embeddingModel.getEmbeddedTexts().get(0));
        assertEquals("Title 9 Control text 9", embeddingModel.getEmbeddedTexts().get(9));
        assertEquals(embeddingModel.embed("Title 3 Control text 3"), corpus.vectors().get(3));
        assertTrue(Files.isRegularFile(store));
    }

    @Test
    void testCorruptStoreIsRegenerated() throws Exception {
        final Path store = tempDir.resolve("controls.vec");
        Files.write(store, new byte[]{0, 0});

        final AlignedCorpus corpus = alignmentManager.align(records(3), store, EmbeddingText.BODY);

        assertEquals(3, corpus.vectors().size());
        assertEquals(Optional.of(3), vectorStore.rowCount(store));
    }

    @Test
    void testFailureKeepsOldStore() {
        final Path store = tempDir.resolve("controls.vec");
        vectorStore.write(store, vectors(5));
        embeddingModel.setFailing(true);

        assertThrows(EmbeddingGenerationFailed.class, () -> alignmentManager.align(records(6), store, EmbeddingText.BODY));
        assertEquals(vectors(5), vectorStore.read(store));
    }

    @Test
    void testEmptyRecordsNeedNoEmbeddings() {
        final AlignedCorpus corpus = alignmentManager.align(List.of(), tempDir.resolve("empty.vec"), EmbeddingText.BODY);

        assertTrue(corpus.isEmpty());
        assertTrue(embeddingModel.getEmbeddedTexts().isEmpty());
    }
}
