package me.golemcore.support.infrastructure.seed;

import me.golemcore.support.domain.model.KnowledgeChunk;
import me.golemcore.support.infrastructure.config.AutoConfiguration;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.EmbeddingPort;
import me.golemcore.support.port.outbound.KnowledgeSearchPort;
import me.golemcore.support.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class KnowledgeBaseLoaderTest {

    private static final String DOCUMENTS = """
            [{"id": "kb-001", "title": "Plans", "content": "Four plans", "category": "billing"},
             {"id": "kb-002", "title": "Sync", "content": "Sync every 5 minutes", "category": "technical",
              "active": false}]
            """;

    private StoragePort storagePort;
    private EmbeddingPort embeddingPort;
    private KnowledgeSearchPort knowledgeSearchPort;
    private SupportProperties properties;
    private KnowledgeBaseLoader loader;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        embeddingPort = mock(EmbeddingPort.class);
        knowledgeSearchPort = mock(KnowledgeSearchPort.class);
        properties = new SupportProperties();
        loader = new KnowledgeBaseLoader(storagePort, embeddingPort, knowledgeSearchPort, properties,
                AutoConfiguration.objectMapper());
        when(storagePort.getText("knowledge", "documents.json"))
                .thenReturn(CompletableFuture.completedFuture(DOCUMENTS));
    }

    @Test
    void loadAndIndex_embedsTitleAndContentInOneBatch() {
        when(embeddingPort.embedBatch(anyList())).thenReturn(CompletableFuture.completedFuture(
                List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f })));

        int indexed = loader.loadAndIndex();

        assertEquals(2, indexed);
        verify(embeddingPort).embedBatch(List.of("Plans\n\nFour plans", "Sync\n\nSync every 5 minutes"));
        ArgumentCaptor<KnowledgeChunk> captor = ArgumentCaptor.forClass(KnowledgeChunk.class);
        verify(knowledgeSearchPort, times(2)).index(captor.capture());
        assertArrayEquals(new float[] { 1f, 0f }, captor.getAllValues().get(0).getEmbedding());
        assertFalse(captor.getAllValues().get(1).isActive());
    }

    @Test
    void loadAndIndex_fallsBackToIndividualEmbeddings() {
        when(embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("batch too large")));
        when(embeddingPort.embed("Plans\n\nFour plans"))
                .thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f }));
        when(embeddingPort.embed("Sync\n\nSync every 5 minutes"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        int indexed = loader.loadAndIndex();

        assertEquals(1, indexed);
        verify(knowledgeSearchPort, times(1)).index(any());
    }

    @Test
    void loadAndIndex_missingFileIndexesNothing() {
        when(storagePort.getText("knowledge", "documents.json")).thenReturn(CompletableFuture.completedFuture(null));

        assertEquals(0, loader.loadAndIndex());
        verifyNoInteractions(embeddingPort);
    }

    @Test
    void onApplicationReady_skipsWhenEmbeddingUnavailable() {
        when(embeddingPort.isAvailable()).thenReturn(false);

        loader.onApplicationReady();

        verify(embeddingPort, never()).embedBatch(anyList());
        verifyNoInteractions(knowledgeSearchPort);
    }

    @Test
    void onApplicationReady_absorbsInvalidDocumentsFile() {
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(storagePort.getText("knowledge", "documents.json"))
                .thenReturn(CompletableFuture.completedFuture("{not an array"));

        assertDoesNotThrow(() -> loader.onApplicationReady());
        verifyNoInteractions(knowledgeSearchPort);
    }
}
