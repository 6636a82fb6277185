package eu.virtualparadox.hybridrag.application.config;

import eu.virtualparadox.hybridrag.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalPropertiesTest {

    @Test
    void defaultsAreValid() {
        final RetrievalProperties props = new RetrievalProperties();
        assertDoesNotThrow(props::validate);

        assertEquals(800, props.getChunkSize());
        assertEquals(100, props.getChunkOverlap());
        assertEquals(10, props.getTopKCandidates());
        assertEquals(5, props.getFinalK());
        assertEquals(0.3, props.getHybridAlpha());
        assertEquals(0.93, props.getDuplicateThreshold());
        assertEquals(0.9, props.getQueryDuplicateThreshold());
        assertEquals(0.85, props.getCuratedMatchThreshold());
        assertTrue(props.getBootstrap().isEnabled());
    }

    @Test
    void createsConfiguredDirectories(@TempDir Path tmp) throws Exception {
        final RetrievalProperties props = new RetrievalProperties();
        props.setIndex(tmp.resolve("index"));
        props.setDocuments(tmp.resolve("reference_docs"));
        props.setModels(tmp.resolve("models"));

        props.validate();

        assertTrue(Files.isDirectory(tmp.resolve("index")));
        assertTrue(Files.isDirectory(tmp.resolve("reference_docs")));
        assertTrue(Files.isDirectory(tmp.resolve("models")));
    }

    @Test
    void overlapMustBeSmallerThanChunkSize() {
        final RetrievalProperties props = new RetrievalProperties();
        props.setChunkSize(100);
        props.setChunkOverlap(100);
        assertThrows(InvalidConfigurationException.class, props::validate);
    }

    @Test
    void alphaOutsideUnitIntervalIsRejected() {
        final RetrievalProperties props = new RetrievalProperties();
        props.setHybridAlpha(1.5);
        assertThrows(InvalidConfigurationException.class, props::validate);

        props.setHybridAlpha(Double.NaN);
        assertThrows(InvalidConfigurationException.class, props::validate);
    }

    @Test
    void nonPositiveCandidateCountsAreRejected() {
        final RetrievalProperties props = new RetrievalProperties();
        props.setFinalK(0);
        assertThrows(InvalidConfigurationException.class, props::validate);
    }

    @Test
    void nonPositiveBatchSizeIsRejected() {
        final RetrievalProperties props = new RetrievalProperties();
        props.getEmbedding().setBatchSize(0);
        assertThrows(InvalidConfigurationException.class, props::validate);
    }
}
