package eu.virtualparadox.hybridrag.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.hybridrag.application.config.RetrievalProperties;
import eu.virtualparadox.hybridrag.exception.EmbeddingProviderException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence embeddings from a local ONNX encoder (mean pooling + L2 normalisation).
 * <p>
 * Expects {@code <models>/embedding/model.onnx} and {@code tokenizer.json}. When either file is
 * missing the service starts anyway but stays unavailable, and every call fails with
 * {@link EmbeddingProviderException}; retrieval then degrades to keyword-only.
 */
@Service
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(OnnxEmbeddingService.class);

    private static final int MAX_LEN = 512;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final int batchSize;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final RetrievalProperties config) {
        final Path modelRoot = config.getModels() == null ? null : config.getModels().resolve("embedding");
        this.modelPath = modelRoot == null ? null : modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot == null ? null : modelRoot.resolve("tokenizer.json");
        this.batchSize = config.getEmbedding().getBatchSize();
    }

    @PostConstruct
    public void init() {
        if (modelPath == null || !Files.isRegularFile(modelPath) || !Files.isRegularFile(tokenizerPath)) {
            logger.warn("No embedding model at {}; semantic search is disabled until one is installed", modelPath);
            return;
        }

        try {
            this.env = OrtEnvironment.getEnvironment();
            this.session = env.createSession(modelPath.toString(), sessionOptions());
            this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

            logger.info("Loaded ONNX embedding model: {}", modelPath);
            logger.info("Model expects inputs: {}", session.getInputNames());
        } catch (OrtException | IOException e) {
            logger.error("Unable to load embedding model {}; semantic search is disabled", modelPath, e);
            this.session = null;
        }
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public boolean isAvailable() {
        return session != null && tokenizer != null;
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        if (!isAvailable()) {
            throw new EmbeddingProviderException("Embedding model is not available (expected at " + modelPath + ")");
        }

        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            final int to = Math.min(texts.size(), from + batchSize);
            result.addAll(embedBatch(texts.subList(from, to)));
        }
        logger.debug("Embedded {} texts in batches of {}", texts.size(), batchSize);
        return result;
    }

    private List<float[]> embedBatch(final List<String> texts) {
        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            if (maxLen > MAX_LEN) {
                maxLen = MAX_LEN;
            }

            final int n = encodings.size();
            final long[][] inputIdArr = new long[n][maxLen];
            final long[][] attnMaskArr = new long[n][maxLen];
            final long[][] tokenTypeArr = new long[n][maxLen];

            for (int i = 0; i < n; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    final float[][][] tokenEmbeddings = (float[][][]) result.get(0).getValue();

                    final List<float[]> out = new ArrayList<>(n);
                    for (int i = 0; i < n; i++) {
                        final float[] vec = meanPool(tokenEmbeddings[i], attnMaskArr[i]);
                        normalize(vec);
                        out.add(vec);
                    }
                    return out;
                }
            }
        } catch (final OrtException | RuntimeException e) {
            throw new EmbeddingProviderException("Failed to embed batch of " + texts.size() + " texts", e);
        }
    }

    private static OrtSession.SessionOptions sessionOptions() throws OrtException {
        final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

        // leave one core free for other tasks
        final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        opts.setIntraOpNumThreads(intraThreads);
        opts.setInterOpNumThreads(1);

        logger.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
        return opts;
    }

    private static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length && i < attentionMask.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    private static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
