package com.phillippitts.whisperwriter.service.transcription.local;

import com.phillippitts.whisperwriter.exception.BackendInitException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Loads the local model once and hands out the cached instance for the rest of the process.
 *
 * <p>Load policy:
 * <ol>
 *   <li>int8 compute type forces the CPU regardless of the configured device.</li>
 *   <li>If loading on the configured device fails, retry exactly once on the CPU with the same
 *       model identifier.</li>
 *   <li>If the CPU attempt fails too, the {@link BackendInitException} propagates and nothing is
 *       cached, so the next recording tries again.</li>
 * </ol>
 */
public class LocalModelProvider {

    private static final Logger LOG = LogManager.getLogger(LocalModelProvider.class);

    private final LocalModelLoader loader;
    private final LocalModelSpec spec;
    private final Object lock = new Object();

    private volatile LocalWhisperModel model;

    public LocalModelProvider(LocalModelLoader loader, LocalModelSpec spec) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
    }

    public LocalWhisperModel get() {
        LocalWhisperModel current = model;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (model == null) {
                model = loadWithFallback();
            }
            return model;
        }
    }

    public boolean isLoaded() {
        return model != null;
    }

    private LocalWhisperModel loadWithFallback() {
        LocalModelSpec target = spec.effective();
        if (!target.equals(spec)) {
            LOG.info("Compute type {} forces CPU (configured device: {})", spec.computeType(), spec.device());
        }
        LOG.info("Loading local model '{}' on {} ({})", target.modelId(), target.device(), target.computeType());
        try {
            return loader.load(target);
        } catch (BackendInitException e) {
            if (target.isCpu()) {
                throw e;
            }
            LOG.warn("Loading on {} failed: {}. Falling back to CPU.", target.device(), e.getMessage());
            return loader.load(target.onCpu());
        }
    }
}
