package com.phillippitts.whisperwriter.service.transcription.local;

import com.phillippitts.whisperwriter.exception.BackendInitException;
import com.phillippitts.whisperwriter.util.ProcessFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves and validates everything whisper.cpp needs before the first transcription.
 *
 * <p>Named models resolve to {@code ${modelsDir}/ggml-${name}.bin}; explicit paths are used as
 * given and never downloaded. A device outside {@code cpu|cuda|auto}, a missing binary or a
 * missing weights file raises {@link BackendInitException}.
 */
public class WhisperCppModelLoader implements LocalModelLoader {

    private static final Logger LOG = LogManager.getLogger(WhisperCppModelLoader.class);

    public static final Set<String> SUPPORTED_DEVICES = Set.of("cpu", "cuda", "auto");

    private final Path binary;
    private final Path modelsDir;
    private final int threads;
    private final Path vadModel;
    private final ProcessFactory processFactory;

    public WhisperCppModelLoader(Path binary, Path modelsDir, int threads, Path vadModel,
                                 ProcessFactory processFactory) {
        this.binary = Objects.requireNonNull(binary, "binary must not be null");
        this.modelsDir = Objects.requireNonNull(modelsDir, "modelsDir must not be null");
        this.threads = threads;
        this.vadModel = vadModel;
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
    }

    @Override
    public LocalWhisperModel load(LocalModelSpec spec) {
        if (!SUPPORTED_DEVICES.contains(spec.device())) {
            throw new BackendInitException("Unsupported device", spec.modelId(), spec.device());
        }
        if (!Files.isRegularFile(binary)) {
            throw new BackendInitException("whisper.cpp binary not found at " + binary.toAbsolutePath(),
                    spec.modelId(), spec.device());
        }
        if (!Files.isExecutable(binary)) {
            throw new BackendInitException("whisper.cpp binary is not executable: " + binary.toAbsolutePath(),
                    spec.modelId(), spec.device());
        }
        Path modelFile = resolveModelFile(spec);
        if (!Files.isRegularFile(modelFile)) {
            throw new BackendInitException("Model weights not found at " + modelFile.toAbsolutePath(),
                    spec.modelId(), spec.device());
        }
        Path vad = vadModel;
        if (vad != null && !Files.isRegularFile(vad)) {
            LOG.warn("VAD model not found at {}; VAD filtering disabled", vad.toAbsolutePath());
            vad = null;
        }
        LOG.info("Local model ready: {} on {}", modelFile.getFileName(), spec.device());
        return new WhisperCppModel(binary.toAbsolutePath(), modelFile.toAbsolutePath(), spec.device(),
                threads, vad == null ? null : vad.toAbsolutePath(), processFactory);
    }

    Path resolveModelFile(LocalModelSpec spec) {
        if (spec.fromPath()) {
            return Path.of(spec.modelId());
        }
        return modelsDir.resolve("ggml-" + spec.modelId() + ".bin");
    }
}
