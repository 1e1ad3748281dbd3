package com.phillippitts.whisperwriter.service.transcription.local;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of a local model load: which weights, on which device, at which precision.
 *
 * @param modelId model name (e.g. "base") or filesystem path when {@code fromPath} is true
 * @param fromPath whether {@code modelId} is an explicit path rather than a named model
 * @param device "cpu", "cuda" or "auto"
 * @param computeType precision such as "default", "float16" or "int8"
 */
public record LocalModelSpec(String modelId, boolean fromPath, String device, String computeType) {

    public static final String CPU = "cpu";
    public static final String INT8 = "int8";

    public LocalModelSpec {
        Objects.requireNonNull(modelId, "modelId must not be null");
        device = device == null || device.isBlank() ? "auto" : device.toLowerCase(Locale.ROOT);
        computeType = computeType == null || computeType.isBlank() ? "default" : computeType.toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves the device the load should actually target: int8 quantization always runs on the CPU.
     */
    public LocalModelSpec effective() {
        if (INT8.equals(computeType) && !CPU.equals(device)) {
            return onCpu();
        }
        return this;
    }

    public LocalModelSpec onCpu() {
        return new LocalModelSpec(modelId, fromPath, CPU, computeType);
    }

    public boolean isCpu() {
        return CPU.equals(device);
    }
}
