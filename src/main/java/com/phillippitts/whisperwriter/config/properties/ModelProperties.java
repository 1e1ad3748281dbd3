package com.phillippitts.whisperwriter.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties selecting and configuring the transcription backend.
 *
 * <p>{@code model-options.use-api} picks the backend once at startup. The {@code local} and
 * {@code api} groups configure each backend; {@code common} applies to both.
 *
 * <pre>
 * model-options.use-api=false
 * model-options.local.model=base
 * model-options.local.compute-type=int8
 * model-options.api.base-url=https://api.openai.com/v1
 * model-options.common.language=en
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "model-options")
public class ModelProperties {

    private final boolean useApi;

    @Valid
    private final Local local;

    @Valid
    private final Api api;

    @Valid
    private final Common common;

    @ConstructorBinding
    public ModelProperties(Boolean useApi, Local local, Api api, Common common) {
        this.useApi = useApi != null && useApi;
        this.local = local == null ? new Local(null, null, null, null, null, null, null, null, null, null) : local;
        this.api = api == null ? new Api(null, null, null) : api;
        this.common = common == null ? new Common(null, null, null) : common;
    }

    public boolean isUseApi() {
        return useApi;
    }

    public Local getLocal() {
        return local;
    }

    public Api getApi() {
        return api;
    }

    public Common getCommon() {
        return common;
    }

    /**
     * Local whisper.cpp backend.
     *
     * @param model named model, resolved to {@code ${modelsDir}/ggml-${model}.bin}
     * @param modelPath explicit weights file; takes precedence over {@code model}
     * @param modelsDir directory holding named models
     * @param binaryPath whisper.cpp command line binary
     * @param computeType precision; {@code int8} forces the CPU
     * @param device cpu, cuda or auto
     * @param conditionOnPreviousText use the previous window's text as decoder context
     * @param vadFilter skip non-speech regions
     * @param vadModelPath whisper.cpp VAD model; VAD is skipped without it
     * @param threads decoder threads
     */
    public record Local(@NotBlank String model,
                        String modelPath,
                        @NotBlank String modelsDir,
                        @NotBlank String binaryPath,
                        @NotBlank String computeType,
                        @NotBlank String device,
                        Boolean conditionOnPreviousText,
                        Boolean vadFilter,
                        String vadModelPath,
                        @Min(1) Integer threads) {

        public Local {
            model = blankToDefault(model, "base");
            modelPath = blankToNull(modelPath);
            modelsDir = blankToDefault(modelsDir, "models");
            binaryPath = blankToDefault(binaryPath, "tools/whisper.cpp/whisper-cli");
            computeType = blankToDefault(computeType, "default");
            device = blankToDefault(device, "auto");
            conditionOnPreviousText = conditionOnPreviousText == null || conditionOnPreviousText;
            vadFilter = vadFilter != null && vadFilter;
            vadModelPath = blankToNull(vadModelPath);
            threads = threads == null ? 4 : threads;
        }
    }

    /**
     * OpenAI-compatible HTTP backend.
     *
     * @param baseUrl API root; {@code /audio/transcriptions} is appended
     * @param model remote model name
     * @param apiKey bearer token; bound from {@code OPENAI_API_KEY} by default
     */
    public record Api(@NotBlank String baseUrl, @NotBlank String model, String apiKey) {

        public Api {
            baseUrl = blankToDefault(baseUrl, "https://api.openai.com/v1");
            model = blankToDefault(model, "whisper-1");
            apiKey = blankToNull(apiKey);
        }
    }

    /**
     * Decoding options shared by both backends.
     *
     * @param language ISO code; blank means auto-detect
     * @param initialPrompt decoder prompt
     * @param temperature sampling temperature
     */
    public record Common(String language,
                         String initialPrompt,
                         @DecimalMin("0.0") @DecimalMax("1.0") Double temperature) {

        public Common {
            language = blankToNull(language);
            initialPrompt = blankToNull(initialPrompt);
            temperature = temperature == null ? 0.0 : temperature;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    private static String blankToDefault(String s, String fallback) {
        return s == null || s.isBlank() ? fallback : s;
    }
}
