package com.phillippitts.whisperwriter.service.transcription.local;

import com.phillippitts.whisperwriter.exception.BackendInvocationExceptionBuilder;
import com.phillippitts.whisperwriter.service.audio.WavWriter;
import com.phillippitts.whisperwriter.service.transcription.DecodingOptions;
import com.phillippitts.whisperwriter.util.ProcessFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Local model backed by the whisper.cpp command line tool.
 *
 * <p>Each call writes the samples to a temporary 32-bit float WAV file and runs:
 * <pre>
 * ${binary} -m ${model} -f ${wav} -l ${language|auto} -tp ${temperature} -t ${threads} -nt -np
 *           [--prompt ${prompt}] [-mc 0] [--vad -vm ${vadModel}] [-ng]
 * </pre>
 * Every non-blank stdout line is one segment; segments are joined with single spaces.
 */
public class WhisperCppModel implements LocalWhisperModel {

    private static final Logger LOG = LogManager.getLogger(WhisperCppModel.class);

    private final Path binary;
    private final Path modelFile;
    private final String device;
    private final int threads;
    private final Path vadModel;
    private final WhisperCppProcessRunner runner;

    WhisperCppModel(Path binary, Path modelFile, String device, int threads, Path vadModel,
                    ProcessFactory processFactory) {
        this.binary = binary;
        this.modelFile = modelFile;
        this.device = device;
        this.threads = threads;
        this.vadModel = vadModel;
        this.runner = new WhisperCppProcessRunner(processFactory);
    }

    @Override
    public String transcribe(float[] samples, int sampleRate, DecodingOptions options, LocalDecodeSettings settings) {
        Path wav = null;
        try {
            wav = Files.createTempFile("whisperwriter-", ".wav");
            WavWriter.writeFloat32(samples, sampleRate, wav);
            String stdout = runner.run(buildCommand(wav, options, settings), wav.getParent());
            return joinSegments(stdout);
        } catch (IOException | UncheckedIOException e) {
            throw BackendInvocationExceptionBuilder.create("Failed to prepare audio for whisper.cpp")
                    .backend(LocalWhisperBackend.NAME)
                    .cause(e)
                    .build();
        } finally {
            deleteQuietly(wav);
        }
    }

    @Override
    public String device() {
        return device;
    }

    List<String> buildCommand(Path wav, DecodingOptions options, LocalDecodeSettings settings) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary.toString());
        cmd.add("-m");
        cmd.add(modelFile.toString());
        cmd.add("-f");
        cmd.add(wav.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(options.autoDetectLanguage() ? "auto" : options.language());
        cmd.add("-tp");
        cmd.add(String.format(Locale.ROOT, "%.2f", options.temperature()));
        cmd.add("-t");
        cmd.add(String.valueOf(threads));
        cmd.add("-nt");
        cmd.add("-np");
        if (options.initialPrompt() != null) {
            cmd.add("--prompt");
            cmd.add(options.initialPrompt());
        }
        if (!settings.conditionOnPreviousText()) {
            // max text context 0: each window decodes without the previous window's text
            cmd.add("-mc");
            cmd.add("0");
        }
        if (settings.vadFilter()) {
            if (vadModel != null) {
                cmd.add("--vad");
                cmd.add("-vm");
                cmd.add(vadModel.toString());
            } else {
                LOG.debug("VAD filter requested but no VAD model configured; decoding full audio");
            }
        }
        if (LocalModelSpec.CPU.equals(device)) {
            cmd.add("-ng");
        }
        return cmd;
    }

    static String joinSegments(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return "";
        }
        return Arrays.stream(stdout.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete temp WAV {}: {}", path, e.getMessage());
        }
    }
}
