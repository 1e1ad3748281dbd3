package com.phillippitts.whisperwriter.service.transcription.local;

import com.phillippitts.whisperwriter.exception.BackendInvocationException;
import com.phillippitts.whisperwriter.exception.BackendInvocationExceptionBuilder;
import com.phillippitts.whisperwriter.util.ProcessFactory;
import com.phillippitts.whisperwriter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one whisper.cpp invocation and returns its stdout.
 *
 * <p>stdout and stderr are drained on daemon threads so the child can never block on a full pipe.
 * There is no timeout: a transcription runs until the process exits. Interruption of the calling
 * thread destroys the child.
 */
final class WhisperCppProcessRunner {

    private static final Logger LOG = LogManager.getLogger(WhisperCppProcessRunner.class);

    static final int STDOUT_MAX_CHARS = 1024 * 1024;
    static final int STDERR_MAX_CHARS = 64 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 500;
    private static final long GOBBLER_FLUSH_MILLIS = 2_000;
    private static final long DESTROY_GRACE_MILLIS = 1_000;

    private final ProcessFactory processFactory;

    WhisperCppProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
    }

    String run(List<String> command, Path workingDir) {
        long start = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process;
        try {
            process = processFactory.start(command, workingDir);
        } catch (IOException e) {
            throw error("Failed to start whisper.cpp", -1, stderr, start, command).cause(e).build();
        }

        Thread out = startGobbler(process.getInputStream(), stdout, "whisper-out", STDOUT_MAX_CHARS);
        Thread err = startGobbler(process.getErrorStream(), stderr, "whisper-err", STDERR_MAX_CHARS);
        try {
            int exitCode = process.waitFor();
            join(out);
            join(err);
            if (exitCode != 0) {
                throw error("whisper.cpp exited with code " + exitCode, exitCode, stderr, start, command).build();
            }
            LOG.debug("whisper.cpp finished in {} ms, stdout={} chars", TimeUtils.elapsedMillis(start), stdout.length());
            return stdout.toString();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy(process);
            throw error("Interrupted while waiting for whisper.cpp", -1, stderr, start, command).cause(e).build();
        }
    }

    private static BackendInvocationExceptionBuilder error(String message, int exitCode, StringBuilder stderr,
                                                          long startNanos, List<String> command) {
        String snippet = stderr.length() <= ERROR_SNIPPET_MAX_CHARS
                ? stderr.toString()
                : stderr.substring(stderr.length() - ERROR_SNIPPET_MAX_CHARS);
        return BackendInvocationExceptionBuilder.create(message)
                .backend(LocalWhisperBackend.NAME)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("binary", command.get(0))
                .metadata("stderr", snippet.strip());
    }

    private static Thread startGobbler(InputStream in, StringBuilder sink, String name, int maxChars) {
        Thread t = new Thread(() -> gobble(in, sink, name, maxChars), name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void gobble(InputStream in, StringBuilder sink, String name, int maxChars) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            boolean capped = false;
            while ((line = br.readLine()) != null) {
                synchronized (sink) {
                    if (sink.length() + line.length() + 1 > maxChars) {
                        if (!capped) {
                            LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                            capped = true;
                        }
                        continue;
                    }
                    if (sink.length() > 0) {
                        sink.append('\n');
                    }
                    sink.append(line);
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    private static void join(Thread t) throws InterruptedException {
        t.join(GOBBLER_FLUSH_MILLIS);
    }

    private static void destroy(Process process) {
        process.destroy();
        try {
            if (!process.waitFor(DESTROY_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
