package com.phillippitts.whisperwriter.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so process-launching code (the whisper.cpp model and
 * launch commands) can be tested with a stub {@link Process}.
 */
public interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command full command line, executable first
     * @param workingDir working directory (may be null)
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
