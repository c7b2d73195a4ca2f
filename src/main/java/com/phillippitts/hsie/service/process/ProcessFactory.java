package com.phillippitts.hsie.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts the subprocess behind a whisper, diarizer or scorer call. Tests substitute a factory
 * returning scripted {@link Process} instances.
 */
@FunctionalInterface
public interface ProcessFactory {

    /**
     * @param command    executable followed by its arguments
     * @param workingDir directory to run in, or {@code null}
     * @throws IOException if the executable cannot be launched
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
