package dev.taskworker.worker.log;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileLogConsumer implements LogConsumer {

    private final Path path;
    private final BufferedWriter writer;

    public FileLogConsumer(Path path) throws IOException {
        Files.createDirectories(path.getParent());
        this.path = path;
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    public Path path() {
        return path;
    }

    @Override
    public void write(String chunk) {
        try {
            writer.write(chunk);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write task log " + path, e);
        }
    }

    @Override
    public void end() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close task log " + path, e);
        }
    }
}
