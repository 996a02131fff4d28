package dev.taskworker.worker.feature;

import static org.junit.jupiter.api.Assertions.*;

import dev.taskworker.worker.task.TestTasks;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalLogFeatureTest {

    @TempDir
    Path logDir;

    @Test
    void writesTheWholeTranscriptIncludingHeldLines() throws Exception {
        var task = TestTasks.task(TestTasks.VALID_PAYLOAD);
        var feature = new LocalLogFeature(logDir);
        task.log().hold();
        task.log().write("header\r\n");

        feature.created(task);
        task.log().release();
        task.log().write("footer\r\n");
        task.log().end().join();
        feature.killed(task);

        var expected = logDir.resolve("task-1").resolve("0").resolve("terminal.log");
        assertEquals(expected, feature.path());
        assertEquals("header\r\nfooter\r\n", Files.readString(expected));
    }

    @Test
    void unwritableDirectoryFailsTheHook() throws Exception {
        var blocker = logDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        var feature = new LocalLogFeature(blocker);

        assertThrows(FeatureException.class, () -> feature.created(TestTasks.task(TestTasks.VALID_PAYLOAD)));
    }
}
