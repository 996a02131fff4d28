package dev.taskworker.worker.container;

import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.model.Frame;
import dev.taskworker.worker.log.TaskLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Forwards a followed container log stream into the task log. */
class ContainerOutputCallback extends ResultCallback.Adapter<Frame> {

    private static final Logger logger = LoggerFactory.getLogger(ContainerOutputCallback.class);

    private final String containerId;
    private final TaskLog output;
    private final Utf8StreamDecoder decoder = new Utf8StreamDecoder();

    ContainerOutputCallback(String containerId, TaskLog output) {
        this.containerId = containerId;
        this.output = output;
    }

    @Override
    public void onNext(Frame frame) {
        write(decoder.decode(frame.getPayload()));
    }

    @Override
    public void onError(Throwable throwable) {
        logger.warn("Output stream of container {} failed", containerId, throwable);
        write(decoder.flush());
        super.onError(throwable);
    }

    @Override
    public void onComplete() {
        write(decoder.flush());
        super.onComplete();
    }

    private void write(String text) {
        if (!text.isEmpty()) {
            output.write(text);
        }
    }
}
