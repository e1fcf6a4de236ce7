package io.herald4j.config;

import io.herald4j.Herald;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Runs the Herald tick, worker and reaper loops with the Spring container.
 *
 * <p>{@code herald.auto-startup} and {@code herald.lifecycle-phase} control when the loops start. On shutdown
 * the loops drain on a separate thread, so beans in the same phase stop in parallel while in-flight publishes
 * finish (bounded by {@code herald.shutdown-timeout}).
 */
public class HeraldLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(HeraldLifecycle.class);

    private final Herald herald;
    private final HeraldProperties props;

    public HeraldLifecycle(Herald herald, HeraldProperties props) {
        this.herald = Objects.requireNonNull(herald, "herald must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public void start() {
        herald.start();
    }

    @Override
    public void stop() {
        herald.stop();
    }

    @Override
    public void stop(Runnable callback) {
        if (!herald.isRunning()) {
            callback.run();
            return;
        }
        Thread drain = new Thread(() -> {
            try {
                herald.stop();
            } catch (RuntimeException e) {
                log.error("Herald shutdown failed msg={}", e.getMessage(), e);
            } finally {
                callback.run();
            }
        });
        drain.setName("herald.shutdown");
        drain.setDaemon(true);
        drain.start();
    }

    @Override
    public boolean isRunning() {
        return herald.isRunning();
    }

    @Override
    public int getPhase() {
        return props.getLifecyclePhase();
    }

    @Override
    public boolean isAutoStartup() {
        return props.isAutoStartup();
    }
}
