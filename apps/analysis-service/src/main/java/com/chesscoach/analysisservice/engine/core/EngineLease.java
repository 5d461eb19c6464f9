package com.chesscoach.analysisservice.engine.core;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 一次句柄租用。close() 把句柄还给池，只生效一次；归还后再取句柄会抛 {@link IllegalStateException}。
 */
public final class EngineLease implements AutoCloseable {

    private final EngineClient client;
    private final Consumer<EngineClient> releaser;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public EngineLease(EngineClient client, Consumer<EngineClient> releaser) {
        this.client = client;
        this.releaser = releaser;
    }

    public EngineClient client() {
        if (released.get()) {
            throw new IllegalStateException("引擎句柄已归还，不能继续使用");
        }
        return client;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            releaser.accept(client);
        }
    }
}
