package com.chesscoach.analysisservice.engine.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineLeaseTest {

    @Test
    void releasesExactlyOnce() {
        AtomicInteger releases = new AtomicInteger();
        EngineLease lease = new EngineLease(new ScriptedEngineClient(), c -> releases.incrementAndGet());

        lease.close();
        lease.close();

        assertThat(releases).hasValue(1);
        assertThat(lease.isReleased()).isTrue();
        assertThatThrownBy(lease::client).isInstanceOf(IllegalStateException.class);
    }
}
