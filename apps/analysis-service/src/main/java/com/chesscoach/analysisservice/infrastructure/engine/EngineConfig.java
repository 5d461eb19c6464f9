package com.chesscoach.analysisservice.infrastructure.engine;

import com.chesscoach.analysisservice.engine.core.EnginePool;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 引擎相关 Bean 的装配：把 UCI 进程句柄工厂接入句柄池。
 * 池大小默认按 CPU 核数减去保留核数计算（见 {@link EngineProperties#resolvePoolSize()}）。
 */
@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "close")
    public EnginePool enginePool(EngineProperties props) {
        EngineProcessLauncher launcher = EngineProcessLauncher.forPath(props.getPath());
        return new BlockingEnginePool(
                props.resolvePoolSize(),
                props.getAcquireTimeout(),
                () -> new UciEngineClient(props, launcher));
    }
}
