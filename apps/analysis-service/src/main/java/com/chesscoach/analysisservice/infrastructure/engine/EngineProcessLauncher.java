package com.chesscoach.analysisservice.infrastructure.engine;

import java.io.IOException;

/**
 * 启动一个引擎进程。生产环境用 {@link ProcessBuilder}，测试可替换为内存中的假进程。
 */
@FunctionalInterface
public interface EngineProcessLauncher {

    Process launch() throws IOException;

    static EngineProcessLauncher forPath(String path) {
        return () -> new ProcessBuilder(path).redirectErrorStream(true).start();
    }
}
