package com.chesscoach.analysisservice.infrastructure.engine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * 测试用的进程替身：按脚本同步应答 UCI 命令，不启动真实引擎。
 */
class FakeUciProcess extends Process {

    @FunctionalInterface
    interface Script {
        void onCommand(String command, FakeUciProcess engine);
    }

    private final Script script;
    private final LineSource stdout = new LineSource();
    private final CommandSink stdin = new CommandSink();
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile boolean alive = true;

    FakeUciProcess(Script script) {
        this.script = script;
    }

    void reply(String... lines) {
        reply(List.of(lines));
    }

    void reply(List<String> lines) {
        for (String line : lines) {
            stdout.push(line + "\n");
        }
    }

    void exit() {
        if (!alive) return;
        alive = false;
        stdout.eof();
        exited.countDown();
    }

    List<String> received() {
        return received;
    }

    @Override
    public OutputStream getOutputStream() {
        return stdin;
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return 0;
    }

    @Override
    public int exitValue() {
        if (alive) throw new IllegalThreadStateException("process is still running");
        return 0;
    }

    @Override
    public void destroy() {
        exit();
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    private final class CommandSink extends OutputStream {

        private final ByteArrayOutputStream line = new ByteArrayOutputStream();

        @Override
        public void write(int b) throws IOException {
            if (!alive) throw new IOException("Broken pipe");
            if (b == '\n') {
                String command = line.toString(StandardCharsets.UTF_8).trim();
                line.reset();
                received.add(command);
                script.onCommand(command, FakeUciProcess.this);
            } else {
                line.write(b);
            }
        }
    }

    private static final class LineSource extends InputStream {

        private static final int END = -1;

        private final BlockingQueue<Integer> bytes = new LinkedBlockingQueue<>();

        void push(String text) {
            for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
                bytes.add(b & 0xFF);
            }
        }

        void eof() {
            bytes.add(END);
        }

        @Override
        public int read() throws IOException {
            try {
                int b = bytes.take();
                if (b == END) bytes.add(END);
                return b;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("read interrupted");
            }
        }

        @Override
        public int read(byte[] buf, int off, int len) throws IOException {
            if (len == 0) return 0;
            int first = read();
            if (first == END) return END;
            buf[off] = (byte) first;
            int n = 1;
            while (n < len) {
                Integer next = bytes.peek();
                if (next == null || next == END) break;
                bytes.poll();
                buf[off + n++] = (byte) next.intValue();
            }
            return n;
        }
    }
}
