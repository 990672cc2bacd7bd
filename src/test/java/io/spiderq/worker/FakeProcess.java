package io.spiderq.worker;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory worker process. Tests write to its stdout/stderr and decide when and how it exits.
 */
public final class FakeProcess extends Process {
    public static final int TERMINATED_EXIT_CODE = 143;

    private final ChunkStream stdout = new ChunkStream();
    private final ChunkStream stderr = new ChunkStream();
    private final CountDownLatch exited = new CountDownLatch(1);
    private final List<String> onDestroyLines = new ArrayList<>();
    private volatile int exitCode;
    private volatile boolean destroyed;

    /**
     * A process that has already printed {@code lines} and exited with {@code exitCode}.
     */
    public static FakeProcess finished(int exitCode, String... lines) {
        FakeProcess p = new FakeProcess();
        for (String line : lines) {
            p.emit(line);
        }
        p.exit(exitCode);
        return p;
    }

    /**
     * A process that prints {@code lines} and then runs until destroyed.
     */
    public static FakeProcess hanging(String... lines) {
        FakeProcess p = new FakeProcess();
        for (String line : lines) {
            p.emit(line);
        }
        return p;
    }

    /**
     * Output the process still writes after it has been told to terminate.
     */
    public FakeProcess printsOnDestroy(String line) {
        onDestroyLines.add(line);
        return this;
    }

    public void emit(String line) {
        stdout.write(line + "\n");
    }

    public void emitRaw(String chunk) {
        stdout.write(chunk);
    }

    public void emitStderr(String line) {
        stderr.write(line + "\n");
    }

    public synchronized void exit(int code) {
        if (exited.getCount() == 0) {
            return;
        }
        exitCode = code;
        stdout.close();
        stderr.close();
        exited.countDown();
    }

    public boolean destroyed() {
        return destroyed;
    }

    @Override
    public OutputStream getOutputStream() {
        return OutputStream.nullOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return stderr;
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (exited.getCount() > 0) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public void destroy() {
        destroyed = true;
        for (String line : onDestroyLines) {
            emit(line);
        }
        exit(TERMINATED_EXIT_CODE);
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }

    /**
     * Blocking byte stream fed in chunks; reads return -1 once closed and drained.
     */
    private static final class ChunkStream extends InputStream {
        private static final byte[] EOF = new byte[0];

        private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
        private byte[] current = new byte[0];
        private int pos;
        private boolean closed;

        void write(String text) {
            chunks.add(text.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void close() {
            chunks.add(EOF);
        }

        @Override
        public int read() {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n == -1 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) {
            if (len == 0) {
                return 0;
            }
            while (pos >= current.length) {
                if (closed) {
                    return -1;
                }
                try {
                    byte[] next = chunks.take();
                    if (next == EOF) {
                        closed = true;
                        return -1;
                    }
                    current = next;
                    pos = 0;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return -1;
                }
            }
            int n = Math.min(len, current.length - pos);
            System.arraycopy(current, pos, b, off, n);
            pos += n;
            return n;
        }
    }
}
