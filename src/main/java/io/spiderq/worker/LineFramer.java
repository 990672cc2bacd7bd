package io.spiderq.worker;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Splits a byte stream into newline-terminated UTF-8 frames. Frames are cut on bytes, not on read chunks, so a
 * record split across two reads is reassembled before decoding. A trailing {@code \r} is dropped and blank frames
 * are skipped.
 *
 * <p>In strict mode an unterminated fragment at end of stream is rejected rather than delivered. Frames longer
 * than {@code maxFrameBytes} are rejected and skipped up to the next newline.
 */
public final class LineFramer {
    private static final int BUFFER_SIZE = 8192;

    private final int maxFrameBytes;
    private final boolean strict;

    public LineFramer(int maxFrameBytes, boolean strict) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be > 0");
        }
        this.maxFrameBytes = maxFrameBytes;
        this.strict = strict;
    }

    public static LineFramer strict(int maxFrameBytes) {
        return new LineFramer(maxFrameBytes, true);
    }

    public static LineFramer lenient(int maxFrameBytes) {
        return new LineFramer(maxFrameBytes, false);
    }

    /**
     * Reads {@code in} to end of stream, handing every accepted frame to {@code sink}.
     */
    public Result frame(InputStream in, Consumer<String> sink) throws IOException {
        ByteArrayOutputStream current = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];
        int accepted = 0;
        int oversized = 0;
        boolean discarding = false;
        int n;
        while ((n = in.read(buffer)) != -1) {
            for (int i = 0; i < n; i++) {
                byte b = buffer[i];
                if (b == '\n') {
                    if (discarding) {
                        discarding = false;
                    } else if (emit(current, sink)) {
                        accepted++;
                    }
                    current.reset();
                    continue;
                }
                if (discarding) {
                    continue;
                }
                if (current.size() >= maxFrameBytes) {
                    oversized++;
                    discarding = true;
                    current.reset();
                    continue;
                }
                current.write(b);
            }
        }
        boolean truncated = false;
        if (!discarding && current.size() > 0) {
            if (strict) {
                truncated = !decode(current).isBlank();
            } else if (emit(current, sink)) {
                accepted++;
            }
        }
        return new Result(accepted, oversized, truncated);
    }

    private boolean emit(ByteArrayOutputStream frame, Consumer<String> sink) {
        String line = decode(frame);
        if (line.isBlank()) {
            return false;
        }
        sink.accept(line);
        return true;
    }

    private static String decode(ByteArrayOutputStream frame) {
        byte[] bytes = frame.toByteArray();
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == '\r') {
            len--;
        }
        return new String(bytes, 0, len, StandardCharsets.UTF_8);
    }

    /**
     * @param frames          frames handed to the sink
     * @param oversizedFrames frames rejected for exceeding the size limit
     * @param truncatedTail   whether a non-blank unterminated fragment was rejected at end of stream
     */
    public record Result(int frames, int oversizedFrames, boolean truncatedTail) {
    }
}
