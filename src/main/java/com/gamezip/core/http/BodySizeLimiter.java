package com.gamezip.core.http;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Enforces a maximum request body size while the body is being read, so an
 * oversized upload is cut off without being buffered in full.
 */
public final class BodySizeLimiter {

    private BodySizeLimiter() {}

    /**
     * Wraps an input stream to enforce a maximum byte limit.
     *
     * @param delegate the underlying input stream
     * @param maxBytes maximum number of bytes allowed; non-positive disables the limit
     * @return a wrapped stream that throws {@link PayloadTooLargeException} once the limit is passed
     */
    public static InputStream limit(InputStream delegate, long maxBytes) {
        if (delegate == null) return null;
        if (maxBytes <= 0 || maxBytes == Long.MAX_VALUE) return delegate;
        return new LimitedInputStream(delegate, maxBytes);
    }

    /**
     * Reads the whole stream, failing with {@link ResourceLimitExceededException}
     * as soon as more than {@code maxBytes} arrive. The caller keeps ownership of
     * {@code in}.
     */
    public static byte[] readAll(InputStream in, long maxBytes) throws IOException {
        if (in == null) {
            return new byte[0];
        }
        var out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        InputStream limited = limit(in, maxBytes);
        try {
            int n;
            while ((n = limited.read(buf)) >= 0) {
                out.write(buf, 0, n);
            }
        } catch (PayloadTooLargeException e) {
            throw new ResourceLimitExceededException("Request body too large", e.maxBytes());
        }
        return out.toByteArray();
    }

    /**
     * Raised from inside the stream; {@link #readAll} converts it to
     * {@link ResourceLimitExceededException}.
     */
    public static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        public PayloadTooLargeException(long maxBytes) {
            super("Payload exceeds maximum size of " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        public long maxBytes() {
            return maxBytes;
        }
    }

    private static final class LimitedInputStream extends FilterInputStream {
        private final long maxBytes;
        private long bytesRead = 0;

        LimitedInputStream(InputStream in, long maxBytes) {
            super(in);
            this.maxBytes = maxBytes;
        }

        @Override
        public int read() throws IOException {
            if (bytesRead > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
            int b = super.read();
            if (b >= 0 && ++bytesRead > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (bytesRead > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
            long remaining = maxBytes - bytesRead;
            int toRead = (int) Math.min(len, remaining + 1);
            int n = super.read(b, off, toRead);
            if (n > 0) {
                bytesRead += n;
                if (bytesRead > maxBytes) {
                    throw new PayloadTooLargeException(maxBytes);
                }
            }
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            long remaining = maxBytes - bytesRead;
            long skipped = super.skip(Math.min(n, remaining + 1));
            bytesRead += skipped;
            if (bytesRead > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
            return skipped;
        }
    }
}
