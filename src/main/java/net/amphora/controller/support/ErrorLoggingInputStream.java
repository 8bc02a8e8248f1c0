package net.amphora.controller.support;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards a listing stream and ends it at the first read failure, which is
 * logged instead of aborting the response.
 */
final class ErrorLoggingInputStream extends FilterInputStream {

    private static final Logger log = LoggerFactory.getLogger(ErrorLoggingInputStream.class);

    private final String prefix;
    private boolean failed;

    ErrorLoggingInputStream(InputStream in, String prefix) {
        super(in);
        this.prefix = prefix;
    }

    @Override
    public int read() throws IOException {
        if (failed) {
            return -1;
        }
        try {
            return super.read();
        } catch (IOException ex) {
            return fail(ex);
        }
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (failed) {
            return -1;
        }
        try {
            return super.read(buffer, offset, length);
        } catch (IOException ex) {
            return fail(ex);
        }
    }

    boolean hasFailed() {
        return failed;
    }

    private int fail(IOException ex) {
        failed = true;
        log.error("listAllWithPrefix::error {}", prefix, ex);
        return -1;
    }
}
