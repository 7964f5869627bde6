package com.mlld.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlld.sdk.exceptions.MessageParseException;
import com.mlld.sdk.protocol.Envelope;
import com.mlld.sdk.protocol.LiveProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Reads the worker's stdout and routes each reply to the request it belongs to.
 *
 * <p>A malformed line cannot be correlated, so every request pending at that
 * moment receives {@code Closed}; reading continues with the next line. End of
 * stream or a read error closes the registry, using the worker's stderr text as
 * the reason when there is any.
 */
final class ResponseReader implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ResponseReader.class);

    static final String DEFAULT_CLOSE_REASON = "live transport closed";
    private static final long STDERR_GRACE_MILLIS = 250;

    private final BufferedReader reader;
    private final PendingRegistry registry;
    private final LiveProtocol protocol;
    private final StderrCollector stderr;

    ResponseReader(BufferedReader reader, PendingRegistry registry, LiveProtocol protocol, StderrCollector stderr) {
        this.reader = reader;
        this.registry = registry;
        this.protocol = protocol;
        this.stderr = stderr;
    }

    @Override
    public void run() {
        String closeReason = null;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
            closeReason = endOfStreamReason();
        } catch (IOException e) {
            closeReason = "live transport read error: " + e.getMessage();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while reading mlld output", e);
            closeReason = "live transport reader failed: " + e.getMessage();
        } finally {
            if (closeReason == null) {
                closeReason = DEFAULT_CLOSE_REASON;
            }
            int notified = registry.close(closeReason);
            if (notified > 0) {
                logger.debug("Live transport closed with {} pending request(s): {}", notified, closeReason);
            }
        }
    }

    void handleLine(String rawLine) {
        String line = rawLine.trim();
        if (line.isEmpty()) {
            return;
        }

        Envelope envelope;
        try {
            envelope = protocol.decode(line);
        } catch (MessageParseException e) {
            int notified = registry.failAll(e.getMessage());
            logger.warn("Discarding malformed live response ({} pending request(s) failed): {}", notified, line);
            return;
        }

        if (envelope.isEmpty()) {
            logger.debug("Ignoring live response without event or result: {}", line);
            return;
        }

        JsonNode event = envelope.getEvent();
        if (event != null) {
            OptionalLong requestId = LiveProtocol.requestIdOf(event);
            if (requestId.isEmpty() || !registry.routeEvent(requestId.getAsLong(), event)) {
                logger.debug("Dropping undeliverable event: {}", line);
            }
        }

        JsonNode result = envelope.getResult();
        if (result != null) {
            OptionalLong requestId = LiveProtocol.requestIdOf(result);
            if (requestId.isEmpty() || !registry.routeResult(requestId.getAsLong(), result)) {
                logger.debug("Dropping undeliverable result: {}", line);
            }
        }
    }

    private String endOfStreamReason() {
        // Both pipes close when the worker exits; give stderr a moment to catch up.
        stderr.awaitFinished(STDERR_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        String text = stderr.text().trim();
        return text.isEmpty() ? DEFAULT_CLOSE_REASON : text;
    }
}
