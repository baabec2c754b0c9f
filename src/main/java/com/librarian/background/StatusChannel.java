package com.librarian.background;

import java.io.PrintStream;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Line codec for the worker-to-owner status channel. Each event is one line on the worker's stdout, tagged with
 * {@link #PREFIX} so stray output on the same stream is ignored.
 */
public final class StatusChannel {
    public static final String PREFIX = "@@librarian-status ";

    private static final Logger log = LoggerFactory.getLogger(StatusChannel.class);
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private StatusChannel() {
    }

    public static String encode(StatusEvent event) {
        try {
            return PREFIX + MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode status event " + event.phase(), e);
        }
    }

    public static Optional<StatusEvent> decode(String line) {
        if (line == null || !line.startsWith(PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(line.substring(PREFIX.length()), StatusEvent.class));
        } catch (JsonProcessingException e) {
            log.warn("Dropping undecodable status line: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Producer side, owned by the worker. */
    public static final class Writer {
        private final PrintStream out;

        public Writer(PrintStream out) {
            this.out = out;
        }

        public synchronized void emit(StatusEvent event) {
            out.println(encode(event));
            out.flush();
        }
    }
}
