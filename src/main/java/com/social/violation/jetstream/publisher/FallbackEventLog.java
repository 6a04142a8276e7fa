package com.social.violation.jetstream.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.violation.core.model.OutboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Last-resort record of events the broker never accepted.
 *
 * <p>One JSON object per line:
 * {@code {"time": 1718000000.123, "key": "violation.events", "data": {...}, "message_id": "..."}}.
 * {@code time} is unix seconds as a float.</p>
 *
 * <p>Each line goes out in a single append write under an in-process lock, so
 * concurrent failed publishes never interleave partial lines. No cross-process
 * locking is attempted.</p>
 *
 * <p>{@link #append(OutboundEvent)} never throws: a failure to write is logged
 * and swallowed so it cannot mask the publish failure already being reported.</p>
 */
public class FallbackEventLog {

    private static final Logger log = LoggerFactory.getLogger(FallbackEventLog.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Object writeLock = new Object();

    public FallbackEventLog(Path file, ObjectMapper mapper, Clock clock) {
        this.file = file;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Appends one line for the event.
     *
     * @return {@code true} if the line was written
     */
    public boolean append(OutboundEvent event) {
        try {
            byte[] line = toLine(event);
            synchronized (writeLock) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                try (FileChannel ch = FileChannel.open(file,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    ByteBuffer buf = ByteBuffer.wrap(line);
                    while (buf.hasRemaining()) {
                        ch.write(buf);
                    }
                }
            }
            log.warn("Wrote undelivered event to fallback log file={} msgId={} key={}",
                    file, event.messageId(), event.routingKey());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write fallback log file={} msgId={} key={}: {}",
                    file, event.messageId(), event.routingKey(), e.toString());
            return false;
        }
    }

    private byte[] toLine(OutboundEvent event) throws JsonProcessingException {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("time", clock.millis() / 1000.0d);
        line.put("key", event.routingKey());
        line.put("data", event.payload());
        line.put("message_id", event.messageId());

        String json;
        try {
            json = mapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            // keep the record even if the payload itself does not serialize
            line.put("data", String.valueOf(event.payload()));
            json = mapper.writeValueAsString(line);
        }
        return (json + "\n").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * All lines currently in the log; empty when the file does not exist yet.
     */
    public List<String> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read fallback log " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
