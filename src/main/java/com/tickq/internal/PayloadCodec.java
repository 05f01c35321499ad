package com.tickq.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.tickq.config.TickQProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Serializes job payloads to JSON bytes, optionally GZIP compressed. Compressed payloads are recognized by
 * the GZIP header on read, so the setting can change without migrating stored rows.
 */
@Component
public class PayloadCodec {

    private final ObjectMapper objectMapper;
    private final boolean compress;

    public PayloadCodec(@Qualifier("tickqObjectMapper") ObjectMapper objectMapper, TickQProperties properties) {
        this.objectMapper = objectMapper;
        this.compress = properties.getJobs().isCompressPayloads();
    }

    public byte[] encode(Object payload) {
        if (payload == null) {
            return null;
        }
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload of type " + payload.getClass().getName()
                    + " cannot be serialized", e);
        }
        return compress ? gzip(json) : json;
    }

    public ObjectReader readerFor(Class<?> payloadClass) {
        return objectMapper.readerFor(payloadClass);
    }

    public Object decode(byte[] payload, ObjectReader reader) throws IOException {
        if (payload == null || payload.length == 0) {
            return null;
        }
        return reader.readValue(isGzip(payload) ? gunzip(payload) : payload);
    }

    static boolean isGzip(byte[] bytes) {
        return bytes.length > 2 && (bytes[0] & 0xff) == 0x1f && (bytes[1] & 0xff) == 0x8b;
    }

    private static byte[] gzip(byte[] bytes) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(bytes.length);
        try (GZIPOutputStream out = new GZIPOutputStream(buffer)) {
            out.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress payload", e);
        }
        return buffer.toByteArray();
    }

    private static byte[] gunzip(byte[] bytes) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return StreamUtils.copyToByteArray(in);
        }
    }
}
