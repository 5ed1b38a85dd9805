package com.z254.genesis.mnemos.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.z254.genesis.mnemos.domain.MemoryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;

/**
 * On-disk format of a record: a {@code sha256:<hex>} header line followed by the canonical
 * JSON body the digest was computed over.
 */
@Component
@Slf4j
public class RecordCodec {

    static final String CHECKSUM_PREFIX = "sha256:";

    private final ObjectMapper canonicalMapper;

    public RecordCodec() {
        this.canonicalMapper = JsonMapper.builder()
                .findAndAddModules()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    public Encoded encode(MemoryRecord record) {
        MemoryRecord unsigned = record.copy();
        unsigned.setChecksum(null);
        byte[] body;
        try {
            body = canonicalMapper.writeValueAsBytes(unsigned);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize record " + record.getId(), e);
        }
        String checksum = sha256(body);
        byte[] header = (CHECKSUM_PREFIX + checksum + "\n").getBytes(StandardCharsets.US_ASCII);
        byte[] file = Arrays.copyOf(header, header.length + body.length);
        System.arraycopy(body, 0, file, header.length, body.length);

        MemoryRecord signed = record.copy();
        signed.setChecksum(checksum);
        return new Encoded(signed, file);
    }

    /**
     * Decode a stored file.
     *
     * @return the record with its checksum set, or empty when the header is malformed, the digest
     * does not match the body, or the body is not a record
     */
    public Optional<MemoryRecord> decode(byte[] file) {
        int newline = indexOf(file, (byte) '\n');
        if (newline < 0) {
            return Optional.empty();
        }
        String header = new String(file, 0, newline, StandardCharsets.US_ASCII).trim();
        if (!header.startsWith(CHECKSUM_PREFIX)) {
            return Optional.empty();
        }
        String expected = header.substring(CHECKSUM_PREFIX.length());
        byte[] body = Arrays.copyOfRange(file, newline + 1, file.length);
        if (!expected.equalsIgnoreCase(sha256(body))) {
            return Optional.empty();
        }
        try {
            MemoryRecord record = canonicalMapper.readValue(body, MemoryRecord.class);
            record.setChecksum(expected.toLowerCase());
            return Optional.of(record);
        } catch (IOException e) {
            log.debug("Checksum verified but body is not a record: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static int indexOf(byte[] bytes, byte target) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == target) {
                return i;
            }
        }
        return -1;
    }

    public record Encoded(MemoryRecord record, byte[] bytes) {
    }
}
