package com.z254.genesis.mnemos.store;

import com.z254.genesis.mnemos.domain.MemoryRecord;
import com.z254.genesis.testing.fixtures.TestDataFactories;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RecordCodecTest {

    private final RecordCodec codec = new RecordCodec();

    private MemoryRecord record() {
        return MemoryRecord.builder()
                .id("m-1")
                .content("hello")
                .createdAt(TestDataFactories.EPOCH)
                .themes(Set.of("travel"))
                .emotions(TestDataFactories.emotions("joy", 0.5))
                .build();
    }

    @Test
    void checksumCoversTheBodyAfterTheHeader() {
        RecordCodec.Encoded encoded = codec.encode(record());
        String file = new String(encoded.bytes(), StandardCharsets.UTF_8);

        String header = file.substring(0, file.indexOf('\n'));
        String body = file.substring(file.indexOf('\n') + 1);

        assertThat(header).isEqualTo("sha256:" + encoded.record().getChecksum());
        assertThat(RecordCodec.sha256(body.getBytes(StandardCharsets.UTF_8))).isEqualTo(encoded.record().getChecksum());
        assertThat(body).doesNotContain("checksum");
    }

    @Test
    void encodingIsStableForEqualRecords() {
        assertThat(codec.encode(record()).bytes()).isEqualTo(codec.encode(record()).bytes());
    }

    @Test
    void decodesWhatItEncodes() {
        RecordCodec.Encoded encoded = codec.encode(record());

        assertThat(codec.decode(encoded.bytes())).hasValueSatisfying(decoded -> {
            assertThat(decoded.getContent()).isEqualTo("hello");
            assertThat(decoded.getCreatedAt()).isEqualTo(TestDataFactories.EPOCH);
            assertThat(decoded.getChecksum()).isEqualTo(encoded.record().getChecksum());
        });
    }

    @Test
    void rejectsTamperedBody() {
        byte[] bytes = codec.encode(record()).bytes();
        bytes[bytes.length - 3] ^= 0x01;

        assertThat(codec.decode(bytes)).isEmpty();
    }

    @Test
    void rejectsMissingOrTruncatedHeader() {
        assertThat(codec.decode("{\"id\":\"m-1\"}".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(codec.decode(new byte[0])).isEmpty();
        assertThat(codec.decode("sha256:abc\n{}".getBytes(StandardCharsets.UTF_8))).isEmpty();
    }
}
