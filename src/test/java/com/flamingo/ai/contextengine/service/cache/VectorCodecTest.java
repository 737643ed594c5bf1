package com.flamingo.ai.contextengine.service.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VectorCodecTest {

  private final VectorCodec codec = new VectorCodec(1024);

  @Nested
  @DisplayName("encode")
  class EncodeTests {

    @Test
    @DisplayName("should store small vectors uncompressed")
    void shouldStoreSmallVectorsUncompressed() {
      VectorCodec.Encoded encoded = codec.encode(List.of(0.1f, 0.2f, 0.3f));

      assertThat(encoded.compressed()).isFalse();
      assertThat(encoded.payload()).hasSize(1 + 3 * Float.BYTES);
      assertThat(encoded.payload()[0]).isEqualTo(VectorCodec.FLAG_RAW);
    }

    @Test
    @DisplayName("should compress large repetitive vectors")
    void shouldCompressLargeRepetitiveVectors() {
      List<Float> vector = new ArrayList<>();
      for (int i = 0; i < 1536; i++) {
        vector.add(i % 2 == 0 ? 0.0f : 1.0f);
      }

      VectorCodec.Encoded encoded = codec.encode(vector);

      assertThat(encoded.compressed()).isTrue();
      assertThat(encoded.payload()[0]).isEqualTo(VectorCodec.FLAG_COMPRESSED);
      assertThat(encoded.ratio()).isLessThan(1.0);
    }

    @Test
    @DisplayName("should keep raw bytes when compression does not shrink the payload")
    void shouldKeepRawBytesWhenCompressionDoesNotHelp() {
      Random random = new Random(7);
      List<Float> vector = new ArrayList<>();
      for (int i = 0; i < 512; i++) {
        vector.add(random.nextFloat());
      }

      VectorCodec.Encoded encoded = codec.encode(vector);

      assertThat(encoded.compressed()).isFalse();
      assertThat(codec.decode(encoded.payload())).isEqualTo(vector);
    }
  }

  @Nested
  @DisplayName("decode")
  class DecodeTests {

    @Test
    @DisplayName("should restore compressed vectors exactly")
    void shouldRestoreCompressedVectorsExactly() {
      List<Float> vector = new ArrayList<>();
      for (int i = 0; i < 1536; i++) {
        vector.add((i % 10) / 10.0f);
      }

      List<Float> decoded = codec.decode(codec.encode(vector).payload());

      assertThat(decoded).isEqualTo(vector);
    }

    @Test
    @DisplayName("should hand out vectors that cannot be modified")
    void shouldReturnUnmodifiableVectors() {
      List<Float> decoded = codec.decode(codec.encode(List.of(0.5f, 0.25f)).payload());

      assertThatThrownBy(() -> decoded.set(0, 9f))
          .isInstanceOf(UnsupportedOperationException.class);
      assertThat(decoded).containsExactly(0.5f, 0.25f);
    }

    @Test
    @DisplayName("should reject an unknown flag byte")
    void shouldRejectUnknownFlag() {
      assertThatThrownBy(() -> codec.decode(new byte[] {9, 0, 0, 0, 0}))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("flag");
    }

    @Test
    @DisplayName("should reject an empty payload")
    void shouldRejectEmptyPayload() {
      assertThatThrownBy(() -> codec.decode(new byte[0]))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject a raw body that is not a whole number of floats")
    void shouldRejectMisalignedRawBody() {
      assertThatThrownBy(() -> codec.decode(new byte[] {0, 1, 2, 3}))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject a corrupt compressed body")
    void shouldRejectCorruptCompressedBody() {
      byte[] payload = {1, 64, 0, 0, 0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};

      assertThatThrownBy(() -> codec.decode(payload)).isInstanceOf(IllegalArgumentException.class);
    }
  }
}
