package com.flamingo.ai.contextengine.service.cache;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

/**
 * Binary codec for cached vectors.
 *
 * <p>Layout: one flag byte, then either the raw little-endian float32 values ({@code 0}) or a
 * 4-byte little-endian original length followed by an LZ4 block ({@code 1}). Payloads are only
 * compressed above the threshold and only when compression actually shrinks them.
 */
public class VectorCodec {

  static final byte FLAG_RAW = 0;
  static final byte FLAG_COMPRESSED = 1;

  private static final int HEADER_BYTES = 1;
  private static final int LENGTH_BYTES = 4;

  private final int compressionThresholdBytes;
  private final LZ4Compressor compressor;
  private final LZ4SafeDecompressor decompressor;

  public VectorCodec(int compressionThresholdBytes) {
    this.compressionThresholdBytes = compressionThresholdBytes;
    LZ4Factory factory = LZ4Factory.fastestInstance();
    this.compressor = factory.fastCompressor();
    this.decompressor = factory.safeDecompressor();
  }

  /** Result of encoding a vector. */
  public record Encoded(byte[] payload, int rawSize, boolean compressed) {

    /** Size ratio of the stored body against the raw float bytes. */
    public double ratio() {
      return rawSize == 0 ? 1.0 : (double) (payload.length - HEADER_BYTES) / rawSize;
    }
  }

  public Encoded encode(List<Float> vector) {
    byte[] raw = toBytes(vector);

    if (raw.length > compressionThresholdBytes) {
      byte[] compressed = compressor.compress(raw);
      if (compressed.length + LENGTH_BYTES < raw.length) {
        ByteBuffer buffer =
            ByteBuffer.allocate(HEADER_BYTES + LENGTH_BYTES + compressed.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(FLAG_COMPRESSED).putInt(raw.length).put(compressed);
        return new Encoded(buffer.array(), raw.length, true);
      }
    }

    byte[] payload = new byte[HEADER_BYTES + raw.length];
    payload[0] = FLAG_RAW;
    System.arraycopy(raw, 0, payload, HEADER_BYTES, raw.length);
    return new Encoded(payload, raw.length, false);
  }

  /**
   * Decodes a payload produced by {@link #encode(List)}.
   *
   * @throws IllegalArgumentException if the payload is malformed
   */
  public List<Float> decode(byte[] payload) {
    if (payload == null || payload.length < HEADER_BYTES) {
      throw new IllegalArgumentException("Empty vector payload");
    }

    byte flag = payload[0];
    if (flag == FLAG_RAW) {
      return fromBytes(payload, HEADER_BYTES, payload.length - HEADER_BYTES);
    }
    if (flag != FLAG_COMPRESSED) {
      throw new IllegalArgumentException("Unknown vector payload flag: " + flag);
    }
    if (payload.length < HEADER_BYTES + LENGTH_BYTES) {
      throw new IllegalArgumentException("Truncated compressed vector payload");
    }

    ByteBuffer header = ByteBuffer.wrap(payload, HEADER_BYTES, LENGTH_BYTES);
    int originalLength = header.order(ByteOrder.LITTLE_ENDIAN).getInt();
    if (originalLength < 0 || originalLength % Float.BYTES != 0) {
      throw new IllegalArgumentException("Invalid original length: " + originalLength);
    }

    byte[] restored = new byte[originalLength];
    int bodyOffset = HEADER_BYTES + LENGTH_BYTES;
    int written;
    try {
      written =
          decompressor.decompress(
              payload, bodyOffset, payload.length - bodyOffset, restored, 0, originalLength);
    } catch (LZ4Exception e) {
      throw new IllegalArgumentException("Corrupt compressed vector payload", e);
    }
    if (written != originalLength) {
      throw new IllegalArgumentException(
          "Decompressed " + written + " bytes, expected " + originalLength);
    }
    return fromBytes(restored, 0, restored.length);
  }

  private static byte[] toBytes(List<Float> vector) {
    ByteBuffer buffer =
        ByteBuffer.allocate(vector.size() * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (Float value : vector) {
      buffer.putFloat(value != null ? value : 0f);
    }
    return buffer.array();
  }

  private static List<Float> fromBytes(byte[] bytes, int offset, int length) {
    if (length % Float.BYTES != 0) {
      throw new IllegalArgumentException("Vector body is not a multiple of 4 bytes: " + length);
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, length).order(ByteOrder.LITTLE_ENDIAN);
    List<Float> vector = new ArrayList<>(length / Float.BYTES);
    while (buffer.remaining() >= Float.BYTES) {
      vector.add(buffer.getFloat());
    }
    return Collections.unmodifiableList(vector);
  }
}
