package com.flamingo.ai.memoryvault.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** JPA converter for persisting a {@code float[]} embedding as little-endian float32 bytes. */
@Converter
public class FloatArrayConverter implements AttributeConverter<float[], byte[]> {

  @Override
  public byte[] convertToDatabaseColumn(float[] attribute) {
    if (attribute == null) {
      return null;
    }
    ByteBuffer buffer =
        ByteBuffer.allocate(attribute.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    buffer.asFloatBuffer().put(attribute);
    return buffer.array();
  }

  @Override
  public float[] convertToEntityAttribute(byte[] dbData) {
    if (dbData == null) {
      return null;
    }
    if (dbData.length % Float.BYTES != 0) {
      throw new IllegalStateException(
          "Corrupt embedding column: " + dbData.length + " bytes is not a float32 array");
    }
    float[] vector = new float[dbData.length / Float.BYTES];
    ByteBuffer.wrap(dbData).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(vector);
    return vector;
  }
}
