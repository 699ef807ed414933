package com.yizhaoqi.kb.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores an embedding as a bracketed, comma separated list of floats, e.g. {@code [0.12,-0.5,1.0]}.
 */
@Converter(autoApply = false)
public class FloatArrayConverter implements AttributeConverter<float[], String> {

    @Override
    public String convertToDatabaseColumn(float[] attribute) {
        if (attribute == null) return null;

        StringBuilder sb = new StringBuilder(attribute.length * 12).append('[');
        for (int i = 0; i < attribute.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(attribute[i]);
        }
        return sb.append(']').toString();
    }

    @Override
    public float[] convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;

        String s = dbData.replaceAll("[\\[\\]]", "").trim();
        if (s.isEmpty()) return new float[0];

        String[] parts = s.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }
}
