package com.example.securechat.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * EncryptionMetadata <-> JSON text column.
 */
@Converter
public class EncryptionMetadataConverter implements AttributeConverter<EncryptionMetadata, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(EncryptionMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize encryption metadata", e);
        }
    }

    @Override
    public EncryptionMetadata convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, EncryptionMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored encryption metadata is not valid JSON", e);
        }
    }
}
