package com.gaming.loyalty.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class JsonMapConverter extends JsonColumnConverter<Map<String, Object>> {

    public JsonMapConverter() {
        super(new TypeReference<Map<String, Object>>() {
        });
    }
}
