package com.gaming.loyalty.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class StringListConverter extends JsonColumnConverter<List<String>> {

    public StringListConverter() {
        super(new TypeReference<List<String>>() {
        });
    }
}
