package com.gaming.loyalty.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gaming.loyalty.domain.RewardConfig;
import jakarta.persistence.Converter;

@Converter
public class RewardConfigConverter extends JsonColumnConverter<RewardConfig> {

    public RewardConfigConverter() {
        super(new TypeReference<RewardConfig>() {
        });
    }
}
