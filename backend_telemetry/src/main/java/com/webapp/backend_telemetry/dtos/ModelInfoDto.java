package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ModelInfoDto {
    private String modelType;
    @Builder.Default
    private List<String> features = new ArrayList<>();
    @JsonProperty("is_trained")
    private boolean trained;
    private int trainingSize;
    private int realRows;
}
