package com.webapp.backend_telemetry.dtos;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Timeline {
    @JsonDeserialize(using = LenientDeserializers.LenientDoubleList.class)
    private List<Double> memoryKb;

    @JsonAlias("cpu")
    @JsonDeserialize(using = LenientDeserializers.LenientDoubleList.class)
    private List<Double> cpuPercent;
}
