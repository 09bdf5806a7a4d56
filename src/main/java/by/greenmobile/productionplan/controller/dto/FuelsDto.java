package by.greenmobile.productionplan.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fuel block of the request. Long keys carry the unit, short keys are accepted too.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FuelsDto {

    @NotNull
    @PositiveOrZero
    @JsonProperty("gas(euro/MWh)")
    @JsonAlias("gas")
    private Double gas;

    @NotNull
    @PositiveOrZero
    @JsonProperty("kerosine(euro/MWh)")
    @JsonAlias("kerosine")
    private Double kerosine;

    @NotNull
    @PositiveOrZero
    @JsonProperty("co2(euro/ton)")
    @JsonAlias("co2")
    private Double co2;

    @NotNull
    @DecimalMin("0")
    @DecimalMax("100")
    @JsonProperty("wind(%)")
    @JsonAlias("wind")
    private Double wind;
}
