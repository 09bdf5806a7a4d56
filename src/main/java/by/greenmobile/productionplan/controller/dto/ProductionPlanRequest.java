package by.greenmobile.productionplan.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductionPlanRequest {

    /** Demand to cover, MW. */
    @NotNull
    @PositiveOrZero
    private Double load;

    @NotNull
    @Valid
    private FuelsDto fuels;

    @NotNull
    private List<@NotNull @Valid PowerPlantDto> powerplants;
}
