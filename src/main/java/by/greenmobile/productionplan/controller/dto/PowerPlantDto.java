package by.greenmobile.productionplan.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PowerPlantDto {

    @NotBlank
    private String name;

    /** "gasfired", "turbojet" or "windturbine". */
    @NotBlank
    private String type;

    @NotNull
    @PositiveOrZero
    private Double efficiency;

    @NotNull
    @PositiveOrZero
    private Double pmin;

    @NotNull
    @PositiveOrZero
    private Double pmax;
}
