package by.greenmobile.productionplan.controller;

import by.greenmobile.productionplan.controller.dto.FuelsDto;
import by.greenmobile.productionplan.controller.dto.PlanItemDto;
import by.greenmobile.productionplan.controller.dto.PowerPlantDto;
import by.greenmobile.productionplan.controller.dto.ProductionPlanRequest;
import by.greenmobile.productionplan.entity.DispatchRequest;
import by.greenmobile.productionplan.entity.FuelPrices;
import by.greenmobile.productionplan.entity.PlantType;
import by.greenmobile.productionplan.entity.PowerPlant;
import by.greenmobile.productionplan.entity.ProductionAssignment;
import by.greenmobile.productionplan.service.ProductionPlanService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
@Slf4j
public class ProductionPlanController {

    private final ProductionPlanService productionPlanService;

    @PostMapping("/productionplan")
    public List<PlanItemDto> productionPlan(@Valid @RequestBody ProductionPlanRequest body) {
        log.info("HTTP /productionplan: load={} plants={}", body.getLoad(), body.getPowerplants().size());

        List<ProductionAssignment> plan = productionPlanService.computePlan(toDispatchRequest(body));

        return plan.stream()
                .map(a -> new PlanItemDto(a.getName(), a.getPower()))
                .collect(Collectors.toList());
    }

    private DispatchRequest toDispatchRequest(ProductionPlanRequest body) {
        FuelsDto f = body.getFuels();
        FuelPrices fuels = new FuelPrices(f.getGas(), f.getKerosine(), f.getCo2(), f.getWind());

        List<PowerPlant> plants = body.getPowerplants().stream()
                .map(this::toPowerPlant)
                .collect(Collectors.toList());

        return new DispatchRequest(body.getLoad(), fuels, plants);
    }

    private PowerPlant toPowerPlant(PowerPlantDto dto) {
        return PowerPlant.builder()
                .name(dto.getName())
                .type(PlantType.fromCode(dto.getType()))
                .efficiency(dto.getEfficiency())
                .pmin(dto.getPmin())
                .pmax(dto.getPmax())
                .build();
    }
}
