package by.greenmobile.productionplan.service;

import by.greenmobile.productionplan.entity.DispatchRequest;
import by.greenmobile.productionplan.entity.FuelPrices;
import by.greenmobile.productionplan.entity.PowerPlant;
import by.greenmobile.productionplan.exception.InvalidInputException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural checks that must hold before the engine runs. The engine itself does not re-check them.
 */
@Component
public class PlanRequestValidator {

    public void validate(DispatchRequest request) {
        if (request == null) {
            throw new InvalidInputException("Request is empty");
        }
        if (!(request.getLoad() >= 0) || Double.isInfinite(request.getLoad())) {
            throw new InvalidInputException("Load must be a non-negative number, got " + request.getLoad());
        }
        validateFuels(request.getFuels());

        if (request.getPlants() == null) {
            throw new InvalidInputException("Power plant list is missing");
        }

        Set<String> names = new HashSet<>();
        for (PowerPlant plant : request.getPlants()) {
            validatePlant(plant);
            if (!names.add(plant.getName())) {
                throw new InvalidInputException("Duplicate power plant name: " + plant.getName());
            }
        }
    }

    private void validateFuels(FuelPrices fuels) {
        if (fuels == null) {
            throw new InvalidInputException("Fuel prices are missing");
        }
        if (fuels.getGas() < 0 || fuels.getKerosine() < 0 || fuels.getCo2() < 0) {
            throw new InvalidInputException("Fuel prices must not be negative");
        }
        if (!(fuels.getWindPercent() >= 0 && fuels.getWindPercent() <= 100)) {
            throw new InvalidInputException("Wind availability must be within [0, 100] %, got " + fuels.getWindPercent());
        }
    }

    private void validatePlant(PowerPlant plant) {
        if (plant == null || plant.getName() == null || plant.getName().isBlank()) {
            throw new InvalidInputException("Every power plant needs a name");
        }
        String name = plant.getName();
        if (plant.getType() == null) {
            throw new InvalidInputException("Unknown type for power plant " + name);
        }
        if (!(plant.getPmin() >= 0)) {
            throw new InvalidInputException("pmin of " + name + " must be >= 0");
        }
        if (!(plant.getPmax() >= plant.getPmin())) {
            throw new InvalidInputException("pmax of " + name + " is below its pmin");
        }
        if (plant.getType().isThermal() && !(plant.getEfficiency() > 0 && plant.getEfficiency() <= 1)) {
            throw new InvalidInputException("Efficiency of " + name + " must be within (0, 1], got " + plant.getEfficiency());
        }
    }
}
