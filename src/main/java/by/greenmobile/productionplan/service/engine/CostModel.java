package by.greenmobile.productionplan.service.engine;

import by.greenmobile.productionplan.config.DispatchProperties;
import by.greenmobile.productionplan.entity.EvaluatedPlant;
import by.greenmobile.productionplan.entity.FuelPrices;
import by.greenmobile.productionplan.entity.PowerPlant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Стоимость МВт·ч станции при текущих ценах на топливо и её рабочее окно [pmin, pmax].
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CostModel {

    private final DispatchProperties properties;

    public EvaluatedPlant evaluate(PowerPlant plant, int inputIndex, FuelPrices fuels) {
        double cost = marginalCost(plant, fuels);
        double pmin = effectivePmin(plant);
        double pmax = effectivePmax(plant, fuels);

        log.debug("COST: {} type={} eff={} cost={} window=[{}, {}]",
                plant.getName(), plant.getType(), plant.getEfficiency(), cost, pmin, pmax);

        return new EvaluatedPlant(plant, inputIndex, cost, pmin, pmax);
    }

    public List<EvaluatedPlant> evaluateAll(List<PowerPlant> plants, FuelPrices fuels) {
        List<EvaluatedPlant> out = new ArrayList<>(plants.size());
        for (int i = 0; i < plants.size(); i++) {
            out.add(evaluate(plants.get(i), i, fuels));
        }
        return out;
    }

    /**
     * Стоимость за МВт·ч электроэнергии:
     * - газ: gas / eff + co2 * коэффициент выбросов (одинаковый для всех газовых станций);
     * - турбореактивная: kerosine / eff;
     * - ветер: 0.
     */
    public double marginalCost(PowerPlant plant, FuelPrices fuels) {
        return switch (plant.getType()) {
            case GAS_FIRED -> fuels.getGas() / plant.getEfficiency()
                    + fuels.getCo2() * properties.getCo2EmissionFactor();
            case TURBOJET -> fuels.getKerosine() / plant.getEfficiency();
            case WIND_TURBINE -> 0.0;
        };
    }

    public double effectivePmin(PowerPlant plant) {
        return switch (plant.getType()) {
            case GAS_FIRED, TURBOJET -> plant.getPmin();
            case WIND_TURBINE -> 0.0;
        };
    }

    /**
     * Для ветра pmax масштабируется доступностью ветра.
     * Сначала умножаем, потом делим: 150 * 60 / 100 даёт ровно 90.
     */
    public double effectivePmax(PowerPlant plant, FuelPrices fuels) {
        return switch (plant.getType()) {
            case GAS_FIRED, TURBOJET -> plant.getPmax();
            case WIND_TURBINE -> plant.getPmax() * fuels.getWindPercent() / 100.0;
        };
    }
}
