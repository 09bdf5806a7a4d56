package by.greenmobile.productionplan.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Описание станции из запроса.
 *
 * Единицы:
 * - pmin / pmax: МВт электрической мощности
 * - efficiency: МВт·ч электроэнергии на МВт·ч топлива (для ветра не используется)
 */
@Value
@Builder
@AllArgsConstructor
public class PowerPlant {
    String name;
    PlantType type;
    double efficiency;
    double pmin;
    double pmax;
}
