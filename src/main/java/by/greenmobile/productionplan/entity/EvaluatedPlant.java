package by.greenmobile.productionplan.entity;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Станция с посчитанной стоимостью. Живёт только в пределах одного расчёта.
 */
@Value
@AllArgsConstructor
public class EvaluatedPlant {
    PowerPlant plant;

    /** Позиция в запросе: tie-break в merit order и порядок в ответе. */
    int inputIndex;

    /** Евро за МВт·ч. */
    double marginalCost;

    double effectivePmin;
    double effectivePmax;

    public String getName() {
        return plant.getName();
    }
}
