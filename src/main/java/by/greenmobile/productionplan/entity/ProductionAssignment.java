package by.greenmobile.productionplan.entity;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class ProductionAssignment {
    String name;

    /** Мощность, МВт, шаг 0.1. */
    double power;
}
