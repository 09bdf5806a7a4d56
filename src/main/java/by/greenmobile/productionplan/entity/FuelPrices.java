package by.greenmobile.productionplan.entity;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Цены на топливо и доступность ветра, приходят с каждым запросом.
 */
@Value
@AllArgsConstructor
public class FuelPrices {
    /** Газ, евро/МВт·ч. */
    double gas;

    /** Керосин, евро/МВт·ч. */
    double kerosine;

    /** Квота CO2, евро/т. */
    double co2;

    /** Доступность ветра, % в [0, 100]. */
    double windPercent;
}
