package by.greenmobile.productionplan.entity;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Validated input of one production plan calculation. Plant order is significant:
 * it is the tie-break of the merit order and the order of the resulting plan.
 */
@Value
@AllArgsConstructor
public class DispatchRequest {
    double load;
    FuelPrices fuels;
    List<PowerPlant> plants;
}
