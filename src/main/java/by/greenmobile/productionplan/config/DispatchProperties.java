package by.greenmobile.productionplan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    /** Tons of CO2 per MWh of gas burnt; the same for every gas-fired plant. */
    private double co2EmissionFactor = 0.3;

    /** Accepted |sum(p) - load| after rounding, MW. */
    private double toleranceMw = 0.1;

    /** Floating point slack for MW comparisons inside the allocation engine. */
    private double epsilon = 1e-6;
}
