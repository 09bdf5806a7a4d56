package by.greenmobile.productionplan.service.engine;

import by.greenmobile.productionplan.config.DispatchProperties;
import by.greenmobile.productionplan.entity.EvaluatedPlant;
import by.greenmobile.productionplan.entity.ProductionAssignment;
import by.greenmobile.productionplan.exception.InfeasibleDemandException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Округление плана до 0.1 МВт.
 *
 * 1) каждое значение округляется half-up и остаётся внутри окна [pmin, pmax] своей станции;
 * 2) невязка (load - сумма) отдаётся одной станции: самой загруженной, при равенстве более дешёвой.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoundingReconciler {

    private static final int SCALE = 1;

    private final DispatchProperties properties;

    /**
     * @param meritOrder станции в порядке стоимости
     * @param raw        неокруглённая мощность по имени станции
     * @return план в порядке запроса, включая станции с нулём
     */
    public List<ProductionAssignment> reconcile(List<EvaluatedPlant> meritOrder, Map<String, Double> raw, double load) {
        int n = meritOrder.size();
        BigDecimal[] rounded = new BigDecimal[n];
        BigDecimal sum = BigDecimal.ZERO;

        for (int i = 0; i < n; i++) {
            EvaluatedPlant plant = meritOrder.get(i);
            rounded[i] = roundWithinWindow(plant, raw.getOrDefault(plant.getName(), 0.0));
            sum = sum.add(rounded[i]);
        }

        // сетка 0.1: станции вне сетки (окно уже шага) остаются точными и в невязку не попадают
        BigDecimal residual = BigDecimal.valueOf(load).subtract(sum).setScale(SCALE, RoundingMode.HALF_UP);

        if (residual.signum() != 0) {
            int absorber = findAbsorber(meritOrder, rounded, residual);
            if (absorber >= 0) {
                log.debug("ROUND: residual {} MW -> {}", residual, meritOrder.get(absorber).getName());
                rounded[absorber] = rounded[absorber].add(residual);
            } else if (residual.abs().doubleValue() > properties.getToleranceMw()) {
                throw new InfeasibleDemandException("Rounding residual of " + residual
                        + " MW cannot be absorbed by any running plant");
            } else {
                log.debug("ROUND: residual {} MW left in place, within tolerance", residual);
            }
        }

        List<Integer> byInput = new ArrayList<>();
        for (int i = 0; i < n; i++) byInput.add(i);
        byInput.sort(Comparator.comparingInt(i -> meritOrder.get(i).getInputIndex()));

        List<ProductionAssignment> out = new ArrayList<>(n);
        for (int i : byInput) {
            out.add(new ProductionAssignment(meritOrder.get(i).getName(), rounded[i].doubleValue()));
        }
        return out;
    }

    /**
     * Half-up до 0.1 и возврат в окно [ceil(pmin), floor(pmax)].
     * Если в окне нет ни одного значения с шагом 0.1 (например pmin = pmax = 10.04),
     * станция получает точное значение, зажатое в [pmin, pmax].
     */
    BigDecimal roundWithinWindow(EvaluatedPlant plant, double value) {
        BigDecimal r = round(value);
        if (r.signum() <= 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        if (!hasGridPoint(plant)) {
            double exact = Math.min(Math.max(value, plant.getEffectivePmin()), plant.getEffectivePmax());
            return BigDecimal.valueOf(exact);
        }
        BigDecimal lower = lowerBound(plant);
        if (r.compareTo(lower) < 0) {
            r = lower;
        }
        BigDecimal upper = upperBound(plant);
        if (r.compareTo(upper) > 0) {
            r = upper;
        }
        return r;
    }

    /**
     * Самая загруженная работающая станция, при равенстве раньше в merit order.
     * Станции без точки сетки в окне невязку не принимают. -1, если подходящей нет.
     */
    private int findAbsorber(List<EvaluatedPlant> meritOrder, BigDecimal[] rounded, BigDecimal residual) {
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < rounded.length; i++) {
            if (rounded[i].signum() > 0 && hasGridPoint(meritOrder.get(i))) candidates.add(i);
        }
        candidates.sort(Comparator.<Integer, BigDecimal>comparing(i -> rounded[i]).reversed()
                .thenComparingInt(i -> i));

        for (int i : candidates) {
            EvaluatedPlant plant = meritOrder.get(i);
            BigDecimal next = rounded[i].add(residual);
            if (next.signum() > 0
                    && next.compareTo(lowerBound(plant)) >= 0
                    && next.compareTo(upperBound(plant)) <= 0) {
                return i;
            }
            log.debug("ROUND: {} cannot take residual {} (would be {})", plant.getName(), residual, next);
        }
        return -1;
    }

    private static boolean hasGridPoint(EvaluatedPlant plant) {
        return lowerBound(plant).compareTo(upperBound(plant)) <= 0;
    }

    private static BigDecimal upperBound(EvaluatedPlant plant) {
        return BigDecimal.valueOf(plant.getEffectivePmax()).setScale(SCALE, RoundingMode.FLOOR);
    }

    private static BigDecimal lowerBound(EvaluatedPlant plant) {
        return BigDecimal.valueOf(plant.getEffectivePmin()).setScale(SCALE, RoundingMode.CEILING);
    }

    private static BigDecimal round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
