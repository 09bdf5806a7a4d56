package by.greenmobile.productionplan.service.engine;

import by.greenmobile.productionplan.config.DispatchProperties;
import by.greenmobile.productionplan.entity.EvaluatedPlant;
import by.greenmobile.productionplan.exception.InfeasibleDemandException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Распределение нагрузки по станциям, уже отсортированным по merit order.
 *
 * Два этапа:
 * 1) жадный проход: каждая станция берёт min(remaining, pmax), пока это не ниже её pmin;
 * 2) на первой станции, у которой pmin больше остатка ("граничная"):
 *    - пропускаем её, если более дорогие станции закрывают остаток сами;
 *    - иначе уже загруженные станции (от последней к первой) уступают мощность,
 *      каждая не ниже своего pmin, чтобы граничная встала ровно на свой pmin.
 *
 * Ремонт выполняется один раз, только для граничной станции.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AllocationEngine {

    private final DispatchProperties properties;

    /**
     * @return неокруглённая мощность по имени станции, в merit order, все станции присутствуют
     * @throws InfeasibleDemandException если план, точно покрывающий load, построить нельзя
     */
    public Map<String, Double> allocate(List<EvaluatedPlant> meritOrder, double load) {
        double eps = properties.getEpsilon();

        double capacity = meritOrder.stream().mapToDouble(EvaluatedPlant::getEffectivePmax).sum();
        if (load > capacity + eps) {
            double missing = load - capacity;
            throw new InfeasibleDemandException(String.format(Locale.US,
                    "Unable to meet load demand with available plants. Missing: %.1f MW", missing), missing);
        }

        double[] out = new double[meritOrder.size()];
        if (load > eps && !fill(meritOrder, 0, load, out)) {
            throw new InfeasibleDemandException(String.format(Locale.US,
                    "Load %.1f MW cannot be matched without running a plant below its minimum output", load));
        }

        Map<String, Double> raw = new LinkedHashMap<>();
        for (int i = 0; i < out.length; i++) {
            raw.put(meritOrder.get(i).getName(), out[i]);
        }
        return raw;
    }

    /**
     * Покрывает {@code amount} станциями {@code from..end}, пишет в {@code out}.
     * При неудаче {@code out} может содержать частичный результат, поэтому вызывающий передаёт копию.
     */
    private boolean fill(List<EvaluatedPlant> order, int from, double amount, double[] out) {
        double eps = properties.getEpsilon();
        double remaining = amount;
        List<Integer> committed = new ArrayList<>();

        for (int i = from; i < order.size() && remaining > eps; i++) {
            EvaluatedPlant plant = order.get(i);
            double want = Math.min(remaining, plant.getEffectivePmax());
            if (want <= eps) continue;

            if (want >= plant.getEffectivePmin() - eps) {
                out[i] = want;
                remaining -= want;
                committed.add(i);
                log.debug("ALLOC: {} <- {} MW (remaining {})", plant.getName(), want, remaining);
                continue;
            }

            // остаток ниже pmin этой станции
            return skipBoundary(order, i, remaining, out)
                    || repairBoundary(order, i, committed, remaining, out);
        }

        return remaining <= eps;
    }

    private boolean skipBoundary(List<EvaluatedPlant> order, int boundary, double remaining, double[] out) {
        double[] trial = out.clone();
        if (!fill(order, boundary + 1, remaining, trial)) {
            return false;
        }
        System.arraycopy(trial, 0, out, 0, out.length);
        log.debug("ALLOC: skip {} (pmin={} > residual={}), covered by costlier plants",
                order.get(boundary).getName(), order.get(boundary).getEffectivePmin(), remaining);
        return true;
    }

    /**
     * Недостающее до pmin граничной станции (shortfall) снимается с загруженных станций,
     * начиная с последней: каждая опускается не ниже своего pmin. Если запаса не хватает,
     * ничего не меняем и возвращаем false.
     */
    private boolean repairBoundary(List<EvaluatedPlant> order, int boundary, List<Integer> committed,
                                   double remaining, double[] out) {
        double eps = properties.getEpsilon();
        EvaluatedPlant current = order.get(boundary);
        double shortfall = current.getEffectivePmin() - remaining;

        double[] cut = new double[out.length];
        double needed = shortfall;
        for (int k = committed.size() - 1; k >= 0 && needed > eps; k--) {
            int idx = committed.get(k);
            double headroom = out[idx] - order.get(idx).getEffectivePmin();
            if (headroom <= 0) continue;
            cut[idx] = Math.min(headroom, needed);
            needed -= cut[idx];
        }

        if (needed > eps) {
            log.debug("ALLOC: cannot repair at {}: committed plants free only {} of {} MW",
                    current.getName(), shortfall - needed, shortfall);
            return false;
        }

        for (int idx : committed) {
            if (cut[idx] > 0) {
                out[idx] -= cut[idx];
                log.debug("ALLOC: repair {} -> {} MW", order.get(idx).getName(), out[idx]);
            }
        }
        out[boundary] = current.getEffectivePmin();
        log.debug("ALLOC: {} runs at its floor {} MW", current.getName(), out[boundary]);
        return true;
    }
}
