package by.greenmobile.productionplan.service;

import by.greenmobile.productionplan.entity.DispatchRequest;
import by.greenmobile.productionplan.entity.EvaluatedPlant;
import by.greenmobile.productionplan.entity.ProductionAssignment;
import by.greenmobile.productionplan.service.engine.AllocationEngine;
import by.greenmobile.productionplan.service.engine.CostModel;
import by.greenmobile.productionplan.service.engine.MeritOrderSorter;
import by.greenmobile.productionplan.service.engine.RoundingReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Единая точка расчёта плана производства:
 * - проверяет запрос (PlanRequestValidator)
 * - считает стоимость и окно каждой станции (CostModel)
 * - сортирует по merit order
 * - распределяет нагрузку (AllocationEngine)
 * - округляет до 0.1 МВт (RoundingReconciler)
 *
 * Состояния нет: параллельные вызовы общего ничего не имеют, кроме настроек.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductionPlanService {

    private final PlanRequestValidator validator;
    private final CostModel costModel;
    private final MeritOrderSorter sorter;
    private final AllocationEngine allocationEngine;
    private final RoundingReconciler reconciler;

    public List<ProductionAssignment> computePlan(DispatchRequest request) {
        validator.validate(request);

        long start = System.nanoTime();
        log.info("PLAN: load={} MW, plants={}", request.getLoad(), request.getPlants().size());

        List<EvaluatedPlant> evaluated = costModel.evaluateAll(request.getPlants(), request.getFuels());
        List<EvaluatedPlant> meritOrder = sorter.sort(evaluated);
        Map<String, Double> raw = allocationEngine.allocate(meritOrder, request.getLoad());
        List<ProductionAssignment> plan = reconciler.reconcile(meritOrder, raw, request.getLoad());

        log.info("PLAN: calculated in {} ms", (System.nanoTime() - start) / 1_000_000.0);
        return plan;
    }
}
