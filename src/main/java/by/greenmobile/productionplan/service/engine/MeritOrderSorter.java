package by.greenmobile.productionplan.service.engine;

import by.greenmobile.productionplan.entity.EvaluatedPlant;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merit order: сначала дешёвые. При равной стоимости сохраняется порядок из запроса,
 * поэтому одинаковый запрос всегда даёт одинаковый план.
 */
@Component
public class MeritOrderSorter {

    static final Comparator<EvaluatedPlant> MERIT_ORDER = Comparator
            .comparingDouble(EvaluatedPlant::getMarginalCost)
            .thenComparingInt(EvaluatedPlant::getInputIndex);

    public List<EvaluatedPlant> sort(List<EvaluatedPlant> evaluated) {
        List<EvaluatedPlant> out = new ArrayList<>(evaluated);
        out.sort(MERIT_ORDER);
        return out;
    }
}
