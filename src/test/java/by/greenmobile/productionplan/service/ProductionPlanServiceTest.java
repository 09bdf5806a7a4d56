package by.greenmobile.productionplan.service;

import by.greenmobile.productionplan.Fleet;
import by.greenmobile.productionplan.config.DispatchProperties;
import by.greenmobile.productionplan.entity.DispatchRequest;
import by.greenmobile.productionplan.entity.EvaluatedPlant;
import by.greenmobile.productionplan.entity.FuelPrices;
import by.greenmobile.productionplan.entity.PowerPlant;
import by.greenmobile.productionplan.entity.ProductionAssignment;
import by.greenmobile.productionplan.exception.InfeasibleDemandException;
import by.greenmobile.productionplan.exception.InvalidInputException;
import by.greenmobile.productionplan.service.engine.CostModel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

import static by.greenmobile.productionplan.Fleet.*;
import static org.junit.jupiter.api.Assertions.*;

class ProductionPlanServiceTest {

    private final ProductionPlanService service = Fleet.service();
    private final CostModel costModel = new CostModel(new DispatchProperties());

    @Test
    void workedExample() {
        List<ProductionAssignment> plan = service.computePlan(new DispatchRequest(910, EXAMPLE_FUELS, examplePlants()));

        assertEquals(List.of("gasfiredbig1", "gasfiredbig2", "gasfiredsomewhatsmaller", "tj1", "windpark1", "windpark2"),
                plan.stream().map(ProductionAssignment::getName).collect(Collectors.toList()));

        Map<String, Double> p = byName(plan);
        assertEquals(460.0, p.get("gasfiredbig1"));
        assertEquals(338.4, p.get("gasfiredbig2"));
        assertEquals(0.0, p.get("gasfiredsomewhatsmaller"));
        assertEquals(0.0, p.get("tj1"));
        assertEquals(90.0, p.get("windpark1"));
        assertEquals(21.6, p.get("windpark2"));
        assertEquals(910.0, sum(plan), 1e-9);
    }

    @Test
    void zeroLoadGivesAllZeroPlan() {
        List<ProductionAssignment> plan = service.computePlan(new DispatchRequest(0, EXAMPLE_FUELS, examplePlants()));

        assertEquals(6, plan.size());
        plan.forEach(a -> assertEquals(0.0, a.getPower()));
    }

    @Test
    void singlePlantBelowFloorIsInfeasible() {
        DispatchRequest request = new DispatchRequest(30, EXAMPLE_FUELS, List.of(gas("only", 0.5, 50, 100)));

        assertThrows(InfeasibleDemandException.class, () -> service.computePlan(request));
    }

    @Test
    void overCapacityIsInfeasible() {
        DispatchRequest request = new DispatchRequest(2000, EXAMPLE_FUELS, examplePlants());

        InfeasibleDemandException ex = assertThrows(InfeasibleDemandException.class, () -> service.computePlan(request));
        assertNotNull(ex.getMissingMw());
    }

    @Test
    void invalidInputIsRejectedBeforeTheEngine() {
        DispatchRequest request = new DispatchRequest(-5, EXAMPLE_FUELS, examplePlants());

        assertThrows(InvalidInputException.class, () -> service.computePlan(request));
    }

    @Test
    void calmDayLeavesWindIdle() {
        FuelPrices calm = new FuelPrices(13.4, 50.8, 20, 0);
        Map<String, Double> p = byName(service.computePlan(new DispatchRequest(480, calm, examplePlants())));

        assertEquals(0.0, p.get("windpark1"));
        assertEquals(0.0, p.get("windpark2"));
        // 20 MW after gasfiredbig1 is below every later floor except tj1, which tops out at 16
        assertEquals(380.0, p.get("gasfiredbig1"));
        assertEquals(100.0, p.get("gasfiredbig2"));
        assertEquals(0.0, p.get("gasfiredsomewhatsmaller"));
        assertEquals(0.0, p.get("tj1"));
    }

    @Test
    void offGridWindowIsNotRoundedAbovePmax() {
        DispatchRequest request = new DispatchRequest(10.04, EXAMPLE_FUELS, List.of(gas("a", 0.5, 10.04, 10.04)));

        double p = service.computePlan(request).get(0).getPower();

        assertTrue(p <= 10.04, "got " + p);
        assertEquals(10.04, p);
    }

    @Test
    void windAndCheapGasBothYieldToCostlierFloor() {
        FuelPrices windy = new FuelPrices(13.4, 50.8, 20, 100);
        List<PowerPlant> plants = List.of(
                wind("w", 10),
                gas("a", 0.5, 95, 100),
                gas("b", 0.4, 80, 100));

        Map<String, Double> p = byName(service.computePlan(new DispatchRequest(180, windy, plants)));

        assertEquals(5.0, p.get("w"));
        assertEquals(95.0, p.get("a"));
        assertEquals(80.0, p.get("b"));
    }

    @Test
    void sameRequestSamePlan() {
        DispatchRequest request = new DispatchRequest(633.3, EXAMPLE_FUELS, examplePlants());

        assertEquals(service.computePlan(request), service.computePlan(request));
    }

    @Test
    void randomFleetsRespectPlantWindows() {
        Random rnd = new Random(42);
        int feasible = 0;

        for (int run = 0; run < 500; run++) {
            FuelPrices fuels = new FuelPrices(5 + rnd.nextInt(30), 20 + rnd.nextInt(60), rnd.nextInt(40), rnd.nextInt(101));
            List<PowerPlant> plants = randomPlants(rnd, run);
            int load = rnd.nextInt(600);

            List<ProductionAssignment> plan;
            try {
                plan = service.computePlan(new DispatchRequest(load, fuels, plants));
            } catch (InfeasibleDemandException e) {
                continue;
            }
            feasible++;

            assertEquals(plants.size(), plan.size());
            assertEquals(load, sum(plan), 0.1 + 1e-9, "run " + run);

            Map<String, EvaluatedPlant> windows = costModel.evaluateAll(plants, fuels).stream()
                    .collect(Collectors.toMap(EvaluatedPlant::getName, Function.identity()));
            for (ProductionAssignment a : plan) {
                EvaluatedPlant w = windows.get(a.getName());
                assertTrue(a.getPower() >= 0, "run " + run);
                assertTrue(a.getPower() <= w.getEffectivePmax() + 1e-9, "run " + run + " " + a);
                if (a.getPower() > 0) {
                    assertTrue(a.getPower() >= w.getEffectivePmin() - 1e-9, "run " + run + " " + a);
                }
            }
        }

        assertTrue(feasible > 100, "too few feasible fleets: " + feasible);
    }

    private static List<PowerPlant> randomPlants(Random rnd, int run) {
        List<PowerPlant> plants = new ArrayList<>();
        int count = 1 + rnd.nextInt(6);
        for (int i = 0; i < count; i++) {
            String name = "p" + run + "_" + i;
            int kind = rnd.nextInt(3);
            int pmin = rnd.nextInt(80);
            int pmax = pmin + rnd.nextInt(300);
            double eff = (25 + rnd.nextInt(40)) / 100.0;
            if (kind == 0) plants.add(gas(name, eff, pmin, pmax));
            else if (kind == 1) plants.add(turbojet(name, eff, pmin / 4, pmax / 2 + pmin / 4));
            else plants.add(wind(name, pmax));
        }
        return plants;
    }

    private static Map<String, Double> byName(List<ProductionAssignment> plan) {
        return plan.stream().collect(Collectors.toMap(ProductionAssignment::getName, ProductionAssignment::getPower));
    }

    private static double sum(List<ProductionAssignment> plan) {
        return plan.stream().mapToDouble(ProductionAssignment::getPower).sum();
    }
}
