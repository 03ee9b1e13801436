package com.orderschedule.service;

import com.orderschedule.dto.ParametersResponse;
import com.orderschedule.dto.ScheduleEventResponse;
import com.orderschedule.dto.ScheduleResponse;
import com.orderschedule.dto.SimulationRequest;
import com.orderschedule.simulation.EventKind;
import com.orderschedule.simulation.ReplenishmentInputs;
import com.orderschedule.simulation.ReplenishmentParameters;
import com.orderschedule.simulation.ReplenishmentScheduler;
import com.orderschedule.simulation.ScheduleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    static final int HORIZON_DAYS = 365;
    static final String NO_ORDERS_MESSAGE = "No orders needed within the next 12 months.";

    private final ReplenishmentScheduler scheduler;
    private final Clock clock;

    public ScheduleResponse simulate(SimulationRequest request) {
        ReplenishmentInputs inputs = toInputs(request);
        List<ScheduleEvent> schedule = scheduler.simulateReplenishment(inputs);
        log.info("Schedule requested | sku={} | start={} | events={}",
                 inputs.getSku(), inputs.getStartDate(), schedule.size());
        return toResponse(inputs, scheduler.computeParameters(inputs), schedule, Instant.now(clock));
    }

    public ParametersResponse parameters(SimulationRequest request) {
        return ParametersResponse.from(scheduler.computeParameters(toInputs(request)));
    }

    LocalDate today() {
        return LocalDate.now(clock);
    }

    ScheduleResponse toResponse(ReplenishmentInputs inputs, ReplenishmentParameters parameters,
                                List<ScheduleEvent> schedule, Instant generatedAt) {
        int orderCount = (int) schedule.stream()
            .filter(e -> e.getEventKind() == EventKind.ORDER_PLACED)
            .count();
        return ScheduleResponse.builder()
            .generatedAt(generatedAt)
            .sku(inputs.getSku())
            .productTitle(inputs.getProductTitle())
            .variantTitle(inputs.getVariantTitle())
            .startDate(inputs.getStartDate())
            .horizonEnd(inputs.getStartDate().plusDays(HORIZON_DAYS))
            .parameters(ParametersResponse.from(parameters))
            .orderCount(orderCount)
            .eventCount(schedule.size())
            .message(schedule.isEmpty() ? NO_ORDERS_MESSAGE : null)
            .events(schedule.stream().map(ScheduleEventResponse::from).toList())
            .build();
    }

    private ReplenishmentInputs toInputs(SimulationRequest request) {
        return ReplenishmentInputs.builder()
            .productTitle(request.getProductTitle())
            .variantTitle(request.getVariantTitle())
            .sku(request.getSku())
            .dailyDemand(request.getDailyDemand())
            .leadTimeDays(request.getLeadTimeDays())
            .shippingTimeDays(request.getShippingTimeDays())
            .safetyStockDays(request.getSafetyStockDays())
            .startingInventory(request.getStartingInventory())
            .startDate(request.getStartDate() != null ? request.getStartDate() : today())
            .inTransitQuantity(request.getInTransitQuantity())
            .inTransitArrivalDate(request.getInTransitArrivalDate())
            .build();
    }
}
