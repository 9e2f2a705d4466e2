package com.jedi.catalog.service;

import com.jedi.catalog.persistence.FlareEventEntity;
import com.jedi.catalog.persistence.FlareEventRepository;
import com.jedi.catalog.pipeline.FlareEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads the stored flare list in ascending peak time order. The index of each event is its
 * position in that order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FlareEventLoader {

    private final FlareEventRepository repository;

    public List<FlareEvent> loadAll() {
        List<FlareEventEntity> entities = repository.findAllOrderByPeakTimeAsc();

        List<FlareEvent> events = new ArrayList<>(entities.size());
        for (FlareEventEntity entity : entities) {
            events.add(new FlareEvent(events.size(), entity.getStartTime(), entity.getPeakTime(), entity.getGoesClass()));
        }

        log.info("Loaded {} flare events", events.size());
        return events;
    }
}
