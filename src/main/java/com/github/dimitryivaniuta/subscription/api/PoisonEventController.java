package com.github.dimitryivaniuta.subscription.api;

import com.github.dimitryivaniuta.subscription.persistence.PoisonEventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/poison-events")
@RequiredArgsConstructor
public class PoisonEventController {

    private final PoisonEventStore store;

    @GetMapping("/{topic}")
    public List<PoisonEventView> list(@PathVariable String topic) {
        return store.getEventsForRetrying(topic).stream()
                .map(PoisonEventView::of)
                .toList();
    }

    @GetMapping("/{topic}/count")
    public PoisonEventCount count(@PathVariable String topic) {
        return new PoisonEventCount(topic, store.count(topic));
    }

    public record PoisonEventCount(String topic, long count) {
    }
}
