package com.harvestlink.provenance.event;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to the mirrored event history, newest first.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private static final int MAX_LIMIT = 1000;

    private final EventSynchronizer synchronizer;

    @GetMapping
    public ResponseEntity<List<DomainEvent>> history(@RequestParam(required = false) String kind,
                                                     @RequestParam(defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        List<DomainEvent> events = kind == null || kind.isBlank()
                ? synchronizer.history()
                : synchronizer.history(DomainEventKind.fromEventName(kind)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown event kind: " + kind)));
        return ResponseEntity.ok(events.size() > limit ? events.subList(0, limit) : events);
    }
}
