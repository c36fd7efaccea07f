package com.questrail.svga.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SvgaObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onDecode(SvgaDecodeEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onEncode(SvgaEncodeEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRepair(SvgaRepairEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<SvgaRepairEvent> getRepairs() {
        return events.stream()
            .filter(e -> e instanceof SvgaRepairEvent)
            .map(e -> (SvgaRepairEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<SvgaRepairEvent> getRepairs(RepairKind kind) {
        return getRepairs().stream()
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized List<SvgaDecodeEvent> getDecodes() {
        return events.stream()
            .filter(e -> e instanceof SvgaDecodeEvent)
            .map(e -> (SvgaDecodeEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<SvgaEncodeEvent> getEncodes() {
        return events.stream()
            .filter(e -> e instanceof SvgaEncodeEvent)
            .map(e -> (SvgaEncodeEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
