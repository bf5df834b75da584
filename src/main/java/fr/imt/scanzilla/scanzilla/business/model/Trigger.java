package fr.imt.scanzilla.scanzilla.business.model;

import java.util.List;

public record Trigger(List<String> events) {

    private static final List<String> PULL_REQUEST_EVENTS = List.of("pull_request", "pull_request_target");

    public Trigger {
        events = List.copyOf(events);
    }

    public static Trigger none() {
        return new Trigger(List.of());
    }

    public boolean hasPullRequestTrigger() {
        return events.stream().anyMatch(PULL_REQUEST_EVENTS::contains);
    }
}
