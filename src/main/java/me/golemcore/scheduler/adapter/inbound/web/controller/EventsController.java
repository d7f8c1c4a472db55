package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.infrastructure.event.RunEventChannel;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Live stream of run notifications and refresh signals for open views.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventsController {

    static final String NOTIFICATION_EVENT = "notification";
    static final String REFRESH_EVENT = "refresh";
    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final RunEventChannel eventChannel;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> events() {
        Flux<ServerSentEvent<Object>> notifications = eventChannel.notifications()
                .map(notification -> ServerSentEvent.<Object>builder(notification)
                        .event(NOTIFICATION_EVENT)
                        .id(Long.toString(notification.runId()))
                        .build());
        Flux<ServerSentEvent<Object>> refreshes = eventChannel.refreshes()
                .map(refresh -> ServerSentEvent.<Object>builder(refresh).event(REFRESH_EVENT).build());
        Flux<ServerSentEvent<Object>> heartbeats = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> ServerSentEvent.<Object>builder().comment("keep-alive").build());
        return Flux.merge(notifications, refreshes, heartbeats);
    }
}
