package me.golemcore.scheduler.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.JobNotification;
import me.golemcore.scheduler.infrastructure.event.RunEventChannel;
import me.golemcore.scheduler.port.outbound.NotificationPort;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Delivers notifications from the run event channel to every
 * {@link NotificationPort}. A failing port is logged and does not affect the
 * others.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final RunEventChannel eventChannel;
    private final List<NotificationPort> notificationPorts;

    private Disposable subscription;

    public NotificationDispatcher(RunEventChannel eventChannel, List<NotificationPort> notificationPorts) {
        this.eventChannel = eventChannel;
        this.notificationPorts = notificationPorts;
    }

    @PostConstruct
    public void start() {
        subscription = eventChannel.notifications()
                .publishOn(Schedulers.boundedElastic())
                .subscribe(this::dispatch, error -> log.error("[Notify] Notification stream failed", error));
        log.info("[Notify] Dispatching to {} notification port(s)", notificationPorts.size());
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    void dispatch(JobNotification notification) {
        for (NotificationPort port : notificationPorts) {
            try {
                port.notify(notification);
            } catch (RuntimeException e) {
                log.warn("[Notify] {} failed for '{}': {}", port.getClass().getSimpleName(),
                        notification.jobName(), e.getMessage());
            }
        }
    }
}
