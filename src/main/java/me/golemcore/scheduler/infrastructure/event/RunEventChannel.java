package me.golemcore.scheduler.infrastructure.event;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.JobNotification;
import me.golemcore.scheduler.domain.model.RunsRefreshedEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Channels between the run sync pipeline and its consumers. Notifications and
 * refresh signals are published on separate multicast streams; events
 * published before the first subscriber arrives are buffered for it.
 */
@Component
@Slf4j
public class RunEventChannel {

    private final Sinks.Many<JobNotification> notifications = Sinks.many().multicast()
            .onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
    private final Sinks.Many<RunsRefreshedEvent> refreshes = Sinks.many().multicast()
            .onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);

    public void publishNotification(JobNotification notification) {
        Sinks.EmitResult result;
        synchronized (notifications) {
            result = notifications.tryEmitNext(notification);
        }
        if (result.isFailure()) {
            log.warn("[Events] Dropped notification for '{}': {}", notification.jobName(), result);
        }
    }

    public void publishRefresh(RunsRefreshedEvent event) {
        Sinks.EmitResult result;
        synchronized (refreshes) {
            result = refreshes.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.debug("[Events] Dropped refresh {}: {}", event.reason(), result);
        }
    }

    public Flux<JobNotification> notifications() {
        return notifications.asFlux();
    }

    public Flux<RunsRefreshedEvent> refreshes() {
        return refreshes.asFlux();
    }
}
