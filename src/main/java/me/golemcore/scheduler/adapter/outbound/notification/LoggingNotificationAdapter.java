package me.golemcore.scheduler.adapter.outbound.notification;

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
import me.golemcore.scheduler.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

/**
 * Writes notifications to the application log. Live clients receive them
 * through the events endpoint.
 */
@Component
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    @Override
    public void notify(JobNotification notification) {
        if (notification.success()) {
            log.info("[Notify] {} - {}{}", notification.title(), notification.message(),
                    preview(notification.outputPreview()));
        } else {
            log.warn("[Notify] {} - {}{}", notification.title(), notification.message(),
                    preview(notification.outputPreview()));
        }
    }

    private static String preview(String outputPreview) {
        return outputPreview != null ? " | " + outputPreview : "";
    }
}
