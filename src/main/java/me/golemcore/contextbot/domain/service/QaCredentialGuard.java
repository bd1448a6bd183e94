package me.golemcore.contextbot.domain.service;

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
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide stop switch for QA calls. Once the service rejects our
 * credentials every further call would fail the same way, so calls are
 * refused for the rest of the process lifetime. The token is only read at
 * startup, so restarting the process with a fixed {@code QA_API_TOKEN} is
 * the reset.
 */
@Component
@Slf4j
public class QaCredentialGuard {

    private final AtomicReference<String> blockedReason = new AtomicReference<>();

    public boolean isBlocked() {
        return blockedReason.get() != null;
    }

    public void block(String reason) {
        String safeReason = reason == null ? "credentials rejected" : reason;
        if (blockedReason.compareAndSet(null, safeReason)) {
            log.error("[QA] Credentials rejected by QA service, refusing further calls until restart: {}",
                    safeReason);
        }
    }

    public String getBlockedReason() {
        return blockedReason.get();
    }
}
