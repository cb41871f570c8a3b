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

package me.golemcore.support.infrastructure.seed;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.StoragePort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Copies bundled demo data ({@code classpath:seed/}) into the workspace on
 * first start. Existing files are never overwritten.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SeedDataInitializer {

    private static final List<String> ACCOUNT_FILES = List.of("customers.json", "subscriptions.json",
            "invoices.json");

    private final StoragePort storagePort;
    private final SupportProperties properties;

    @PostConstruct
    public void init() {
        if (!properties.getKnowledge().isSeedOnStartup()) {
            log.debug("[Seed] Seeding disabled");
            return;
        }
        SupportProperties.DirectoriesProperties dirs = properties.getStorage().getDirectories();
        for (String file : ACCOUNT_FILES) {
            seed("seed/accounts/" + file, dirs.getAccounts(), file);
        }
        String documents = properties.getKnowledge().getDocumentsFile();
        seed("seed/knowledge/documents.json", dirs.getKnowledge(), documents);
    }

    void seed(String resourcePath, String directory, String file) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            log.debug("[Seed] No bundled resource {}", resourcePath);
            return;
        }
        try {
            if (Boolean.TRUE.equals(storagePort.exists(directory, file).join())) {
                return;
            }
            try (InputStream in = resource.getInputStream()) {
                String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                storagePort.putText(directory, file, content).join();
            }
            log.info("[Seed] Seeded {}/{}", directory, file);
        } catch (IOException | RuntimeException e) {
            log.warn("[Seed] Failed to seed {}/{}: {}", directory, file, e.getMessage());
        }
    }
}
