package me.golemcore.gurgeh.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gurgeh.domain.model.DecisionRecord;
import me.golemcore.gurgeh.domain.model.WriteMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists policy decisions as one JSON file per record under
 * {@code /self/decisions/pending/}. Record ids start with the creation time
 * in epoch millis, so name order is age order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecisionRecordStore {

    static final String DECISIONS_DIR = "/self/decisions/pending";
    private static final String JSON_SUFFIX = ".json";

    private final AgentFileService fileService;
    private final ObjectMapper objectMapper;

    public void save(DecisionRecord record) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
            fileService.write(DECISIONS_DIR + "/" + record.getId() + JSON_SUFFIX, json, WriteMode.OVERWRITE);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[Policy] Failed to persist decision {}: {}", record.getId(), e.getMessage());
        }
    }

    public List<String> listIds() {
        return fileService.list(DECISIONS_DIR).stream()
                .filter(name -> name.endsWith(JSON_SUFFIX))
                .map(name -> name.substring(0, name.length() - JSON_SUFFIX.length()))
                .sorted()
                .toList();
    }

    /**
     * Deletes the oldest records so that at most {@code maxRecords} remain.
     *
     * @return number of deleted records
     */
    public int compact(int maxRecords) {
        List<String> ids = listIds();
        int excess = ids.size() - maxRecords;
        if (excess <= 0) {
            return 0;
        }
        int deleted = 0;
        for (String id : ids.subList(0, excess)) {
            try {
                if (fileService.delete(DECISIONS_DIR + "/" + id + JSON_SUFFIX)) {
                    deleted++;
                }
            } catch (RuntimeException e) {
                log.warn("[Policy] Failed to delete decision {}: {}", id, e.getMessage());
            }
        }
        log.info("[Policy] Compacted decision records: deleted {}, kept {}", deleted, ids.size() - deleted);
        return deleted;
    }
}
