package me.golemcore.gurgeh.domain.model;

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

/**
 * Kind of artifact a delegated worker produces. Decides how the worker output
 * is written back.
 */
public enum DelegationTaskType {
    SERVE, CODE;

    public static DelegationTaskType fromAttribute(String value) {
        if (value != null && "code".equalsIgnoreCase(value.trim())) {
            return CODE;
        }
        return SERVE;
    }
}
