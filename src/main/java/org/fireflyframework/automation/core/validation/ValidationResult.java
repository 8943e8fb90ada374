/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.automation.core.validation;

import java.util.ArrayList;
import java.util.List;

public record ValidationResult(boolean valid, List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ValidationResult of(List<ValidationIssue> issues) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.isError()) {
                errors.add(issue);
            } else {
                warnings.add(issue);
            }
        }
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public List<ValidationIssue> allIssues() {
        List<ValidationIssue> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }
}
