/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.danielgmyers.mirror;

import com.danielgmyers.mirror.validation.ValidationReport;

/**
 * Thrown when the mirrored document fails validation. The document is not saved.
 */
public class DocumentValidationException extends MirrorException {

    private final ValidationReport report;

    public DocumentValidationException(String message, ValidationReport report) {
        super(message);
        this.report = report;
    }

    public ValidationReport getReport() {
        return report;
    }
}
