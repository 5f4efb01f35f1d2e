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

package com.danielgmyers.mirror.store;

/**
 * Loads and saves workflow envelopes. Implementations are expected to do I/O and may fail with
 * {@link DocumentStoreException}.
 */
public interface DocumentStore {

    /**
     * Fetches the envelope of the workflow with the given id.
     */
    WorkflowEnvelope load(String workflowId);

    /**
     * Persists the envelope, replacing the stored workflow with the same id.
     */
    void save(WorkflowEnvelope envelope);
}
