/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.jobs;

import java.util.Map;

/**
 * Contract for asynchronous job handlers.
 *
 * <p>
 * A job runner looks handlers up by {@link #handlesType()} and calls {@link #execute(Long, Map)} with the stored
 * payload.
 *
 * <p>
 * <b>Error Handling:</b> thrown exceptions mark the attempt failed. Handlers throw
 * {@link villagecompute.recommendations.exceptions.ValidationException} for payloads that can never succeed.
 */
public interface JobHandler {

    /**
     * @return the job type this handler processes
     */
    JobType handlesType();

    /**
     * Executes the job with the given payload.
     *
     * @param jobId
     *            job identifier, used for logging and tracing
     * @param payload
     *            deserialized job parameters
     * @throws Exception
     *             any error during execution
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
