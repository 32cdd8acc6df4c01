package com.scholary.spatialaudio.job;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one successful stage execution.
 *
 * @param stage the stage
 * @param cacheHit whether the payload came from the content cache
 * @param payload the stage payload as a JSON document
 */
public record StageResult(StageName stage, boolean cacheHit, JsonNode payload) {}
