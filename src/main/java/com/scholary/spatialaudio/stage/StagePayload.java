package com.scholary.spatialaudio.stage;

/**
 * Typed output of a pipeline stage.
 *
 * <p>The set of implementations is closed: {@code SeparationPayload}, {@code TranscriptionPayload}
 * and {@code SpatializePayload}, one record per stage. They live with their stages in separate
 * packages, and an unnamed module only allows {@code sealed} subclasses within one package, so the
 * interface is a plain marker. Payloads are validated when they cross the adapter boundary and are
 * converted to a JSON document only for the cache, the stage artifact and the job record.
 */
public interface StagePayload {}
