/**
 * The detection facade and its result envelope.
 *
 * <p>
 * {@link com.costsentinel.core.engine.CostAnomalyEngine} wires normalization,
 * detection, explanation and
 * {@link com.costsentinel.core.engine.ResultAssembler} into a single call
 * that never throws.
 * </p>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.engine;
