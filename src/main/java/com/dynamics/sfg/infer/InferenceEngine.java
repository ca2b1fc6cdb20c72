package com.dynamics.sfg.infer;

/**
 * The sampler behind {@code infer}: receives the compiled forward model and
 * returns equally weighted posterior draws of its free variables.
 *
 * Implementations must be interruptible. When the calling thread is
 * interrupted they stop and raise {@link InferenceException} with reason
 * {@link InferenceException.Reason#CANCELLED}, never returning partial draws.
 */
public interface InferenceEngine {

    SampleSet sample(ForwardModel model, InferenceSettings settings);
}
