package com.dynamics.sfg.infer;

import com.dynamics.sfg.infer.InferenceException.Reason;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import lombok.extern.log4j.Log4j2;

/**
 * Sampling-importance-resampling over the prior.
 *
 * <ol>
 * <li>Draw from the priors and run the forward model, chunk by chunk, checking
 * for interruption between chunks.</li>
 * <li>Weight every draw by its likelihood; report the effective sample size
 * {@code 1 / sum(w^2)} of the normalized weights.</li>
 * <li>Resample systematically to equally weighted posterior draws.</li>
 * </ol>
 * Works for any prior family and needs no gradients, at the price of
 * degenerating when the posterior is far narrower than the prior, which the
 * effective sample size check reports as NOT_CONVERGED.
 */
@Log4j2
public final class ImportanceSamplingEngine implements InferenceEngine {

    @Override
    public SampleSet sample(ForwardModel model, InferenceSettings settings) {
        final int n = settings.getDraws();
        if (n < 1)
            throw new IllegalArgumentException("draws must be >= 1, got " + n);
        final int chunk = Math.max(1, settings.getChunkSize());
        Random random = new Random(settings.getSeed());

        Map<String, double[][]> prior = model.samplePrior(n, random);
        double[] logWeights = new double[n];
        int failed = 0;
        for (int from = 0; from < n; from += chunk) {
            checkInterrupted(from, n);
            int count = Math.min(chunk, n - from);
            ForwardModel.Pass pass = model.run(slice(prior, from, count), count);
            failed += pass.failureCount();
            System.arraycopy(model.logLikelihood(pass), 0, logWeights, from, count);
        }
        if (failed > 0)
            log.warn("Importance sampling: {} of {} draws failed numerically and carry no weight", failed, n);
        checkInterrupted(n, n);

        double max = Double.NEGATIVE_INFINITY;
        int finite = 0;
        for (double lw : logWeights) {
            if (Double.isFinite(lw)) {
                finite++;
                max = Math.max(max, lw);
            }
        }
        if (finite == 0)
            throw new InferenceException(Reason.DIVERGED, "no draw has a finite likelihood",
                    Map.of("draws", n, "finiteWeights", 0, "failedDraws", failed));

        double[] w = new double[n];
        double sum = 0;
        for (int d = 0; d < n; d++) {
            w[d] = Double.isFinite(logWeights[d]) ? Math.exp(logWeights[d] - max) : 0.0;
            sum += w[d];
        }
        double sumSq = 0;
        for (int d = 0; d < n; d++) {
            w[d] /= sum;
            sumSq += w[d] * w[d];
        }
        double ess = 1.0 / sumSq;
        double logEvidence = max + Math.log(sum / n);

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("draws", n);
        diagnostics.put("finiteWeights", finite);
        diagnostics.put("failedDraws", failed);
        diagnostics.put("effectiveSampleSize", ess);
        diagnostics.put("logEvidence", logEvidence);
        if (ess < settings.getMinEffectiveSampleSize())
            throw new InferenceException(Reason.NOT_CONVERGED, "effective sample size " + ess + " below "
                    + settings.getMinEffectiveSampleSize(), diagnostics);

        int[] picks = systematicResample(w, random);
        Map<String, double[][]> posterior = new LinkedHashMap<>();
        for (var e : prior.entrySet()) {
            double[][] src = e.getValue();
            double[][] dst = new double[n][];
            for (int d = 0; d < n; d++)
                dst[d] = src[picks[d]].clone();
            posterior.put(e.getKey(), dst);
        }
        log.info("Importance sampling: {} draws, ESS {}, log evidence {}", n, String.format("%.1f", ess),
                String.format("%.3f", logEvidence));
        return new SampleSet(n, posterior, diagnostics);
    }

    /** One uniform offset, n evenly spaced pointers into the cumulative weights. */
    static int[] systematicResample(double[] weights, Random random) {
        int n = weights.length;
        int[] out = new int[n];
        double u = random.nextDouble() / n;
        double cumulative = weights[0];
        int j = 0;
        for (int k = 0; k < n; k++) {
            double target = u + (double) k / n;
            while (target > cumulative && j < n - 1)
                cumulative += weights[++j];
            out[k] = j;
        }
        return out;
    }

    private static Map<String, double[][]> slice(Map<String, double[][]> draws, int from, int count) {
        Map<String, double[][]> out = new LinkedHashMap<>();
        for (var e : draws.entrySet())
            out.put(e.getKey(), Arrays.copyOfRange(e.getValue(), from, from + count));
        return out;
    }

    private static void checkInterrupted(int done, int total) {
        if (Thread.currentThread().isInterrupted())
            throw new InferenceException(Reason.CANCELLED, "sampling interrupted",
                    Map.of("evaluatedDraws", done, "draws", total));
    }
}
