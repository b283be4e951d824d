package com.finance.anomaly.engine.timeseries;

import com.finance.anomaly.engine.statistics.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Spectral-residual spike detector.
 *
 * <p>The series is detrended (least squares) and mirror-padded by one window on each side. The
 * saliency map is the inverse DFT of the spectrum with its log-amplitude replaced by the residual
 * against a short trailing average. Each point's saliency is compared with the mean saliency of its
 * judgement neighbourhood; the relative excess, divided by 10 and clamped to [0, 1], is the score.
 *
 * <p>Window sizes: window = min(max(3, n/3), max(3, n/5)); averaging = min(3, max(1, window/4));
 * judgement = max(3, min(n/8, window)). Series shorter than the minimum length yield no signals.
 *
 * <p>A point is only reported when its detrended value is also more than {@code minDeviationSigma}
 * robust standard deviations (1.4826 * MAD) from the median detrended value. With zero MAD any
 * non-zero deviation qualifies.
 */
public class SpikeDetector {

    private static final double EPS = 1e-8;
    private static final double SCORE_SCALE = 10.0;
    private static final double MAD_TO_SIGMA = 1.4826;

    private final double threshold;
    private final int minLength;
    private final double minDeviationSigma;

    public SpikeDetector(double threshold, int minLength, double minDeviationSigma) {
        this.threshold = threshold;
        this.minLength = Math.max(8, minLength);
        this.minDeviationSigma = minDeviationSigma;
    }

    public List<SeriesSignal> detect(double[] values) {
        int n = values.length;
        List<SeriesSignal> signals = new ArrayList<>();
        if (n < minLength) return signals;

        int window = Math.min(Math.max(3, n / 3), Math.max(3, n / 5));
        int averaging = Math.min(3, Math.max(1, window / 4));
        int judgement = Math.max(3, Math.min(n / 8, window));

        double[] detrended = detrend(values);
        double maxAbs = 0.0;
        double scale = 1.0;
        for (int i = 0; i < n; i++) {
            maxAbs = Math.max(maxAbs, Math.abs(detrended[i]));
            scale = Math.max(scale, Math.abs(values[i]));
        }
        // Constant or perfectly linear: nothing stands out
        if (maxAbs <= 1e-9 * scale) return signals;

        double center = DescriptiveStatistics.median(detrended);
        double[] absDeviations = new double[n];
        for (int i = 0; i < n; i++) {
            absDeviations[i] = Math.abs(detrended[i] - center);
        }
        double sigma = MAD_TO_SIGMA * DescriptiveStatistics.median(absDeviations);
        double minDeviation = sigma > 0.0 ? minDeviationSigma * sigma : 1e-9 * scale;

        double[] padded = mirrorPad(detrended, window);
        double[] saliency = saliency(padded, averaging);

        for (int i = 0; i < n; i++) {
            if (absDeviations[i] <= minDeviation) continue;
            double own = saliency[i + window];
            double sum = 0.0;
            int count = 0;
            for (int j = Math.max(0, i - judgement); j <= Math.min(n - 1, i + judgement); j++) {
                if (j == i) continue;
                sum += saliency[j + window];
                count++;
            }
            double baseline = count > 0 ? sum / count : 0.0;
            double raw = Math.abs(own - baseline) / Math.max(baseline, EPS);
            double score = Math.min(1.0, Math.max(0.0, raw / SCORE_SCALE));
            if (score > threshold) {
                signals.add(new SeriesSignal(i, score));
            }
        }
        return signals;
    }

    static double[] detrend(double[] values) {
        int n = values.length;
        double meanX = (n - 1) / 2.0;
        double meanY = 0.0;
        for (double v : values) meanY += v;
        meanY /= n;
        double sxx = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < n; i++) {
            sxx += (i - meanX) * (i - meanX);
            sxy += (i - meanX) * (values[i] - meanY);
        }
        double slope = sxx == 0.0 ? 0.0 : sxy / sxx;
        double intercept = meanY - slope * meanX;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = values[i] - (intercept + slope * i);
        }
        return out;
    }

    /**
     * Reflects {@code pad} points at each end without repeating the edge point.
     */
    static double[] mirrorPad(double[] values, int pad) {
        int n = values.length;
        double[] out = new double[n + 2 * pad];
        for (int i = 0; i < pad; i++) {
            out[i] = values[pad - i];
            out[pad + n + i] = values[n - 2 - i];
        }
        System.arraycopy(values, 0, out, pad, n);
        return out;
    }

    static double[] saliency(double[] values, int averaging) {
        int n = values.length;
        double[] re = new double[n];
        double[] im = new double[n];
        dft(values, new double[n], re, im, false);

        double[] amplitude = new double[n];
        double[] logAmplitude = new double[n];
        for (int k = 0; k < n; k++) {
            amplitude[k] = Math.hypot(re[k], im[k]);
            logAmplitude[k] = amplitude[k] > EPS ? Math.log(amplitude[k]) : 0.0;
        }

        double[] residualRe = new double[n];
        double[] residualIm = new double[n];
        for (int k = 0; k < n; k++) {
            if (amplitude[k] <= EPS) continue;
            int from = Math.max(0, k - averaging + 1);
            double avg = 0.0;
            for (int j = from; j <= k; j++) avg += logAmplitude[j];
            avg /= (k - from + 1);
            double magnitude = Math.exp(logAmplitude[k] - avg);
            residualRe[k] = re[k] / amplitude[k] * magnitude;
            residualIm[k] = im[k] / amplitude[k] * magnitude;
        }

        double[] outRe = new double[n];
        double[] outIm = new double[n];
        dft(residualRe, residualIm, outRe, outIm, true);
        double[] saliency = new double[n];
        for (int t = 0; t < n; t++) {
            saliency[t] = Math.hypot(outRe[t], outIm[t]);
        }
        return saliency;
    }

    // Plain O(n^2) DFT; series here are a few dozen points long
    private static void dft(double[] inRe, double[] inIm, double[] outRe, double[] outIm, boolean inverse) {
        int n = inRe.length;
        double sign = inverse ? 1.0 : -1.0;
        for (int k = 0; k < n; k++) {
            double sumRe = 0.0;
            double sumIm = 0.0;
            for (int t = 0; t < n; t++) {
                double angle = sign * 2.0 * Math.PI * k * t / n;
                double cos = Math.cos(angle);
                double sin = Math.sin(angle);
                sumRe += inRe[t] * cos - inIm[t] * sin;
                sumIm += inRe[t] * sin + inIm[t] * cos;
            }
            if (inverse) {
                sumRe /= n;
                sumIm /= n;
            }
            outRe[k] = sumRe;
            outIm[k] = sumIm;
        }
    }
}
