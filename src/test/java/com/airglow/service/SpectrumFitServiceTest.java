package com.airglow.service;

import com.airglow.model.FitResult;
import com.airglow.model.Spectrum;
import org.junit.jupiter.api.Test;

import static com.airglow.service.SyntheticSpectra.AMP_A;
import static com.airglow.service.SyntheticSpectra.AMP_B;
import static com.airglow.service.SyntheticSpectra.LINE_A;
import static com.airglow.service.SyntheticSpectra.LINE_B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SpectrumFitServiceTest {

    private final SpectrumFitService service = new SpectrumFitService();

    @Test
    void recoversInjectedLinesOverPolynomialContinuum() {
        Spectrum s = SyntheticSpectra.twoLines();

        FitResult fit = service.fit(s, 4, new double[]{LINE_A, LINE_B});

        assertThat(fit.status).isEqualTo(FitResult.Status.FITTED);
        assertThat(fit.rSquared).isGreaterThan(0.99);
        assertThat(fit.wave).containsExactly(s.wave);

        int peakA = SyntheticSpectra.argMax(fit.lines, 0, 40);
        int peakB = SyntheticSpectra.argMax(fit.lines, 41, 100);
        assertThat(Math.abs(fit.wave[peakA] - LINE_A)).isLessThanOrEqualTo(1.0);
        assertThat(Math.abs(fit.wave[peakB] - LINE_B)).isLessThanOrEqualTo(1.0);
        assertThat(fit.lines[peakA]).isCloseTo(AMP_A, within(0.05 * AMP_A));
        assertThat(fit.lines[peakB]).isCloseTo(AMP_B, within(0.05 * AMP_B));

        for (int i = 0; i < s.length(); i++) {
            assertThat(fit.continuum[i]).isCloseTo(SyntheticSpectra.continuum(s.wave[i]), within(1e-6));
            assertThat(fit.continuum[i] + fit.lines[i] + fit.residual[i]).isCloseTo(s.flux[i], within(1e-9));
        }
    }

    @Test
    void everyThirdSampleMissingStillFits() {
        Spectrum full = SyntheticSpectra.twoLines();
        double[] flux = full.flux.clone();
        for (int i = 0; i < flux.length; i += 3) flux[i] = i % 2 == 0 ? Double.NaN : Double.POSITIVE_INFINITY;
        Spectrum holed = new Spectrum(full.wave, flux, full.sigma, full.disp);

        FitResult fit = service.fit(holed, 4, new double[]{LINE_A, LINE_B});

        int kept = 100 - 34;
        assertThat(fit.wave).hasSize(kept);
        assertThat(fit.lines).hasSize(kept);
        assertThat(fit.continuum).hasSize(kept);
        assertThat(fit.residual).hasSize(kept);
        assertThat(Double.isFinite(fit.rSquared)).isTrue();
        assertThat(fit.rSquared).isGreaterThan(0.99);
        for (int i = 0; i < kept; i++) {
            assertThat(Double.isFinite(fit.lines[i] + fit.continuum[i] + fit.residual[i])).isTrue();
        }
    }

    @Test
    void lineOutsideBandDoesNotBreakFit() {
        Spectrum s = SyntheticSpectra.twoLines();

        FitResult fit = service.fit(s, 4, new double[]{LINE_A, LINE_B, 8000.0});

        assertThat(fit.rSquared).isGreaterThan(0.99);
        assertThat(fit.lines[SyntheticSpectra.argMax(fit.lines, 0, 40)]).isCloseTo(AMP_A, within(0.05 * AMP_A));
    }
}
