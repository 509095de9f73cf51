package com.airglow.service;

import com.airglow.model.DesignMatrix;
import com.airglow.model.FitResult;
import com.airglow.model.RegressionResult;
import com.airglow.model.SeparatedSpectrum;
import com.airglow.model.Spectrum;

public class SpectrumFitService {

    private final DesignMatrixService designService = new DesignMatrixService();
    private final RegressionService regressionService = new RegressionService();
    private final SeparationService separationService = new SeparationService();

    public FitResult fit(Spectrum spectrum, int continuumTerms, double[] vacuumLines) {
        Spectrum clean = spectrum.clean();

        DesignMatrix a = designService.build(clean.wave, clean.disp, vacuumLines, continuumTerms);
        RegressionResult reg = regressionService.fit(a, clean.flux);
        SeparatedSpectrum parts = separationService.separate(a, reg.coefficients, clean.flux);

        return new FitResult(FitResult.Status.FITTED, clean.wave, parts.lines, parts.continuum, parts.residual, reg.rSquared);
    }
}
