package com.airglow.service;

import com.airglow.model.DesignMatrix;
import com.airglow.model.RegressionResult;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// OLS through the SVD pseudo-inverse: empty columns (lines off the band) get coefficient 0.
public class RegressionService {

    private static final Logger log = LoggerFactory.getLogger(RegressionService.class);

    public RegressionResult fit(DesignMatrix design, double[] flux) {
        if (flux.length != design.rows()) {
            throw new IllegalArgumentException("Flux has " + flux.length + " samples, design matrix " + design.rows() + " rows");
        }
        if (design.columns() >= design.rows()) {
            throw new RankDeficientDesignException(design.rows(), design.columns());
        }

        RealMatrix a = MatrixUtils.createRealMatrix(design.data);
        RealVector y = new ArrayRealVector(flux, false);

        SingularValueDecomposition svd = new SingularValueDecomposition(a);
        RealVector params = svd.getSolver().solve(y);
        int rank = svd.getRank();
        if (rank < design.columns()) {
            log.debug("Design matrix rank {} < {} columns, using minimum-norm solution", rank, design.columns());
        }

        double[] model = a.operate(params).toArray();
        return new RegressionResult(params.toArray(), model, rSquared(flux, model), rank);
    }

    /** 1 - SSR/SST with SST taken about the observed mean; NaN when the flux is constant. */
    public double rSquared(double[] observed, double[] model) {
        double mean = 0;
        for (double v : observed) mean += v;
        mean /= observed.length;

        double ssr = 0, sst = 0;
        for (int i = 0; i < observed.length; i++) {
            double r = observed[i] - model[i];
            double d = observed[i] - mean;
            ssr += r * r;
            sst += d * d;
        }
        if (sst == 0) return Double.NaN;
        return 1.0 - ssr / sst;
    }
}
