package com.airglow.service;

import com.airglow.model.FitRecord;
import com.airglow.model.FitResult;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

// Primary HDU with PLATE/NFITS, then one binary table per record in fitting order.
public class FitOutputService {

    static final String[] COLUMNS = {"WAVE", "LINES", "CONT", "RESIDS"};

    public static File outputFile(File saveDir, int plate) {
        return new File(saveDir, plate + "_split_fit.fits");
    }

    public File write(File saveDir, int plate, List<FitRecord> records) throws IOException, FitsException {
        File out = outputFile(saveDir, plate);
        Files.deleteIfExists(out.toPath());

        try (Fits fits = new Fits()) {
            BasicHDU<?> primary = BasicHDU.getDummyHDU();
            primary.getHeader().addValue("PLATE", plate, "plate number");
            primary.getHeader().addValue("NFITS", records.size(), "number of fitted spectra");
            fits.addHDU(primary);

            for (FitRecord r : records) fits.addHDU(toTable(r));

            try (BufferedFile bf = new BufferedFile(out, "rw")) {
                fits.write(bf);
            }
        }
        return out;
    }

    private BinaryTableHDU toTable(FitRecord r) throws FitsException {
        FitResult fit = r.result;
        BinaryTable table = new BinaryTable(new Object[]{fit.wave, fit.lines, fit.continuum, fit.residual});
        BinaryTableHDU hdu = (BinaryTableHDU) Fits.makeHDU(table);
        for (int i = 0; i < COLUMNS.length; i++) hdu.setColumnName(i, COLUMNS[i], null);

        Header h = hdu.getHeader();
        h.addValue("PLATE", r.plate, "plate number");
        h.addValue("CAMERA", r.camera, "detector arm tag");
        h.addValue("SPECNO", r.specNo, "spectrum number in plate");
        // FITS cards cannot hold NaN/Inf
        boolean rsqValid = Double.isFinite(fit.rSquared);
        h.addValue("RSQVALID", rsqValid, "RSQUARED defined");
        if (rsqValid) h.addValue("RSQUARED", fit.rSquared, "coefficient of determination");
        h.addValue("FITTIME", r.fitSeconds, "fit wall time [s]");
        h.addValue("STATUS", fit.status.name(), "fit status");
        return hdu;
    }

    public List<FitRecord> read(File f) throws IOException, FitsException {
        List<FitRecord> records = new ArrayList<>();
        try (Fits fits = new Fits(f)) {
            BasicHDU<?>[] hdus = fits.read();
            for (int i = 1; i < hdus.length; i++) {
                BinaryTableHDU t = (BinaryTableHDU) hdus[i];
                Header h = t.getHeader();
                FitResult fit = new FitResult(
                    FitResult.Status.valueOf(h.getStringValue("STATUS").trim()),
                    (double[]) t.getColumn(COLUMNS[0]),
                    (double[]) t.getColumn(COLUMNS[1]),
                    (double[]) t.getColumn(COLUMNS[2]),
                    (double[]) t.getColumn(COLUMNS[3]),
                    h.getBooleanValue("RSQVALID", true) && h.containsKey("RSQUARED")
                        ? h.getDoubleValue("RSQUARED") : Double.NaN);
                records.add(new FitRecord(h.getDoubleValue("FITTIME"), h.getIntValue("PLATE"),
                    h.getStringValue("CAMERA").trim(), h.getIntValue("SPECNO"), fit));
            }
        }
        return records;
    }
}
