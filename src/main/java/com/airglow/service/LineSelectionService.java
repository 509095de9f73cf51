package com.airglow.service;

import com.airglow.model.AirglowLine;
import com.airglow.model.AirglowLineLists;
import com.airglow.model.LineBand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

public class LineSelectionService {

    private static final Logger log = LoggerFactory.getLogger(LineSelectionService.class);

    // Catalog is in nm, spectra grids are in Angstrom.
    static final double NM_TO_ANGSTROM = 10.0;

    private final WavelengthConversionService converter;

    public LineSelectionService() {
        this(new WavelengthConversionService());
    }

    public LineSelectionService(WavelengthConversionService converter) {
        this.converter = converter;
    }

    // vacuum Angstrom, catalog order
    public double[] select(List<AirglowLine> catalog, LineBand band) {
        double[] air = new double[catalog.size()];
        for (int i = 0; i < air.length; i++) air[i] = catalog.get(i).obsWave;
        double[] vac = converter.airToVacuum(air);

        double[] picked = new double[vac.length];
        int n = 0;
        for (int i = 0; i < vac.length; i++) {
            if (band.accepts(catalog.get(i).intensity, vac[i])) {
                picked[n++] = vac[i] * NM_TO_ANGSTROM;
            }
        }
        return Arrays.copyOf(picked, n);
    }

    public AirglowLineLists buildLineLists(List<AirglowLine> catalog) {
        double[] shortBand = select(catalog, LineBand.SHORT);
        double[] longBand = select(catalog, LineBand.LONG);
        log.info("Airglow catalog: {} lines, {} in short band, {} in long band",
            catalog.size(), shortBand.length, longBand.length);
        return new AirglowLineLists(shortBand, longBand);
    }
}
