package com.airglow.service;

import com.airglow.model.AirglowLineLists;
import com.airglow.model.CameraArm;
import com.airglow.model.FitRecord;
import com.airglow.model.FitResult;
import com.airglow.model.PlateBatch;
import com.airglow.model.SpectrumMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

public class PlateFitService {

    private static final Logger log = LoggerFactory.getLogger(PlateFitService.class);

    private final SpectrumFitService fitService;
    private final AirglowLineLists lineLists;
    private final int maxPerPlate;
    private final Long seed;

    public PlateFitService(AirglowLineLists lineLists, int maxPerPlate, Long seed) {
        this(new SpectrumFitService(), lineLists, maxPerPlate, seed);
    }

    public PlateFitService(SpectrumFitService fitService, AirglowLineLists lineLists, int maxPerPlate, Long seed) {
        if (maxPerPlate <= 0) throw new IllegalArgumentException("maxPerPlate must be positive: " + maxPerPlate);
        this.fitService = fitService;
        this.lineLists = lineLists;
        this.maxPerPlate = maxPerPlate;
        this.seed = seed;
    }

    public List<FitRecord> fitPlate(PlateBatch batch, List<SpectrumMetadata> plateRows) {
        List<SpectrumMetadata> selected = sample(plateRows, batch.plate);
        List<FitRecord> records = new ArrayList<>(selected.size());

        for (int i = 0; i < selected.size(); i++) {
            SpectrumMetadata row = selected.get(i);
            log.info("Splitting spectrum {}/{} (specno {}) for plate {}", i + 1, selected.size(), row.specNo, batch.plate);
            records.add(fitOne(batch, row));
        }
        return records;
    }

    FitRecord fitOne(PlateBatch batch, SpectrumMetadata row) {
        long start = System.nanoTime();
        FitResult result;
        Optional<CameraArm> arm = CameraArm.fromTag(row.camera);
        if (arm.isPresent()) {
            CameraArm a = arm.get();
            result = fitService.fit(batch.spectrum(row.specNo), a.continuumTerms, lineLists.forArm(a));
        } else {
            log.warn("Don't recognize camera '{}' for plate {} specno {}, recording empty fit", row.camera, batch.plate, row.specNo);
            result = FitResult.degenerate();
        }
        double seconds = (System.nanoTime() - start) / 1e9;
        return new FitRecord(seconds, batch.plate, row.camera, row.specNo, result);
    }

    /** Up to maxPerPlate distinct rows, in random order. */
    List<SpectrumMetadata> sample(List<SpectrumMetadata> plateRows, int plate) {
        List<SpectrumMetadata> pool = new ArrayList<>(plateRows);
        Random rnd = seed == null ? new Random() : new Random(seed ^ plate);
        Collections.shuffle(pool, rnd);
        return pool.subList(0, Math.min(maxPerPlate, pool.size()));
    }
}
