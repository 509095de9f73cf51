package com.airglow.service;

import com.airglow.model.BatchSummary;
import com.airglow.model.FitRecord;
import com.airglow.model.PlateBatch;
import com.airglow.model.SpectrumMetadata;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class PlateProcessingService {

    private static final Logger log = LoggerFactory.getLogger(PlateProcessingService.class);

    private final PlateFileService plateFiles;
    private final FitOutputService output;
    private final PlateFitService fitter;
    private final Map<Integer, List<SpectrumMetadata>> metadata;
    private final File saveDir;

    public PlateProcessingService(PlateFitService fitter, Map<Integer, List<SpectrumMetadata>> metadata, File saveDir) {
        this(new PlateFileService(), new FitOutputService(), fitter, metadata, saveDir);
    }

    public PlateProcessingService(PlateFileService plateFiles, FitOutputService output, PlateFitService fitter,
                                  Map<Integer, List<SpectrumMetadata>> metadata, File saveDir) {
        this.plateFiles = plateFiles;
        this.output = output;
        this.fitter = fitter;
        this.metadata = metadata;
        this.saveDir = saveDir;
    }

    /** Plate files in the directory that have no output file yet, sorted by name. */
    public List<File> pendingPlates(File spectraDir) throws IOException {
        File[] files = spectraDir.listFiles((d, name) -> name.endsWith(".fits") || name.endsWith(".fit"));
        if (files == null) throw new IOException("Spectra directory not readable: " + spectraDir);
        Arrays.sort(files);

        List<File> pending = new ArrayList<>();
        for (File f : files) {
            if (!FitOutputService.outputFile(saveDir, PlateFileService.plateIdOf(f)).exists()) pending.add(f);
        }
        log.info("Will be analyzing {} plate files ({} already done)", pending.size(), files.length - pending.size());
        return pending;
    }

    public BatchSummary run(List<File> plates, boolean parallel, int poolSize) throws InterruptedException {
        AtomicInteger completed = new AtomicInteger(0);
        AtomicInteger noMeta = new AtomicInteger(0);
        AtomicInteger failed = new AtomicInteger(0);

        if (!parallel) {
            for (File f : plates) runOne(f, completed, noMeta, failed);
        } else {
            ExecutorService exec = Executors.newFixedThreadPool(Math.max(1, poolSize));
            try {
                Map<File, Future<?>> tasks = new LinkedHashMap<>();
                for (File f : plates) tasks.put(f, exec.submit(() -> runOne(f, completed, noMeta, failed)));
                exec.shutdown();
                // No per-plate deadline: a stalled fit holds its worker until it finishes.
                while (!exec.awaitTermination(1, TimeUnit.HOURS)) {
                    log.info("Still fitting: {} of {} plates done", completed.get() + noMeta.get() + failed.get(), plates.size());
                }
                // runOne handles Exceptions; anything left here is an Error
                for (Map.Entry<File, Future<?>> t : tasks.entrySet()) {
                    try {
                        t.getValue().get();
                    } catch (ExecutionException e) {
                        failed.incrementAndGet();
                        log.error("Plate file {} died, no output written", t.getKey().getName(), e.getCause());
                    }
                }
            } finally {
                exec.shutdownNow();
            }
        }

        BatchSummary summary = new BatchSummary(completed.get(), noMeta.get(), failed.get());
        log.info("Batch finished: {}", summary);
        return summary;
    }

    private void runOne(File f, AtomicInteger completed, AtomicInteger noMeta, AtomicInteger failed) {
        try {
            if (processPlate(f) != null) completed.incrementAndGet();
            else noMeta.incrementAndGet();
        } catch (Exception e) {
            failed.incrementAndGet();
            log.error("Plate file {} failed, no output written", f.getName(), e);
        }
    }

    /** Fits one plate and writes its output; returns null when the plate has no metadata rows. */
    public File processPlate(File plateFile) throws IOException, FitsException {
        int plate = PlateFileService.plateIdOf(plateFile);
        List<SpectrumMetadata> rows = metadata.getOrDefault(plate, Collections.emptyList());
        if (rows.isEmpty()) {
            log.warn("No metadata rows for plate {}, skipping {}", plate, plateFile.getName());
            return null;
        }

        log.info("Fitting spectra in plate {}", plate);
        PlateBatch batch = plateFiles.read(plateFile);
        List<FitRecord> records = fitter.fitPlate(batch, rows);
        File out = output.write(saveDir, plate, records);
        log.info("Plate {} done: {} fits written to {}", plate, records.size(), out.getName());
        return out;
    }
}
