package com.airglow.main;

import com.airglow.model.AirglowLine;
import com.airglow.model.AirglowLineLists;
import com.airglow.model.AppConfig;
import com.airglow.model.BatchSummary;
import com.airglow.model.SpectrumMetadata;
import com.airglow.service.AirglowCatalogService;
import com.airglow.service.LineSelectionService;
import com.airglow.service.MetadataService;
import com.airglow.service.PlateFitService;
import com.airglow.service.PlateProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;
import java.util.Map;

public class SkySplitApp {

    private static final Logger log = LoggerFactory.getLogger(SkySplitApp.class);

    public static void main(String[] args) throws Exception {
        File spectraDir = new File(AppConfig.getSpectraDir());
        File saveDir = new File(AppConfig.getSaveDir());
        if (!saveDir.isDirectory() && !saveDir.mkdirs()) {
            throw new IllegalStateException("Cannot create output directory " + saveDir);
        }

        // Inputs shared by all plates: loaded once, read-only afterwards.
        Map<Integer, List<SpectrumMetadata>> metadata = new MetadataService().loadByPlate(new File(AppConfig.getMetadataFile()));
        List<AirglowLine> catalog = new AirglowCatalogService().loadDirectory(new File(AppConfig.getAirglowDir()));
        AirglowLineLists lineLists = new LineSelectionService().buildLineLists(catalog);

        PlateFitService fitter = new PlateFitService(lineLists, AppConfig.getMaxSpectraPerPlate(), AppConfig.getSampleSeed());
        PlateProcessingService batch = new PlateProcessingService(fitter, metadata, saveDir);

        List<File> pending = batch.pendingPlates(spectraDir);
        BatchSummary summary = batch.run(pending, AppConfig.isParallel(), AppConfig.getPoolSize());
        log.info("Done: {}", summary);
    }
}
