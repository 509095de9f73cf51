package com.airglow.service;

import com.airglow.model.SpectrumMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MetadataService {

    private static final Logger log = LoggerFactory.getLogger(MetadataService.class);

    public Map<Integer, List<SpectrumMetadata>> loadByPlate(File f) throws IOException {
        Map<Integer, List<SpectrumMetadata>> byPlate = new LinkedHashMap<>();
        for (SpectrumMetadata row : load(f)) {
            byPlate.computeIfAbsent(row.plate, k -> new ArrayList<>()).add(row);
        }
        log.info("Got metadata for {} plates", byPlate.size());
        return byPlate;
    }

    public List<SpectrumMetadata> load(File f) throws IOException {
        List<String> lines = Files.readAllLines(f.toPath());
        List<SpectrumMetadata> rows = new ArrayList<>();
        int plateCol = -1, specCol = -1, camCol = -1;

        for (int n = 0; n < lines.size(); n++) {
            String l = lines.get(n).trim();
            if (l.isEmpty() || l.startsWith("#")) continue;
            String[] parts = l.split("\\s+");

            if (plateCol < 0) {
                List<String> header = Arrays.asList(parts);
                plateCol = header.indexOf("PLATE");
                specCol = header.indexOf("SPECNO");
                camCol = header.indexOf("CAMERAS");
                if (plateCol < 0 || specCol < 0 || camCol < 0) {
                    throw new IOException(f + ": header must contain PLATE, SPECNO and CAMERAS");
                }
                continue;
            }
            try {
                rows.add(new SpectrumMetadata(Integer.parseInt(parts[plateCol]), Integer.parseInt(parts[specCol]), parts[camCol]));
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                throw new IOException(f + ":" + (n + 1) + ": malformed metadata row '" + l + "'", e);
            }
        }
        return Collections.unmodifiableList(rows);
    }
}
