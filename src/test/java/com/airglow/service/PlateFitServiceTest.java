package com.airglow.service;

import com.airglow.model.AirglowLineLists;
import com.airglow.model.FitRecord;
import com.airglow.model.FitResult;
import com.airglow.model.PlateBatch;
import com.airglow.model.Spectrum;
import com.airglow.model.SpectrumMetadata;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlateFitServiceTest {

    private static final int PLATE = 266;

    private final AirglowLineLists lineLists = new AirglowLineLists(
        new double[]{SyntheticSpectra.LINE_A, SyntheticSpectra.LINE_B},
        new double[]{SyntheticSpectra.LINE_B});

    private static PlateBatch batchOf(int n) {
        List<Spectrum> spectra = new ArrayList<>();
        for (int i = 0; i < n; i++) spectra.add(SyntheticSpectra.twoLines());
        return new PlateBatch(PLATE, spectra);
    }

    private static List<SpectrumMetadata> rows(String... cameras) {
        List<SpectrumMetadata> rows = new ArrayList<>();
        for (int i = 0; i < cameras.length; i++) rows.add(new SpectrumMetadata(PLATE, i, cameras[i]));
        return rows;
    }

    @Test
    void routesEachCameraToItsBand() {
        PlateFitService service = new PlateFitService(lineLists, 10, 7L);

        FitRecord blue = service.fitOne(batchOf(2), new SpectrumMetadata(PLATE, 0, "b1"));
        FitRecord red = service.fitOne(batchOf(2), new SpectrumMetadata(PLATE, 1, "r2"));

        assertThat(blue.result.status).isEqualTo(FitResult.Status.FITTED);
        assertThat(blue.result.rSquared).isGreaterThan(0.99);
        assertThat(blue.plate).isEqualTo(PLATE);
        assertThat(blue.camera).isEqualTo("b1");
        assertThat(blue.specNo).isEqualTo(0);
        assertThat(blue.fitSeconds).isGreaterThanOrEqualTo(0.0);

        // Red list lacks the 5020 line, so that line stays in the residual
        assertThat(red.result.status).isEqualTo(FitResult.Status.FITTED);
        assertThat(red.result.rSquared).isLessThan(blue.result.rSquared);
        assertThat(red.specNo).isEqualTo(1);
    }

    @Test
    void unknownCameraGivesZeroRecordWithoutFitting() {
        PlateFitService service = new PlateFitService(lineLists, 10, 7L);

        // specno 99 does not exist: the spectrum must not even be looked up
        FitRecord r = service.fitOne(batchOf(1), new SpectrumMetadata(PLATE, 99, "z9"));

        assertThat(r.result.isDegenerate()).isTrue();
        assertThat(r.result.wave).containsExactly(0);
        assertThat(r.result.lines).containsExactly(0);
        assertThat(r.result.continuum).containsExactly(0);
        assertThat(r.result.residual).containsExactly(0);
        assertThat(r.result.rSquared).isEqualTo(0.0);
        assertThat(r.camera).isEqualTo("z9");
        assertThat(r.specNo).isEqualTo(99);
    }

    @Test
    void plateKeepsGoingPastUnknownCamera() {
        PlateFitService service = new PlateFitService(lineLists, 10, 1L);

        List<FitRecord> records = service.fitPlate(batchOf(3), rows("b2", "??", "r1"));

        assertThat(records).hasSize(3);
        assertThat(records.stream().filter(r -> r.result.isDegenerate()).count()).isEqualTo(1);
        assertThat(records.stream().map(r -> r.specNo).collect(Collectors.toSet())).containsExactlyInAnyOrder(0, 1, 2);
    }

    @Test
    void sampleIsBoundedAndDistinct() {
        PlateFitService service = new PlateFitService(lineLists, 10, 3L);
        List<SpectrumMetadata> plateRows = new ArrayList<>();
        for (int i = 0; i < 40; i++) plateRows.add(new SpectrumMetadata(PLATE, i, "b1"));

        List<SpectrumMetadata> picked = service.sample(plateRows, PLATE);

        assertThat(picked).hasSize(10);
        Set<Integer> ids = new HashSet<>();
        for (SpectrumMetadata m : picked) ids.add(m.specNo);
        assertThat(ids).hasSize(10);
    }

    @Test
    void seededSampleIsReproducible() {
        List<SpectrumMetadata> plateRows = new ArrayList<>();
        for (int i = 0; i < 40; i++) plateRows.add(new SpectrumMetadata(PLATE, i, "r1"));

        List<SpectrumMetadata> a = new PlateFitService(lineLists, 5, 42L).sample(plateRows, PLATE);
        List<SpectrumMetadata> b = new PlateFitService(lineLists, 5, 42L).sample(plateRows, PLATE);

        assertThat(a).extracting(m -> m.specNo).containsExactlyElementsOf(
            b.stream().map(m -> m.specNo).collect(Collectors.toList()));
    }

    @Test
    void smallPlateIsFullyCovered() {
        PlateFitService service = new PlateFitService(lineLists, 10, null);

        assertThat(service.sample(rows("b1", "b2", "r1"), PLATE)).hasSize(3);
    }

    @Test
    void rejectsNonPositiveSampleSize() {
        assertThatThrownBy(() -> new PlateFitService(lineLists, 0, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
