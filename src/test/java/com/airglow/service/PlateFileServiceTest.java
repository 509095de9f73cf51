package com.airglow.service;

import com.airglow.model.PlateBatch;
import com.airglow.model.Spectrum;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.BufferedFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlateFileServiceTest {

    @TempDir
    Path dir;

    private final PlateFileService service = new PlateFileService();

    @Test
    void plateIdIsFirstLongDigitRun() {
        assertThat(PlateFileService.plateIdOf(new File("sky_flux_0266_b1.fits"))).isEqualTo(266);
        assertThat(PlateFileService.plateIdOf(new File("spFrame-10023.fits"))).isEqualTo(10023);
        assertThatThrownBy(() -> PlateFileService.plateIdOf(new File("sky_b1.fits")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsSpectraWrittenAsImageExtensions() throws IOException, FitsException {
        Spectrum s0 = SyntheticSpectra.twoLines();
        double[] flux = s0.flux.clone();
        flux[5] = Double.NaN;
        Spectrum s1 = new Spectrum(s0.wave, flux, s0.sigma, s0.disp);
        File f = dir.resolve("sky_flux_0266.fits").toFile();

        service.write(new PlateBatch(266, List.of(s0, s1)), f);
        PlateBatch back = service.read(f);

        assertThat(back.plate).isEqualTo(266);
        assertThat(back.size()).isEqualTo(2);
        assertThat(back.spectrum(0).wave).containsExactly(s0.wave);
        assertThat(back.spectrum(0).flux).containsExactly(s0.flux);
        assertThat(back.spectrum(1).disp).containsExactly(s0.disp);
        assertThat(Double.isNaN(back.spectrum(1).flux[5])).isTrue();
        assertThat(back.spectrum(1).clean().length()).isEqualTo(99);
    }

    @Test
    void integerAndFloatImagesAreWidened() throws FitsException {
        double[][] f = PlateFileService.toDouble(new float[][]{{1.5f, 2f}, {3f, 4f}}, "SKY");
        assertThat(f[0]).containsExactly(1.5, 2.0);
        assertThat(f[1]).containsExactly(3.0, 4.0);

        assertThat(PlateFileService.toDouble(new long[][]{{7L, -2L}}, "SKY")[0]).containsExactly(7.0, -2.0);
        assertThat(PlateFileService.toDouble(new byte[][]{{(byte) 200, 3}}, "SKY")[0]).containsExactly(200.0, 3.0);
    }

    @Test
    void nonTwoDimensionalKernelIsRejected() {
        assertThatThrownBy(() -> PlateFileService.toDouble(new double[]{1, 2}, "WAVE"))
            .isInstanceOf(FitsException.class)
            .hasMessageContaining("WAVE")
            .hasMessageContaining("double[]");
        assertThatThrownBy(() -> PlateFileService.toDouble(null, "DISP"))
            .isInstanceOf(FitsException.class)
            .hasMessageContaining("DISP");
    }

    @Test
    void cubeExtensionFailsTheRead() throws IOException, FitsException {
        File f = dir.resolve("sky_flux_0777.fits").toFile();
        try (Fits fits = new Fits()) {
            fits.addHDU(BasicHDU.getDummyHDU());
            for (String name : new String[]{"WAVE", "SKY", "SIGMA", "DISP"}) {
                BasicHDU<?> hdu = Fits.makeHDU(new double[2][3][4]);
                hdu.getHeader().addValue("EXTNAME", name, "spectrum array");
                fits.addHDU(hdu);
            }
            try (BufferedFile out = new BufferedFile(f, "rw")) {
                fits.write(out);
            }
        }

        assertThatThrownBy(() -> service.read(f))
            .isInstanceOf(FitsException.class)
            .hasMessageContaining("sky_flux_0777.fits[")
            .hasMessageContaining("double[][][]");
    }

    @Test
    void missingSpectrumNumberIsAnError() {
        PlateBatch batch = new PlateBatch(1, List.of(SyntheticSpectra.twoLines()));
        assertThatThrownBy(() -> batch.spectrum(1)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
