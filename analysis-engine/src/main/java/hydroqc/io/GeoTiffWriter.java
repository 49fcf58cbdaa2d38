package hydroqc.io;

import hydroqc.domain.grid.AffineTransform;
import hydroqc.domain.grid.CoordinateReference;
import hydroqc.domain.grid.CrsUnits;
import hydroqc.domain.grid.DepthGrid;
import lombok.extern.slf4j.Slf4j;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import mil.nga.tiff.util.TiffException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Escribe rásteres de una banda en GeoTIFF float32 comprimido con deflate.
 * <p>
 * La georreferenciación se escribe como ModelPixelScale + ModelTiepoint cuando la
 * transformación es norte-arriba sin rotación, y como ModelTransformation en otro
 * caso. El CRS se escribe en el directorio GeoKey y el centinela en GDAL_NODATA.
 */
@Slf4j
public class GeoTiffWriter {

    /**
     * Escribe una superficie en float32.
     *
     * @param path      Fichero de destino (se sobrescribe; los directorios padre se crean).
     * @param width     Columnas.
     * @param height    Filas.
     * @param values    Valores por filas; {@code NaN} se sustituye por {@code nodata}.
     * @param transform Transformación píxel → mundo.
     * @param crs       Sistema de referencia.
     * @param nodata    Centinela de "sin dato".
     * @throws IOException Si falla la escritura.
     */
    public void writeFloat32(Path path, int width, int height, double[] values,
                             AffineTransform transform, CoordinateReference crs, double nodata) throws IOException {
        Objects.requireNonNull(path, "La ruta de destino no puede ser nula.");
        Objects.requireNonNull(values, "Los valores no pueden ser nulos.");
        if (values.length != width * height) {
            throw new IllegalArgumentException("Los valores no coinciden con la forma " + width + "x" + height);
        }
        log.info("Escribiendo GeoTIFF float32 {}x{} en {}", width, height, path.toAbsolutePath());

        // 1. Muestras
        Rasters rasters = new Rasters(width, height, 1, FieldType.FLOAT);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                double v = values[row * width + col];
                float sample = Double.isNaN(v) ? (float) nodata : (float) v;
                rasters.setFirstPixelSample(col, row, sample);
            }
        }

        // 2. Directorio de imagen
        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(FieldType.FLOAT.getBits());
        directory.setCompression(TiffConstants.COMPRESSION_DEFLATE);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);
        directory.setWriteRasters(rasters);

        // 3. Etiquetas GeoTIFF
        addGeoreferencing(directory, transform);
        addGeoKeys(directory, crs);
        addAscii(directory, GeoTiffTags.GDAL_NODATA, formatNodata(nodata));

        TIFFImage image = new TIFFImage();
        image.add(directory);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            TiffWriter.writeTiff(path.toFile(), image);
            log.debug("GeoTIFF escrito correctamente: {}", path.getFileName());
        } catch (IOException e) {
            log.error("Error fatal al escribir el GeoTIFF en {}", path.toAbsolutePath(), e);
            throw e;
        } catch (TiffException e) {
            log.error("Error de codificación TIFF al escribir {}", path.toAbsolutePath(), e);
            throw new IOException("No se pudo codificar el GeoTIFF " + path.toAbsolutePath(), e);
        }
    }

    /**
     * Escribe una rejilla de profundidades con su propio centinela (o -9999 si no tiene).
     */
    public void writeGrid(Path path, DepthGrid grid) throws IOException {
        double nodata = grid.nodataValue() != null ? grid.nodataValue() : -9999.0;
        writeFloat32(path, grid.width(), grid.height(), grid.depths(), grid.transform(), grid.crs(), nodata);
    }

    private void addGeoreferencing(FileDirectory directory, AffineTransform t) {
        if (t.b() == 0.0 && t.d() == 0.0 && t.e() < 0.0) {
            addDoubles(directory, GeoTiffTags.MODEL_PIXEL_SCALE, List.of(t.a(), -t.e(), 0.0));
            addDoubles(directory, GeoTiffTags.MODEL_TIEPOINT, List.of(0.0, 0.0, 0.0, t.c(), t.f(), 0.0));
        } else {
            addDoubles(directory, GeoTiffTags.MODEL_TRANSFORMATION, List.of(
                    t.a(), t.b(), 0.0, t.c(),
                    t.d(), t.e(), 0.0, t.f(),
                    0.0, 0.0, 0.0, 0.0,
                    0.0, 0.0, 0.0, 1.0));
        }
    }

    private void addGeoKeys(FileDirectory directory, CoordinateReference crs) {
        List<Integer> keys = new ArrayList<>();
        if (crs.units() == CrsUnits.METERS) {
            addKey(keys, GeoTiffTags.KEY_MODEL_TYPE, GeoTiffTags.MODEL_TYPE_PROJECTED);
        } else if (crs.units() == CrsUnits.DEGREES) {
            addKey(keys, GeoTiffTags.KEY_MODEL_TYPE, GeoTiffTags.MODEL_TYPE_GEOGRAPHIC);
        }
        addKey(keys, GeoTiffTags.KEY_RASTER_TYPE, GeoTiffTags.RASTER_PIXEL_IS_AREA);
        if (crs.epsg() != null) {
            int key = crs.isGeographic() ? GeoTiffTags.KEY_GEOGRAPHIC_TYPE : GeoTiffTags.KEY_PROJECTED_CS_TYPE;
            addKey(keys, key, crs.epsg());
        }
        List<Integer> directoryValues = new ArrayList<>(List.of(1, 1, 0, keys.size() / 4));
        directoryValues.addAll(keys);
        Optional<FieldTagType> tag = GeoTiffTags.tagById(GeoTiffTags.GEO_KEY_DIRECTORY);
        if (tag.isEmpty()) {
            log.warn("La librería TIFF no reconoce GeoKeyDirectory; el CRS no se escribirá.");
            return;
        }
        directory.addEntry(new FileDirectoryEntry(tag.get(), FieldType.SHORT, directoryValues.size(), directoryValues));
    }

    private static void addKey(List<Integer> keys, int keyId, int value) {
        keys.add(keyId);
        keys.add(0);
        keys.add(1);
        keys.add(value);
    }

    private void addDoubles(FileDirectory directory, int tagId, List<Double> values) {
        Optional<FieldTagType> tag = GeoTiffTags.tagById(tagId);
        if (tag.isEmpty()) {
            log.warn("La librería TIFF no reconoce la etiqueta {}; se omite.", tagId);
            return;
        }
        directory.addEntry(new FileDirectoryEntry(tag.get(), FieldType.DOUBLE, values.size(), new ArrayList<>(values)));
    }

    private void addAscii(FileDirectory directory, int tagId, String value) {
        Optional<FieldTagType> tag = GeoTiffTags.tagById(tagId);
        if (tag.isEmpty()) {
            log.warn("La librería TIFF no reconoce la etiqueta {}; se omite.", tagId);
            return;
        }
        List<String> values = new ArrayList<>();
        values.add(value);
        directory.addEntry(new FileDirectoryEntry(tag.get(), FieldType.ASCII, value.length() + 1, values));
    }

    private static String formatNodata(double nodata) {
        if (nodata == Math.rint(nodata) && Math.abs(nodata) < 1e15) {
            return Long.toString((long) nodata);
        }
        return Double.toString(nodata);
    }
}
