package hydroqc.io;

import hydroqc.domain.exception.RasterFormatException;
import hydroqc.domain.grid.AffineTransform;
import hydroqc.domain.grid.CoordinateReference;
import hydroqc.domain.grid.CrsUnits;
import hydroqc.domain.grid.DepthGrid;
import hydroqc.domain.grid.GeoBounds;
import hydroqc.domain.grid.GridMetadata;
import hydroqc.domain.grid.GridStatistics;
import hydroqc.domain.grid.LoadedGrid;
import hydroqc.geo.CrsTransformer;
import lombok.extern.slf4j.Slf4j;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Carga una rejilla de profundidades desde un GeoTIFF de una sola banda.
 * <p>
 * <b>Georreferenciación</b>, por orden de preferencia:
 * <ol>
 * <li>ModelTransformation (matriz 4×4).</li>
 * <li>ModelPixelScale + ModelTiepoint (norte arriba).</li>
 * <li>Sin etiquetas: transformación unitaria, con aviso.</li>
 * </ol>
 * Si el tipo de ráster es PixelIsPoint, el origen se desplaza medio píxel para que
 * la transformación describa siempre esquinas de píxel.
 * <p>
 * <b>Sin dato:</b> el valor de GDAL_NODATA (o el indicado explícitamente) y los
 * valores no finitos pasan a {@code NaN}.
 * <p>
 * <b>Envolvente:</b> si el CRS no es geográfico se reproyecta solo la envolvente a
 * WGS84 para visualización. Un fallo no es fatal; una envolvente fuera del rango
 * geográfico se informa como desconocida.
 */
@Slf4j
public class GeoTiffGridLoader {

    private final CrsTransformer crsTransformer;

    public GeoTiffGridLoader() {
        this(new CrsTransformer());
    }

    public GeoTiffGridLoader(CrsTransformer crsTransformer) {
        this.crsTransformer = Objects.requireNonNull(crsTransformer, "El transformador de CRS no puede ser nulo.");
    }

    public LoadedGrid load(Path path) throws IOException {
        return load(path, null);
    }

    /**
     * Carga la rejilla, sus metadatos y sus estadísticas.
     *
     * @param path           Ruta del GeoTIFF.
     * @param nodataOverride Centinela de "sin dato" que sustituye al del fichero, o {@code null}.
     * @return La rejilla cargada.
     * @throws FileNotFoundException Si el fichero no existe.
     * @throws RasterFormatException Si el fichero no es un GeoTIFF legible de una banda.
     */
    public LoadedGrid load(Path path, Double nodataOverride) throws IOException {
        Objects.requireNonNull(path, "La ruta del ráster no puede ser nula.");
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Raster file not found: " + path.toAbsolutePath()
                    + ". The stored dataset may have been moved or deleted.");
        }
        log.info("Cargando rejilla batimétrica desde {}", path.toAbsolutePath());

        // 1. Lectura del primer directorio
        FileDirectory directory;
        try {
            TIFFImage image = TiffReader.readTiff(path.toFile());
            List<FileDirectory> directories = image.getFileDirectories();
            if (directories == null || directories.isEmpty()) {
                throw new RasterFormatException("El TIFF no contiene ningún directorio de imagen: " + path);
            }
            directory = directories.get(0);
        } catch (RasterFormatException e) {
            log.error("Formato de ráster inválido en {}", path.toAbsolutePath(), e);
            throw e;
        } catch (FileNotFoundException e) {
            throw e;
        } catch (IOException | TiffException | IllegalArgumentException | IndexOutOfBoundsException e) {
            log.error("Error fatal al leer el ráster {}", path.toAbsolutePath(), e);
            throw new RasterFormatException("No se pudo leer el ráster " + path.toAbsolutePath() + ": " + e.getMessage(), e);
        }
        return decode(directory, path, nodataOverride);
    }

    /**
     * Interpreta un directorio TIFF ya leído. Cualquier etiqueta ausente o mal tipada
     * termina en {@link RasterFormatException}.
     */
    LoadedGrid decode(FileDirectory directory, Path path, Double nodataOverride) throws RasterFormatException {
        try {
            int width = directory.getImageWidth().intValue();
            int height = directory.getImageHeight().intValue();
            if (width <= 0 || height <= 0) {
                throw new RasterFormatException("Dimensiones de ráster inválidas: " + width + "x" + height);
            }

            // 2. Georreferenciación y CRS
            GeoKeys geoKeys = GeoKeys.parse(directory);
            CoordinateReference crs = geoKeys.toCoordinateReference();
            AffineTransform transform = readTransform(directory, geoKeys.pixelIsPoint(), path);

            // 3. Centinela de "sin dato"
            Double nodata = nodataOverride != null ? nodataOverride : readNodata(directory);

            // 4. Muestras de la primera banda
            Rasters rasters = directory.readRasters();
            if (rasters.getSamplesPerPixel() > 1) {
                log.warn("El ráster {} tiene {} bandas; solo se usa la primera.", path.getFileName(), rasters.getSamplesPerPixel());
            }
            double[] depths = new double[width * height];
            for (int row = 0; row < height; row++) {
                for (int col = 0; col < width; col++) {
                    Number sample = rasters.getFirstPixelSample(col, row);
                    depths[row * width + col] = sample == null ? Double.NaN : sample.doubleValue();
                }
            }

            DepthGrid grid = new DepthGrid(width, height, depths, transform, crs, nodata);
            GridMetadata metadata = GridMetadata.builder()
                    .crs(crs)
                    .wgs84Bounds(resolveBounds(grid).orElse(null))
                    .width(width)
                    .height(height)
                    .transform(transform)
                    .nodataValue(nodata)
                    .build();
            GridStatistics statistics = GridStatistics.of(grid);
            log.info("Rejilla cargada: {}x{}, CRS {}, {} celdas válidas ({} sin dato).",
                    width, height, crs, statistics.validCount(), statistics.nodataCount());
            return new LoadedGrid(grid, metadata, statistics);
        } catch (RasterFormatException e) {
            log.error("Formato de ráster inválido en {}", path.toAbsolutePath(), e);
            throw e;
        } catch (TiffException | IllegalArgumentException | IndexOutOfBoundsException
                 | NullPointerException | ClassCastException e) {
            // Las etiquetas ausentes o mal tipadas llegan como excepciones de tiempo de ejecución.
            log.error("Error fatal al interpretar el ráster {}", path.toAbsolutePath(), e);
            throw new RasterFormatException("No se pudo interpretar el ráster " + path.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    private AffineTransform readTransform(FileDirectory directory, boolean pixelIsPoint, Path path) {
        Optional<double[]> matrix = GeoTiffTags.doubles(directory, GeoTiffTags.MODEL_TRANSFORMATION);
        if (matrix.isPresent() && matrix.get().length >= 8) {
            double[] m = matrix.get();
            double c = m[3];
            double f = m[7];
            if (pixelIsPoint) {
                c -= 0.5 * m[0] + 0.5 * m[1];
                f -= 0.5 * m[4] + 0.5 * m[5];
            }
            return new AffineTransform(m[0], m[1], c, m[4], m[5], f);
        }

        Optional<double[]> scale = GeoTiffTags.doubles(directory, GeoTiffTags.MODEL_PIXEL_SCALE);
        Optional<double[]> tiepoint = GeoTiffTags.doubles(directory, GeoTiffTags.MODEL_TIEPOINT);
        if (scale.isPresent() && tiepoint.isPresent() && scale.get().length >= 2 && tiepoint.get().length >= 6) {
            double sx = scale.get()[0];
            double sy = scale.get()[1];
            double[] tie = tiepoint.get();
            double originX = tie[3] - tie[0] * sx;
            double originY = tie[4] + tie[1] * sy;
            if (pixelIsPoint) {
                originX -= 0.5 * sx;
                originY += 0.5 * sy;
            }
            return new AffineTransform(sx, 0.0, originX, 0.0, -sy, originY);
        }

        log.warn("El ráster {} no tiene georreferenciación; se usa la transformación unitaria [1, 0, 0, 0, -1, 0].",
                path.getFileName());
        return AffineTransform.unitNorthUp();
    }

    private Double readNodata(FileDirectory directory) {
        Optional<String> text = GeoTiffTags.ascii(directory, GeoTiffTags.GDAL_NODATA);
        if (text.isEmpty() || text.get().isEmpty()) {
            return null;
        }
        String raw = text.get();
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            log.warn("Valor GDAL_NODATA no numérico ('{}'); se ignora.", raw);
            return null;
        }
    }

    private Optional<GeoBounds> resolveBounds(DepthGrid grid) {
        GeoBounds bounds;
        if (grid.crs().isGeographic()) {
            bounds = GeoBounds.ofGrid(grid.transform(), grid.width(), grid.height());
        } else {
            bounds = crsTransformer.gridBoundsToWgs84(grid.transform(), grid.width(), grid.height(), grid.crs())
                    .orElseGet(() -> {
                        log.debug("No se pudo reproyectar la envolvente; se usan los límites de origen.");
                        return GeoBounds.ofGrid(grid.transform(), grid.width(), grid.height());
                    });
        }
        if (!bounds.isWithinGeographicRange()) {
            log.warn("La envolvente [{}, {}, {}, {}] no está en rango geográfico; se informa como desconocida.",
                    bounds.minX(), bounds.minY(), bounds.maxX(), bounds.maxY());
            return Optional.empty();
        }
        return Optional.of(bounds);
    }

    /**
     * Claves relevantes del directorio GeoKey.
     */
    record GeoKeys(Integer modelType, Integer rasterType, Integer geographicEpsg, Integer projectedEpsg) {

        static GeoKeys parse(FileDirectory directory) {
            Optional<double[]> values = GeoTiffTags.doubles(directory, GeoTiffTags.GEO_KEY_DIRECTORY);
            if (values.isEmpty() || values.get().length < 4) {
                return new GeoKeys(null, null, null, null);
            }
            double[] keys = values.get();
            int count = (int) keys[3];
            Integer modelType = null;
            Integer rasterType = null;
            Integer geographic = null;
            Integer projected = null;
            for (int k = 0, idx = 4; k < count && idx + 3 < keys.length; k++, idx += 4) {
                int keyId = (int) keys[idx];
                int location = (int) keys[idx + 1];
                int value = (int) keys[idx + 3];
                if (location != 0) {
                    // Valor guardado en otra etiqueta (double/ascii): no lo necesitamos.
                    continue;
                }
                switch (keyId) {
                    case GeoTiffTags.KEY_MODEL_TYPE -> modelType = value;
                    case GeoTiffTags.KEY_RASTER_TYPE -> rasterType = value;
                    case GeoTiffTags.KEY_GEOGRAPHIC_TYPE -> geographic = value;
                    case GeoTiffTags.KEY_PROJECTED_CS_TYPE -> projected = value;
                    default -> {
                    }
                }
            }
            return new GeoKeys(modelType, rasterType, geographic, projected);
        }

        boolean pixelIsPoint() {
            return rasterType != null && rasterType == GeoTiffTags.RASTER_PIXEL_IS_POINT;
        }

        CoordinateReference toCoordinateReference() {
            CrsUnits units = CrsUnits.UNKNOWN;
            if (modelType != null) {
                if (modelType == GeoTiffTags.MODEL_TYPE_GEOGRAPHIC) {
                    units = CrsUnits.DEGREES;
                } else if (modelType == GeoTiffTags.MODEL_TYPE_PROJECTED || modelType == GeoTiffTags.MODEL_TYPE_GEOCENTRIC) {
                    units = CrsUnits.METERS;
                }
            }
            Integer epsg = null;
            if (projectedEpsg != null && projectedEpsg > 0 && projectedEpsg != GeoTiffTags.USER_DEFINED) {
                epsg = projectedEpsg;
                if (units == CrsUnits.UNKNOWN) {
                    units = CrsUnits.METERS;
                }
            } else if (geographicEpsg != null && geographicEpsg > 0 && geographicEpsg != GeoTiffTags.USER_DEFINED) {
                epsg = geographicEpsg;
                if (units == CrsUnits.UNKNOWN) {
                    units = CrsUnits.DEGREES;
                }
            }
            return new CoordinateReference(epsg, units);
        }
    }
}
