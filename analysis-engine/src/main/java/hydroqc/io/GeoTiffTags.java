package hydroqc.io;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Identificadores de etiquetas y claves GeoTIFF, y conversión tolerante de sus valores.
 * <p>
 * Las etiquetas se buscan por su número y no por el nombre de la constante, para no
 * depender de qué etiquetas enumera cada versión de la librería TIFF.
 */
final class GeoTiffTags {

    // --- Etiquetas TIFF ---
    static final int MODEL_PIXEL_SCALE = 33550;
    static final int MODEL_TIEPOINT = 33922;
    static final int MODEL_TRANSFORMATION = 34264;
    static final int GEO_KEY_DIRECTORY = 34735;
    static final int GDAL_NODATA = 42113;

    // --- Claves del directorio GeoKey ---
    static final int KEY_MODEL_TYPE = 1024;
    static final int KEY_RASTER_TYPE = 1025;
    static final int KEY_GEOGRAPHIC_TYPE = 2048;
    static final int KEY_PROJECTED_CS_TYPE = 3072;

    static final int MODEL_TYPE_PROJECTED = 1;
    static final int MODEL_TYPE_GEOGRAPHIC = 2;
    static final int MODEL_TYPE_GEOCENTRIC = 3;
    static final int RASTER_PIXEL_IS_AREA = 1;
    static final int RASTER_PIXEL_IS_POINT = 2;

    /**
     * Código reservado para CRS definidos por el usuario.
     */
    static final int USER_DEFINED = 32767;

    private GeoTiffTags() {
    }

    static Optional<FieldTagType> tagById(int id) {
        for (FieldTagType type : FieldTagType.values()) {
            if (type.getId() == id) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    static Optional<Object> values(FileDirectory directory, int tagId) {
        Set<FileDirectoryEntry> entries = directory.getEntries();
        if (entries == null) {
            entries = Collections.emptySet();
        }
        for (FileDirectoryEntry entry : entries) {
            if (entry.getFieldTag() != null && entry.getFieldTag().getId() == tagId) {
                return Optional.ofNullable(entry.getValues());
            }
        }
        return Optional.empty();
    }

    static Optional<double[]> doubles(FileDirectory directory, int tagId) {
        return values(directory, tagId).map(GeoTiffTags::toDoubleArray);
    }

    static Optional<String> ascii(FileDirectory directory, int tagId) {
        return values(directory, tagId).map(GeoTiffTags::toAscii);
    }

    static double[] toDoubleArray(Object value) {
        if (value instanceof Number number) {
            return new double[]{number.doubleValue()};
        }
        if (value instanceof List<?> list) {
            double[] out = new double[list.size()];
            for (int i = 0; i < list.size(); i++) {
                Object item = list.get(i);
                if (!(item instanceof Number number)) {
                    throw new IllegalArgumentException("Valor no numérico en etiqueta GeoTIFF: " + item);
                }
                out[i] = number.doubleValue();
            }
            return out;
        }
        if (value instanceof double[] array) {
            return array.clone();
        }
        if (value instanceof float[] array) {
            double[] out = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                out[i] = array[i];
            }
            return out;
        }
        if (value instanceof int[] array) {
            double[] out = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                out[i] = array[i];
            }
            return out;
        }
        throw new IllegalArgumentException("Tipo de valor GeoTIFF no soportado: " + value.getClass().getName());
    }

    static String toAscii(Object value) {
        if (value instanceof String text) {
            return stripNul(text);
        }
        if (value instanceof byte[] bytes) {
            return stripNul(new String(bytes, StandardCharsets.US_ASCII));
        }
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder();
            for (Object item : list) {
                sb.append(item);
            }
            return stripNul(sb.toString());
        }
        return stripNul(String.valueOf(value));
    }

    private static String stripNul(String text) {
        int nul = text.indexOf('\0');
        return (nul >= 0 ? text.substring(0, nul) : text).trim();
    }
}
